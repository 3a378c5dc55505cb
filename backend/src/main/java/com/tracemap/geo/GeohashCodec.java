package com.tracemap.geo;

import java.util.Arrays;

import com.tracemap.model.BoundingBox;
import com.tracemap.model.Coordinate;
import com.tracemap.util.GeoValidator;

/**
 * Base-32 geohash encoding.
 *
 * <p>Bits alternate longitude, latitude, longitude, ... starting from the whole world
 * ([-180, 180] x [-90, 90]); each bit halves the remaining interval and five bits make one
 * symbol. A geohash of precision P therefore names one rectangular cell, and the geohash
 * of a point at precision P is always a prefix of its geohash at any finer precision.
 *
 * <p>That prefix property is what lets a plain string range query stand in for a spatial
 * one: {@code geohash >= prefix AND geohash < upperBound(prefix)} selects exactly the
 * records stored inside the cell named by {@code prefix}.
 */
public final class GeohashCodec {

    public static final int MIN_PRECISION = 1;
    public static final int MAX_PRECISION = 12;

    /**
     * Sorts after every geohash symbol in plain code-point order.
     */
    public static final char RANGE_SENTINEL = '~';

    private static final char[] BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz".toCharArray();

    private static final int[] BASE32_INV = new int['z' + 1];

    static {
        Arrays.fill(BASE32_INV, -1);
        for (int i = 0; i < BASE32.length; i++) {
            BASE32_INV[BASE32[i]] = i;
        }
    }

    private GeohashCodec() {
    }

    public static String encode(Coordinate coordinate, int precision) {
        return encode(coordinate.getLatitude(), coordinate.getLongitude(), precision);
    }

    public static String encode(double latitude, double longitude, int precision) {
        checkPrecision(precision);
        if (!GeoValidator.isValidCoordinate(latitude, longitude)) {
            throw new IllegalArgumentException("coordinate out of range: " + latitude + ", " + longitude);
        }

        double minLat = -90.0;
        double maxLat = 90.0;
        double minLng = -180.0;
        double maxLng = 180.0;

        char[] out = new char[precision];
        boolean lngBit = true;
        for (int i = 0; i < precision; i++) {
            int symbol = 0;
            for (int bit = 0; bit < 5; bit++) {
                symbol <<= 1;
                if (lngBit) {
                    double mid = (minLng + maxLng) / 2;
                    if (longitude >= mid) {
                        symbol |= 1;
                        minLng = mid;
                    } else {
                        maxLng = mid;
                    }
                } else {
                    double mid = (minLat + maxLat) / 2;
                    if (latitude >= mid) {
                        symbol |= 1;
                        minLat = mid;
                    } else {
                        maxLat = mid;
                    }
                }
                lngBit = !lngBit;
            }
            out[i] = BASE32[symbol];
        }
        return new String(out);
    }

    /**
     * Exact bounds of the cell named by {@code geohash}. Lower edges are inclusive, upper
     * edges exclusive except on the +90/+180 world boundary.
     */
    public static BoundingBox decodeBounds(String geohash) {
        if (!isValid(geohash)) {
            throw new IllegalArgumentException("not a geohash: " + geohash);
        }
        double minLat = -90.0;
        double maxLat = 90.0;
        double minLng = -180.0;
        double maxLng = 180.0;

        boolean lngBit = true;
        for (int i = 0; i < geohash.length(); i++) {
            int symbol = BASE32_INV[geohash.charAt(i)];
            for (int shift = 4; shift >= 0; shift--) {
                boolean high = ((symbol >> shift) & 1) == 1;
                if (lngBit) {
                    double mid = (minLng + maxLng) / 2;
                    if (high) {
                        minLng = mid;
                    } else {
                        maxLng = mid;
                    }
                } else {
                    double mid = (minLat + maxLat) / 2;
                    if (high) {
                        minLat = mid;
                    } else {
                        maxLat = mid;
                    }
                }
                lngBit = !lngBit;
            }
        }
        return new BoundingBox(minLat, maxLat, minLng, maxLng);
    }

    /**
     * Cell dimensions at {@code precision}, from the bit split alone: longitude takes
     * ceil(5P/2) bits and latitude floor(5P/2).
     */
    public static CellSize cellSize(int precision) {
        checkPrecision(precision);
        int totalBits = 5 * precision;
        int lngBits = (totalBits + 1) / 2;
        int latBits = totalBits / 2;
        return new CellSize(precision, 180.0 / (1L << latBits), 360.0 / (1L << lngBits));
    }

    /**
     * Exclusive upper bound of the range holding every geohash that starts with {@code prefix}.
     */
    public static String upperBound(String prefix) {
        return prefix + RANGE_SENTINEL;
    }

    public static boolean isValid(String geohash) {
        if (geohash == null || geohash.isEmpty() || geohash.length() > MAX_PRECISION) {
            return false;
        }
        for (int i = 0; i < geohash.length(); i++) {
            char c = geohash.charAt(i);
            if (c >= BASE32_INV.length || BASE32_INV[c] < 0) {
                return false;
            }
        }
        return true;
    }

    private static void checkPrecision(int precision) {
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                "precision must be between " + MIN_PRECISION + " and " + MAX_PRECISION + ", got " + precision);
        }
    }
}
