package com.tracemap.util;

public final class GeoValidator {

    private GeoValidator() {
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lng) {
        return lng >= -180 && lng <= 180;
    }

    public static boolean isValidCoordinate(double lat, double lng) {
        return isValidLatitude(lat) && isValidLongitude(lng);
    }

    public static boolean isValidSpan(double latDelta, double lngDelta) {
        return Double.isFinite(latDelta) && Double.isFinite(lngDelta) && latDelta > 0 && lngDelta > 0;
    }

    public static double clampLatitude(double lat) {
        return Math.min(Math.max(lat, -90), 90);
    }

    public static double clampLongitude(double lng) {
        return Math.min(Math.max(lng, -180), 180);
    }
}
