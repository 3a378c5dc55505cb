package com.tracemap.model;

import java.util.Locale;
import java.util.Objects;

import com.tracemap.exception.InvalidViewportException;
import com.tracemap.util.GeoValidator;

/**
 * The visible map region: a center plus the degrees of latitude/longitude it spans.
 * Construction rejects out-of-range centers and non-positive spans; callers clamp first.
 */
public final class Viewport {

    private final Coordinate center;
    private final CoordinateSpan span;

    public Viewport(Coordinate center, CoordinateSpan span) {
        if (center == null || span == null) {
            throw new InvalidViewportException("center and span are required");
        }
        if (!GeoValidator.isValidSpan(span.getLatitudeDelta(), span.getLongitudeDelta())) {
            throw new InvalidViewportException("latDelta and lngDelta must be positive, got " + span);
        }
        this.center = center;
        this.span = span;
    }

    public static Viewport of(double lat, double lng, double latDelta, double lngDelta) {
        if (!GeoValidator.isValidCoordinate(lat, lng)) {
            throw new InvalidViewportException("lat must be between -90 and 90, lng between -180 and 180");
        }
        return new Viewport(new Coordinate(lat, lng), new CoordinateSpan(latDelta, lngDelta));
    }

    public Coordinate getCenter() {
        return center;
    }

    public CoordinateSpan getSpan() {
        return span;
    }

    /**
     * Box covered by this viewport, clamped to valid coordinate ranges. No antimeridian wrap.
     */
    public BoundingBox boundingBox() {
        double halfLat = span.getLatitudeDelta() / 2;
        double halfLng = span.getLongitudeDelta() / 2;
        return new BoundingBox(
            GeoValidator.clampLatitude(center.getLatitude() - halfLat),
            GeoValidator.clampLatitude(center.getLatitude() + halfLat),
            GeoValidator.clampLongitude(center.getLongitude() - halfLng),
            GeoValidator.clampLongitude(center.getLongitude() + halfLng)
        );
    }

    /**
     * Coarse identity of this viewport: center and span rounded to {@code decimals} places.
     * Two viewports with the same key are treated as the same fetch.
     */
    public String quantizedKey(int decimals) {
        String pattern = "%." + decimals + "f";
        return String.join(":",
            String.format(Locale.ROOT, pattern, center.getLatitude()),
            String.format(Locale.ROOT, pattern, center.getLongitude()),
            String.format(Locale.ROOT, pattern, span.getLatitudeDelta()),
            String.format(Locale.ROOT, pattern, span.getLongitudeDelta()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Viewport other)) {
            return false;
        }
        return center.equals(other.center) && span.equals(other.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(center, span);
    }

    @Override
    public String toString() {
        return "Viewport{center=" + center + ", span=" + span + "}";
    }
}
