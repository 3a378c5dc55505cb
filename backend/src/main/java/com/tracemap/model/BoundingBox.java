package com.tracemap.model;

import java.util.Objects;

import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned latitude/longitude box with inclusive edges.
 * Backed by a JTS {@link Envelope} where x is longitude and y is latitude.
 */
public final class BoundingBox {

    private final Envelope envelope;

    public BoundingBox(double minLat, double maxLat, double minLng, double maxLng) {
        if (minLat > maxLat || minLng > maxLng) {
            throw new IllegalArgumentException("bounding box min must not exceed max");
        }
        this.envelope = new Envelope(minLng, maxLng, minLat, maxLat);
    }

    public double getMinLat() {
        return envelope.getMinY();
    }

    public double getMaxLat() {
        return envelope.getMaxY();
    }

    public double getMinLng() {
        return envelope.getMinX();
    }

    public double getMaxLng() {
        return envelope.getMaxX();
    }

    public double latitudeSpan() {
        return envelope.getHeight();
    }

    public double longitudeSpan() {
        return envelope.getWidth();
    }

    public Coordinate center() {
        return new Coordinate((getMinLat() + getMaxLat()) / 2, (getMinLng() + getMaxLng()) / 2);
    }

    public boolean contains(Coordinate coordinate) {
        return envelope.covers(coordinate.getLongitude(), coordinate.getLatitude());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundingBox other)) {
            return false;
        }
        return envelope.equals(other.envelope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getMinLat(), getMaxLat(), getMinLng(), getMaxLng());
    }

    @Override
    public String toString() {
        return String.format("[lat %.5f..%.5f, lng %.5f..%.5f]", getMinLat(), getMaxLat(), getMinLng(), getMaxLng());
    }
}
