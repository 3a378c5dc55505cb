package com.tracemap.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracemap.util.GeoValidator;

public final class Coordinate {

    private final double latitude;
    private final double longitude;

    @JsonCreator
    public Coordinate(@JsonProperty("latitude") double latitude, @JsonProperty("longitude") double longitude) {
        if (!GeoValidator.isValidCoordinate(latitude, longitude)) {
            throw new IllegalArgumentException("lat must be between -90 and 90, lng between -180 and 180");
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Builds a coordinate after pinning both axes into their valid ranges.
     */
    public static Coordinate clamped(double latitude, double longitude) {
        return new Coordinate(GeoValidator.clampLatitude(latitude), GeoValidator.clampLongitude(longitude));
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinate other)) {
            return false;
        }
        return Double.compare(latitude, other.latitude) == 0 && Double.compare(longitude, other.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude);
    }

    @Override
    public String toString() {
        return String.format("(%.6f, %.6f)", latitude, longitude);
    }
}
