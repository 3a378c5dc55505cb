package com.tracemap.model;

import java.util.Objects;

public final class CoordinateSpan {

    private final double latitudeDelta;
    private final double longitudeDelta;

    public CoordinateSpan(double latitudeDelta, double longitudeDelta) {
        this.latitudeDelta = latitudeDelta;
        this.longitudeDelta = longitudeDelta;
    }

    public double getLatitudeDelta() {
        return latitudeDelta;
    }

    public double getLongitudeDelta() {
        return longitudeDelta;
    }

    public double maxDelta() {
        return Math.max(latitudeDelta, longitudeDelta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CoordinateSpan other)) {
            return false;
        }
        return Double.compare(latitudeDelta, other.latitudeDelta) == 0
            && Double.compare(longitudeDelta, other.longitudeDelta) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitudeDelta, longitudeDelta);
    }

    @Override
    public String toString() {
        return String.format("%.4f x %.4f", latitudeDelta, longitudeDelta);
    }
}
