package com.tracemap.geo;

public final class CellSize {

    private final int precision;
    private final double latitudeHeight;
    // at the equator
    private final double longitudeWidth;

    CellSize(int precision, double latitudeHeight, double longitudeWidth) {
        this.precision = precision;
        this.latitudeHeight = latitudeHeight;
        this.longitudeWidth = longitudeWidth;
    }

    public int getPrecision() {
        return precision;
    }

    public double getLatitudeHeight() {
        return latitudeHeight;
    }

    public double getLongitudeWidth() {
        return longitudeWidth;
    }

    @Override
    public String toString() {
        return "CellSize{p=" + precision + ", lat=" + latitudeHeight + ", lng=" + longitudeWidth + "}";
    }
}
