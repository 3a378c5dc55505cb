package com.tracemap.service;

import com.tracemap.model.BoundingBox;
import com.tracemap.model.Coordinate;

public class GeographicRegion {
    private String name;
    private double minLat;
    private double maxLat;
    private double minLng;
    private double maxLng;
    private double centerLat;
    private double centerLng;

    public String getName() {
        return name;
    }

    public double getMinLat() {
        return minLat;
    }

    public double getMaxLat() {
        return maxLat;
    }

    public double getMinLng() {
        return minLng;
    }

    public double getMaxLng() {
        return maxLng;
    }

    public double getCenterLat() {
        return centerLat;
    }

    public double getCenterLng() {
        return centerLng;
    }

    public BoundingBox boundingBox() {
        return new BoundingBox(minLat, maxLat, minLng, maxLng);
    }

    public Coordinate center() {
        return new Coordinate(centerLat, centerLng);
    }
}
