package com.tracemap.dto;

import com.tracemap.model.Viewport;

import jakarta.validation.constraints.NotNull;

public class ViewportRequest {

    @NotNull
    private Double lat;

    @NotNull
    private Double lng;

    @NotNull
    private Double latDelta;

    @NotNull
    private Double lngDelta;

    public Viewport toViewport() {
        return Viewport.of(lat, lng, latDelta, lngDelta);
    }

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLng() {
        return lng;
    }

    public void setLng(Double lng) {
        this.lng = lng;
    }

    public Double getLatDelta() {
        return latDelta;
    }

    public void setLatDelta(Double latDelta) {
        this.latDelta = latDelta;
    }

    public Double getLngDelta() {
        return lngDelta;
    }

    public void setLngDelta(Double lngDelta) {
        this.lngDelta = lngDelta;
    }
}
