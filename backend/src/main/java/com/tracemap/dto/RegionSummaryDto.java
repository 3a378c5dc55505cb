package com.tracemap.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracemap.model.Coordinate;

public class RegionSummaryDto {

    private final String region;
    private final long count;
    private final Coordinate center;

    @JsonCreator
    public RegionSummaryDto(
        @JsonProperty("region") String region,
        @JsonProperty("count") long count,
        @JsonProperty("center") Coordinate center
    ) {
        this.region = region;
        this.count = count;
        this.center = center;
    }

    public String getRegion() {
        return region;
    }

    public long getCount() {
        return count;
    }

    public Coordinate getCenter() {
        return center;
    }
}
