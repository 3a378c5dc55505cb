package com.tracemap.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read model of a stored trace. Immutable; identity is the store-assigned id.
 *
 * <p>{@code geohash} is the index key the writer computed at the fixed write precision.
 * It is carried as-is and never re-derived from {@code coordinate}.
 */
public final class TraceRecord {

    private final String id;
    private final String name;
    private final Coordinate coordinate;
    private final String geohash;
    private final Map<String, String> mediaRefs;
    private final Instant createdAt;

    @JsonCreator
    public TraceRecord(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("coordinate") Coordinate coordinate,
        @JsonProperty("geohash") String geohash,
        @JsonProperty("mediaRefs") Map<String, String> mediaRefs,
        @JsonProperty("createdAt") Instant createdAt
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.coordinate = Objects.requireNonNull(coordinate, "coordinate");
        this.geohash = geohash;
        this.mediaRefs = mediaRefs == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(mediaRefs));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    public String getGeohash() {
        return geohash;
    }

    public Map<String, String> getMediaRefs() {
        return mediaRefs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraceRecord other)) {
            return false;
        }
        return id.equals(other.id)
            && Objects.equals(name, other.name)
            && coordinate.equals(other.coordinate)
            && Objects.equals(geohash, other.geohash)
            && mediaRefs.equals(other.mediaRefs)
            && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "TraceRecord{id=" + id + ", name=" + name + ", at=" + coordinate + ", geohash=" + geohash + "}";
    }
}
