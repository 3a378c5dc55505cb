package com.tracemap.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracemap.geo.GeohashCodec;
import com.tracemap.model.Coordinate;
import com.tracemap.model.TraceRecord;
import com.tracemap.util.GeoValidator;

/**
 * Typed decode of one {@code traces} row. A row that cannot become a valid {@link TraceRecord}
 * maps to {@code null} and is counted; callers drop the nulls.
 */
public class TraceRowMapper implements RowMapper<TraceRecord> {

    private static final Logger log = LoggerFactory.getLogger(TraceRowMapper.class);

    private static final TypeReference<Map<String, String>> MEDIA_REFS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final AtomicLong decodeFailures = new AtomicLong();

    public TraceRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public TraceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("id");
        String name = rs.getString("name");
        String geohash = rs.getString("geohash");
        double lat = rs.getDouble("lat");
        boolean latMissing = rs.wasNull();
        double lng = rs.getDouble("lng");
        boolean lngMissing = rs.wasNull();
        Instant createdAt = toInstant(rs.getObject("created_at"));

        if (id == null || name == null || createdAt == null) {
            return reject(id, "missing id, name or created_at");
        }
        if (geohash == null || !GeohashCodec.isValid(geohash)) {
            return reject(id, "invalid geohash " + geohash);
        }
        if (latMissing || lngMissing || !GeoValidator.isValidCoordinate(lat, lng)) {
            return reject(id, "invalid coordinate");
        }

        Map<String, String> mediaRefs;
        try {
            mediaRefs = readMediaRefs(rs.getObject("media_refs"));
        } catch (Exception e) {
            return reject(id, "undecodable media_refs: " + e.getMessage());
        }
        return new TraceRecord(id, name, new Coordinate(lat, lng), geohash, mediaRefs, createdAt);
    }

    public long decodeFailures() {
        return decodeFailures.get();
    }

    private Map<String, String> readMediaRefs(Object raw) throws Exception {
        String json = null;
        if (raw instanceof PGobject pg) {
            json = pg.getValue();
        } else if (raw instanceof String s) {
            json = s;
        }
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, MEDIA_REFS);
    }

    private static Instant toInstant(Object raw) {
        if (raw instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (raw instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    private TraceRecord reject(String id, String reason) {
        long failures = decodeFailures.incrementAndGet();
        log.warn("Skipping trace row {}: {} ({} decode failures so far)", id, reason, failures);
        return null;
    }
}
