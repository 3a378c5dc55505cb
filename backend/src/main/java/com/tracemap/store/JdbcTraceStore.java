package com.tracemap.store;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracemap.model.BoundingBox;
import com.tracemap.model.TraceRecord;

@Repository
public class JdbcTraceStore implements TraceStore {

    private static final String COLUMNS = "id::text as id, name, lat, lng, geohash, media_refs, created_at";

    // the geohash column is declared COLLATE "C", which keeps '~' after every geohash symbol
    private static final String RANGE_SQL = "select " + COLUMNS + " from traces"
        + " where geohash >= ? and geohash < ?"
        + " order by created_at desc limit ?";

    private static final String RECENT_SQL = "select " + COLUMNS + " from traces order by created_at desc limit ?";

    private static final String COUNT_SQL = "select count(*) from traces"
        + " where lat >= ? and lat <= ? and lng >= ? and lng <= ?";

    private final JdbcTemplate jdbcTemplate;
    private final TraceRowMapper rowMapper;

    public JdbcTraceStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.rowMapper = new TraceRowMapper(objectMapper);
    }

    @Override
    public List<TraceRecord> findByGeohashRange(String lowerInclusive, String upperExclusive, int limit) {
        try {
            return decoded(jdbcTemplate.query(RANGE_SQL, rowMapper, lowerInclusive, upperExclusive, limit));
        } catch (DataAccessException e) {
            throw new StoreQueryException("range query [" + lowerInclusive + ", " + upperExclusive + ") failed", e);
        }
    }

    @Override
    public List<TraceRecord> findRecent(int limit) {
        try {
            return decoded(jdbcTemplate.query(RECENT_SQL, rowMapper, limit));
        } catch (DataAccessException e) {
            throw new StoreQueryException("recent query failed", e);
        }
    }

    @Override
    public long countInBox(BoundingBox box) {
        try {
            Long count = jdbcTemplate.queryForObject(COUNT_SQL, Long.class,
                box.getMinLat(), box.getMaxLat(), box.getMinLng(), box.getMaxLng());
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new StoreQueryException("count query for " + box + " failed", e);
        }
    }

    public long decodeFailures() {
        return rowMapper.decodeFailures();
    }

    private static List<TraceRecord> decoded(List<TraceRecord> rows) {
        return rows.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }
}
