package com.tracemap.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracemap.model.TraceRecord;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class TraceRowMapperTest {

    private TraceRowMapper mapper;
    private ResultSet rs;

    @BeforeEach
    public void setUp() throws SQLException {
        mapper = new TraceRowMapper(new ObjectMapper());
        rs = mock(ResultSet.class);
        when(rs.getString("id")).thenReturn("0d7c4c3e-5a7e-4d4a-9f1b-3f1f4b8e2a10");
        when(rs.getString("name")).thenReturn("Canal at dusk");
        when(rs.getString("geohash")).thenReturn("u09tvw0f");
        when(rs.getDouble("lat")).thenReturn(48.8566);
        when(rs.getDouble("lng")).thenReturn(2.3522);
        when(rs.wasNull()).thenReturn(false);
        when(rs.getObject("created_at")).thenReturn(OffsetDateTime.of(2025, 7, 18, 9, 30, 0, 0, ZoneOffset.UTC));
        when(rs.getObject("media_refs")).thenReturn("{\"image\":\"images/canal.jpg\",\"audio\":\"audio/canal.m4a\"}");
    }

    @Test
    public void decodesACompleteRow() throws SQLException {
        TraceRecord record = mapper.mapRow(rs, 0);

        assertNotNull(record);
        assertEquals("Canal at dusk", record.getName());
        assertEquals(48.8566, record.getCoordinate().getLatitude());
        assertEquals("u09tvw0f", record.getGeohash());
        assertEquals(Map.of("image", "images/canal.jpg", "audio", "audio/canal.m4a"), record.getMediaRefs());
        assertEquals(Instant.parse("2025-07-18T09:30:00Z"), record.getCreatedAt());
        assertEquals(0, mapper.decodeFailures());
    }

    @Test
    public void readsJsonbAndTimestampColumns() throws SQLException {
        PGobject jsonb = new PGobject();
        jsonb.setType("jsonb");
        jsonb.setValue("{\"image\":\"images/x.jpg\"}");
        when(rs.getObject("media_refs")).thenReturn(jsonb);
        when(rs.getObject("created_at")).thenReturn(Timestamp.from(Instant.parse("2025-07-18T09:30:00Z")));

        TraceRecord record = mapper.mapRow(rs, 0);

        assertNotNull(record);
        assertEquals(Map.of("image", "images/x.jpg"), record.getMediaRefs());
        assertEquals(Instant.parse("2025-07-18T09:30:00Z"), record.getCreatedAt());
    }

    @Test
    public void missingMediaRefsIsAnEmptyMap() throws SQLException {
        when(rs.getObject("media_refs")).thenReturn(null);

        TraceRecord record = mapper.mapRow(rs, 0);

        assertNotNull(record);
        assertTrue(record.getMediaRefs().isEmpty());
    }

    @Test
    public void skipsRowWithBadGeohash() throws SQLException {
        when(rs.getString("geohash")).thenReturn("u09tvwa!");

        assertNull(mapper.mapRow(rs, 0));
        assertEquals(1, mapper.decodeFailures());
    }

    @Test
    public void skipsRowWithOutOfRangeCoordinate() throws SQLException {
        when(rs.getDouble("lat")).thenReturn(123.0);

        assertNull(mapper.mapRow(rs, 0));
        assertEquals(1, mapper.decodeFailures());
    }

    @Test
    public void skipsRowWithNullCoordinate() throws SQLException {
        when(rs.getDouble("lat")).thenReturn(0.0);
        when(rs.wasNull()).thenReturn(true, false);

        assertNull(mapper.mapRow(rs, 0));
        assertEquals(1, mapper.decodeFailures());
    }

    @Test
    public void skipsRowWithoutTimestamp() throws SQLException {
        when(rs.getObject("created_at")).thenReturn(null);

        assertNull(mapper.mapRow(rs, 0));
        assertEquals(1, mapper.decodeFailures());
    }

    @Test
    public void skipsRowWithUndecodableMediaRefs() throws SQLException {
        when(rs.getObject("media_refs")).thenReturn("[1, 2");

        assertNull(mapper.mapRow(rs, 0));
        assertNull(mapper.mapRow(rs, 1));
        assertEquals(2, mapper.decodeFailures());
    }
}
