package com.tracemap.dto;

import java.time.Instant;

import com.tracemap.session.MapSession;

public class SessionDto {
    private String id;
    private Instant createdAt;
    private Instant lastActivity;
    private long cyclesIssued;
    private long cyclesSkipped;

    public static SessionDto from(MapSession session) {
        SessionDto dto = new SessionDto();
        dto.id = session.getId();
        dto.createdAt = session.getCreatedAt();
        dto.lastActivity = session.getLastActivity();
        dto.cyclesIssued = session.getGate().getCyclesIssued();
        dto.cyclesSkipped = session.getGate().getCyclesSkipped();
        return dto;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public long getCyclesIssued() {
        return cyclesIssued;
    }

    public long getCyclesSkipped() {
        return cyclesSkipped;
    }
}
