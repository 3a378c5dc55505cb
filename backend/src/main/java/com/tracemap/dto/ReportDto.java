package com.tracemap.dto;

import java.time.Instant;

import com.tracemap.model.TraceReport;

public class ReportDto {
    private String id;
    private String traceId;
    private String category;
    private String description;
    private Instant createdAt;

    public static ReportDto from(TraceReport report) {
        ReportDto dto = new ReportDto();
        dto.id = report.getId() != null ? report.getId().toString() : null;
        dto.traceId = report.getTraceId().toString();
        dto.category = report.getCategory().getLabel();
        dto.description = report.getDescription();
        dto.createdAt = report.getCreatedAt();
        return dto;
    }

    public String getId() {
        return id;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
