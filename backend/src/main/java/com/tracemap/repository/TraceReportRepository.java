package com.tracemap.repository;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tracemap.model.TraceReport;

public interface TraceReportRepository extends JpaRepository<TraceReport, UUID> {
}
