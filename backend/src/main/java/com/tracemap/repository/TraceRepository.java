package com.tracemap.repository;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tracemap.model.Trace;

public interface TraceRepository extends JpaRepository<Trace, UUID> {
}
