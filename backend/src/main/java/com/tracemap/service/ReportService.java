package com.tracemap.service;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tracemap.dto.ReportDto;
import com.tracemap.dto.ReportRequest;
import com.tracemap.exception.TraceNotFoundException;
import com.tracemap.model.Trace;
import com.tracemap.model.TraceReport;
import com.tracemap.repository.TraceReportRepository;
import com.tracemap.repository.TraceRepository;
import com.tracemap.util.TraceIds;

@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    static final String DEFAULT_DESCRIPTION = "No description provided";

    private final TraceRepository traceRepository;
    private final TraceReportRepository reportRepository;

    public ReportService(TraceRepository traceRepository, TraceReportRepository reportRepository) {
        this.traceRepository = traceRepository;
        this.reportRepository = reportRepository;
    }

    /**
     * Files a moderation report. The report keeps its own copy of the trace's name and location
     * so it stays readable after the trace is removed.
     */
    @Transactional
    public ReportDto submit(String traceId, ReportRequest request) {
        if (request.getCategory() == null) {
            throw new IllegalArgumentException("category is required");
        }
        UUID id = TraceIds.parse(traceId);
        Trace trace = traceRepository.findById(id).orElseThrow(() -> new TraceNotFoundException(traceId));

        TraceReport report = new TraceReport();
        report.setTraceId(trace.getId());
        report.setTraceName(trace.getName());
        report.setLatitude(trace.getLat());
        report.setLongitude(trace.getLng());
        report.setGeohash(trace.getGeohash());
        report.setCategory(request.getCategory());
        String description = request.getDescription();
        report.setDescription(description == null || description.isBlank() ? DEFAULT_DESCRIPTION : description.trim());

        TraceReport saved = reportRepository.save(report);
        log.info("Report {} filed against trace {} as {}", saved.getId(), traceId, saved.getCategory());
        return ReportDto.from(saved);
    }
}
