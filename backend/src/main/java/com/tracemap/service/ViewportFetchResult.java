package com.tracemap.service;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracemap.model.TraceRecord;

/**
 * Outcome of one fetch cycle: the bbox-exact records, newest first, plus how they were found.
 * An empty result is a normal outcome; {@link #isDegraded()} tells a sparse region apart
 * from a cycle where every queried cell failed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ViewportFetchResult {

    private final List<TraceRecord> records;
    private final FetchStage stage;
    private final int precision;
    private final int cellsQueried;
    private final int cellsFailed;

    @JsonCreator
    public ViewportFetchResult(
        @JsonProperty("records") List<TraceRecord> records,
        @JsonProperty("stage") FetchStage stage,
        @JsonProperty("precision") int precision,
        @JsonProperty("cellsQueried") int cellsQueried,
        @JsonProperty("cellsFailed") int cellsFailed
    ) {
        this.records = records == null ? Collections.emptyList() : List.copyOf(records);
        this.stage = stage;
        this.precision = precision;
        this.cellsQueried = cellsQueried;
        this.cellsFailed = cellsFailed;
    }

    public List<TraceRecord> getRecords() {
        return records;
    }

    public FetchStage getStage() {
        return stage;
    }

    public int getPrecision() {
        return precision;
    }

    public int getCellsQueried() {
        return cellsQueried;
    }

    public int getCellsFailed() {
        return cellsFailed;
    }

    public boolean isDegraded() {
        return cellsQueried > 0 && cellsFailed == cellsQueried;
    }

    public int size() {
        return records.size();
    }

    @Override
    public String toString() {
        return "ViewportFetchResult{stage=" + stage + ", records=" + records.size() + ", precision=" + precision
            + ", cellsQueried=" + cellsQueried + ", cellsFailed=" + cellsFailed + "}";
    }
}
