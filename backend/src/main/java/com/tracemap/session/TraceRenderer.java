package com.tracemap.session;

import java.util.List;

import com.tracemap.model.TraceRecord;

public interface TraceRenderer {

    void onFetchResult(List<TraceRecord> records);
}
