package com.tracemap.session;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.tracemap.model.TraceRecord;

/**
 * Ids of what is currently on the map. A new result with the same ids, in any order, is dropped
 * so redundant fetches do not make the map flicker. Otherwise the whole list is replaced.
 *
 * <p>Not thread-safe: owned by one session's event loop.
 */
public class RenderedTraceCache {

    private Set<String> renderedIds = Collections.emptySet();
    private List<TraceRecord> rendered = Collections.emptyList();

    /**
     * @return true when {@code records} differs from what is rendered and has replaced it
     */
    public boolean offer(List<TraceRecord> records) {
        Set<String> ids = new LinkedHashSet<>();
        for (TraceRecord record : records) {
            ids.add(record.getId());
        }
        if (ids.equals(renderedIds)) {
            return false;
        }
        renderedIds = Collections.unmodifiableSet(ids);
        rendered = List.copyOf(records);
        return true;
    }

    public List<TraceRecord> current() {
        return rendered;
    }

    public Set<String> renderedIds() {
        return renderedIds;
    }
}
