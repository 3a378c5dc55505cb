package com.tracemap.service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class CoverSet {

    private final Set<String> prefixes;
    private final int precision;
    // floor precision still needed more cells than the cap allowed
    private final boolean truncated;

    public CoverSet(Set<String> prefixes, int precision, boolean truncated) {
        this.prefixes = Collections.unmodifiableSet(new LinkedHashSet<>(prefixes));
        this.precision = precision;
        this.truncated = truncated;
    }

    public Set<String> getPrefixes() {
        return prefixes;
    }

    public int getPrecision() {
        return precision;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public int size() {
        return prefixes.size();
    }
}
