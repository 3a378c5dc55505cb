package com.tracemap.service;

import java.util.Set;

public final class CoveragePlan {

    private final CoverSet cover;
    private final FetchCaps caps;

    public CoveragePlan(CoverSet cover, FetchCaps caps) {
        this.cover = cover;
        this.caps = caps;
    }

    public Set<String> getPrefixes() {
        return cover.getPrefixes();
    }

    public int getPrecision() {
        return cover.getPrecision();
    }

    public int getPerCellLimit() {
        return caps.getPerCellLimit();
    }

    public CoverSet getCover() {
        return cover;
    }

    public FetchCaps getCaps() {
        return caps;
    }

    @Override
    public String toString() {
        return "CoveragePlan{precision=" + cover.getPrecision() + ", cells=" + cover.size()
            + ", truncated=" + cover.isTruncated() + ", " + caps + "}";
    }
}
