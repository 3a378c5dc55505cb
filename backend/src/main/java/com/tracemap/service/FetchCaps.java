package com.tracemap.service;

public final class FetchCaps {

    private final int maxPrefixes;
    private final int perCellLimit;

    public FetchCaps(int maxPrefixes, int perCellLimit) {
        if (maxPrefixes < 1 || perCellLimit < 1) {
            throw new IllegalArgumentException("fetch caps must be positive");
        }
        this.maxPrefixes = maxPrefixes;
        this.perCellLimit = perCellLimit;
    }

    public int getMaxPrefixes() {
        return maxPrefixes;
    }

    public int getPerCellLimit() {
        return perCellLimit;
    }

    @Override
    public String toString() {
        return "FetchCaps{maxPrefixes=" + maxPrefixes + ", perCellLimit=" + perCellLimit + "}";
    }
}
