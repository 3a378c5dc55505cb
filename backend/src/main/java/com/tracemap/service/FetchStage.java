package com.tracemap.service;

public enum FetchStage {
    PRIMARY,
    NEIGHBORS,
    GLOBAL_SAMPLE,
    EMPTY
}
