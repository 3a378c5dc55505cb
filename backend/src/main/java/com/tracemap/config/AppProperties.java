package com.tracemap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Cache cache = new Cache();
    private final Index index = new Index();
    private final Fetch fetch = new Fetch();
    private final Gate gate = new Gate();
    private final Session session = new Session();

    public Cache getCache() {
        return cache;
    }

    public Index getIndex() {
        return index;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public Gate getGate() {
        return gate;
    }

    public Session getSession() {
        return session;
    }

    public static class Cache {
        private int viewportSeconds = 60;
        private int traceSeconds = 600;

        public int getViewportSeconds() {
            return viewportSeconds;
        }

        public void setViewportSeconds(int viewportSeconds) {
            this.viewportSeconds = viewportSeconds;
        }

        public int getTraceSeconds() {
            return traceSeconds;
        }

        public void setTraceSeconds(int traceSeconds) {
            this.traceSeconds = traceSeconds;
        }
    }

    /**
     * Geohash precisions shared by the writer and the reader.
     */
    public static class Index {
        private int writePrecision = 8;
        private int floorPrecision = 1;

        public int getWritePrecision() {
            return writePrecision;
        }

        public void setWritePrecision(int writePrecision) {
            this.writePrecision = writePrecision;
        }

        public int getFloorPrecision() {
            return floorPrecision;
        }

        public void setFloorPrecision(int floorPrecision) {
            this.floorPrecision = floorPrecision;
        }
    }

    public static class Fetch {
        private long cellTimeoutMs = 4000;
        private int globalSampleLimit = 50;
        private double worldScaleSpanDegrees = 20.0;
        private int queryThreads = 16;

        public long getCellTimeoutMs() {
            return cellTimeoutMs;
        }

        public void setCellTimeoutMs(long cellTimeoutMs) {
            this.cellTimeoutMs = cellTimeoutMs;
        }

        public int getGlobalSampleLimit() {
            return globalSampleLimit;
        }

        public void setGlobalSampleLimit(int globalSampleLimit) {
            this.globalSampleLimit = globalSampleLimit;
        }

        public double getWorldScaleSpanDegrees() {
            return worldScaleSpanDegrees;
        }

        public void setWorldScaleSpanDegrees(double worldScaleSpanDegrees) {
            this.worldScaleSpanDegrees = worldScaleSpanDegrees;
        }

        public int getQueryThreads() {
            return queryThreads;
        }

        public void setQueryThreads(int queryThreads) {
            this.queryThreads = queryThreads;
        }
    }

    public static class Gate {
        private long settleMillis = 200;
        private int keyDecimals = 3;

        public long getSettleMillis() {
            return settleMillis;
        }

        public void setSettleMillis(long settleMillis) {
            this.settleMillis = settleMillis;
        }

        public int getKeyDecimals() {
            return keyDecimals;
        }

        public void setKeyDecimals(int keyDecimals) {
            this.keyDecimals = keyDecimals;
        }
    }

    public static class Session {
        private long idleTimeoutSeconds = 900;
        private int maxLive = 500;

        public long getIdleTimeoutSeconds() {
            return idleTimeoutSeconds;
        }

        public void setIdleTimeoutSeconds(long idleTimeoutSeconds) {
            this.idleTimeoutSeconds = idleTimeoutSeconds;
        }

        public int getMaxLive() {
            return maxLive;
        }

        public void setMaxLive(int maxLive) {
            this.maxLive = maxLive;
        }
    }
}
