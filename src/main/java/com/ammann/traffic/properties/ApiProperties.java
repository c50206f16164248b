/* (C)2026 */
package com.ammann.traffic.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * REST API path constants shared by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Alert analytics endpoints
     */
    public static final class Alerts {
        private Alerts() {}

        public static final String BASE = "/analytics/alerts";
        public static final String BY_HOUR = BASE + "/by-hour";
        public static final String HISTOGRAM = BASE + "/histogram";
        public static final String TOP_SOURCES = BASE + "/top-sources";
        public static final String COUNTS_BY_WINDOW = BASE + "/counts-by-window";
        public static final String ROLLING_COUNT = BASE + "/rolling-count";
        public static final String SCAN_BURSTS = BASE + "/scan-bursts";
        public static final String QUIET_PERIODS = BASE + "/quiet-periods";
        public static final String GAP_STATS = BASE + "/gap-stats";
        public static final String TOP_TARGETS = BASE + "/top-targets";
        public static final String TOP_PAIRS = BASE + "/top-pairs";
        public static final String HEAVIEST_FLOODS = BASE + "/heaviest-floods";
        public static final String RECENT = BASE + "/recent";
    }

    /**
     * Host traffic analytics endpoints
     */
    public static final class Hosts {
        private Hosts() {}

        public static final String BASE = "/analytics/hosts";
        public static final String TOP_BANDWIDTH = BASE + "/top-bandwidth";
        public static final String AVG_PACKET_SIZE = BASE + "/avg-packet-size";
        public static final String HEAVY_OUTGOING = BASE + "/heavy-outgoing";
        public static final String PORT_FANOUT = BASE + "/port-fanout";
        public static final String SOURCE_SPIKES = BASE + "/source-spikes";
        public static final String ROLLING_TOTAL = BASE + "/rolling-total";
        public static final String ROLLING_TOTAL_SERIES = ROLLING_TOTAL + "/series";
        public static final String HEATMAP = BASE + "/heatmap";
    }

    /**
     * Ingestion endpoints
     */
    public static final class Ingest {
        private Ingest() {}

        public static final String BASE = "/ingest";
        public static final String ALERTS = BASE + "/alerts";
        public static final String INTERVAL_STATS = BASE + "/interval-stats";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
