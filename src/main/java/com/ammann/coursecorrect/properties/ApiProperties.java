/* (C)2026 */
package com.ammann.coursecorrect.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 *
 * <p>Organizes endpoints by functional area (conversion, venues, distribution, corrections,
 * results, health) to ensure consistent path naming.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Finish time conversion endpoints
     */
    public static final class Conversion {
        private Conversion() {}

        public static final String BASE = "/convert";
    }

    /**
     * Venue listing endpoints
     */
    public static final class Venues {
        private Venues() {}

        public static final String BASE = "/venues";
        public static final String STATISTICS = "/statistics";
    }

    /**
     * Finish time distribution endpoints
     */
    public static final class Distribution {
        private Distribution() {}

        public static final String BASE = "/distribution";
    }

    /**
     * Correction table and run endpoints
     */
    public static final class Corrections {
        private Corrections() {}

        public static final String BASE = "/corrections";
        public static final String RUNS = "/runs";
        public static final String RECOMPUTE = "/recompute";
    }

    /**
     * Stored result endpoints
     */
    public static final class Results {
        private Results() {}

        public static final String BASE = "/results";
        public static final String VENUES = "/venues";
    }
}
