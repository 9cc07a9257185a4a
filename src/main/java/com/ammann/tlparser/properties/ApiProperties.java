/* (C)2026 */
package com.ammann.tlparser.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Single formula endpoints
     */
    public static final class Formulas {
        private Formulas() {}

        public static final String BASE = "/formulas";
        public static final String EVALUATE = "/evaluate";
    }

    /**
     * Requirement batch endpoints
     */
    public static final class Requirements {
        private Requirements() {}

        public static final String BASE = "/requirements";
        public static final String DIGEST = "/digest";
        public static final String DIGEST_DOCUMENTS = DIGEST + "/documents";
        public static final String DIGEST_ROWS = DIGEST + "/rows";
    }
}
