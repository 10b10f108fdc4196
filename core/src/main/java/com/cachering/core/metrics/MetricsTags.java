package com.cachering.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String RESULT = "result";

    /**
     * What started a discovery cycle.
     */
    public static final String TRIGGER = "trigger";

    /**
     * Node address ({@code host:port}).
     */
    public static final String NODE = "node";

    public static final String OPERATION = "operation";
}
