package io.github.eutro.ssadce.core.passes.opts;

import io.github.eutro.ssadce.core.passes.meta.LivenessAnalysis;

import java.util.Map;

/**
 * Tunables of {@link DeadCodeElimination}.
 */
public final class DceOptions {
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public static final String MAX_ITERATIONS_VAR = "SSADCE_MAX_ITERATIONS";
    public static final String MAX_LIVENESS_ITERATIONS_VAR = "SSADCE_MAX_LIVENESS_ITERATIONS";
    public static final String TRUST_PURE_CALLS_VAR = "SSADCE_TRUST_PURE_CALLS";
    public static final String RECORD_DECISIONS_VAR = "SSADCE_RECORD_DECISIONS";

    public static final DceOptions DEFAULT = builder().build();

    private final int maxIterations;
    private final int maxLivenessIterations;
    private final boolean trustPureCalls;
    private final boolean recordConservativeDecisions;

    private DceOptions(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.maxLivenessIterations = builder.maxLivenessIterations;
        this.trustPureCalls = builder.trustPureCalls;
        this.recordConservativeDecisions = builder.recordConservativeDecisions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read options from the environment, falling back to the defaults.
     *
     * @return The options.
     * @throws IllegalArgumentException If a variable is set to something invalid.
     */
    public static DceOptions fromEnvironment() {
        return fromEnv(System.getenv());
    }

    /**
     * Read options from a map of environment variables, falling back to the defaults.
     *
     * @param env The environment.
     * @return The options.
     * @throws IllegalArgumentException If a variable is set to something invalid.
     */
    public static DceOptions fromEnv(Map<String, String> env) {
        Builder builder = builder();
        String value;
        if ((value = env.get(MAX_ITERATIONS_VAR)) != null) {
            builder.maxIterations(parseInt(MAX_ITERATIONS_VAR, value));
        }
        if ((value = env.get(MAX_LIVENESS_ITERATIONS_VAR)) != null) {
            builder.maxLivenessIterations(parseInt(MAX_LIVENESS_ITERATIONS_VAR, value));
        }
        if ((value = env.get(TRUST_PURE_CALLS_VAR)) != null) {
            builder.trustPureCalls(parseBoolean(TRUST_PURE_CALLS_VAR, value));
        }
        if ((value = env.get(RECORD_DECISIONS_VAR)) != null) {
            builder.recordConservativeDecisions(parseBoolean(RECORD_DECISIONS_VAR, value));
        }
        return builder.build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        switch (value.trim().toLowerCase()) {
            case "1":
            case "true":
            case "yes":
            case "on":
                return true;
            case "0":
            case "false":
            case "no":
            case "off":
                return false;
            default:
                throw new IllegalArgumentException(name + " must be a boolean, got '" + value + "'");
        }
    }

    /**
     * Get the maximum number of rounds of the fixed-point loop.
     *
     * @return The limit.
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Get the maximum number of sweeps of the liveness dataflow in a single round.
     *
     * @return The limit.
     */
    public int getMaxLivenessIterations() {
        return maxLivenessIterations;
    }

    /**
     * Whether unused calls to callees that are known to be pure, and have a body, may be removed.
     *
     * @return Whether pure calls are trusted.
     */
    public boolean isTrustPureCalls() {
        return trustPureCalls;
    }

    public boolean isRecordConservativeDecisions() {
        return recordConservativeDecisions;
    }

    public Builder toBuilder() {
        return builder()
                .maxIterations(maxIterations)
                .maxLivenessIterations(maxLivenessIterations)
                .trustPureCalls(trustPureCalls)
                .recordConservativeDecisions(recordConservativeDecisions);
    }

    @Override
    public String toString() {
        return "DceOptions{maxIterations=" + maxIterations
                + ", maxLivenessIterations=" + maxLivenessIterations
                + ", trustPureCalls=" + trustPureCalls
                + ", recordConservativeDecisions=" + recordConservativeDecisions
                + "}";
    }

    public static final class Builder {
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private int maxLivenessIterations = LivenessAnalysis.DEFAULT_MAX_ITERATIONS;
        private boolean trustPureCalls = false;
        private boolean recordConservativeDecisions = true;

        private Builder() {
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations <= 0) {
                throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxLivenessIterations(int maxLivenessIterations) {
            if (maxLivenessIterations <= 0) {
                throw new IllegalArgumentException("maxLivenessIterations must be positive, got " + maxLivenessIterations);
            }
            this.maxLivenessIterations = maxLivenessIterations;
            return this;
        }

        public Builder trustPureCalls(boolean trustPureCalls) {
            this.trustPureCalls = trustPureCalls;
            return this;
        }

        public Builder recordConservativeDecisions(boolean recordConservativeDecisions) {
            this.recordConservativeDecisions = recordConservativeDecisions;
            return this;
        }

        public DceOptions build() {
            return new DceOptions(this);
        }
    }
}
