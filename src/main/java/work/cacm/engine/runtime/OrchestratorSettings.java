package work.cacm.engine.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.cacm.engine.shared.DurationParser;
import work.cacm.engine.worker.WorkerLifecycleManager;

/**
 * Tunables of an {@link Orchestrator}.
 */
public record OrchestratorSettings(
    Optional<Duration> stepTimeout,
    int maxDelegationDepth,
    OutputConflictPolicy outputConflictPolicy
) {
    public static final String STEP_TIMEOUT_PROPERTY = "cacm.stepTimeout";
    public static final String MAX_DELEGATION_DEPTH_PROPERTY = "cacm.maxDelegationDepth";
    public static final String OUTPUT_CONFLICT_POLICY_PROPERTY = "cacm.outputConflictPolicy";

    public OrchestratorSettings {
        Objects.requireNonNull(stepTimeout, "stepTimeout");
        Objects.requireNonNull(outputConflictPolicy, "outputConflictPolicy");
        if (maxDelegationDepth < 0) {
            throw new IllegalArgumentException("maxDelegationDepth must be >= 0: " + maxDelegationDepth);
        }
        stepTimeout = stepTimeout.filter(timeout -> !timeout.isZero());
    }

    public static OrchestratorSettings defaults() {
        return builder().build();
    }

    /**
     * Reads {@code cacm.stepTimeout}, {@code cacm.maxDelegationDepth} and {@code cacm.outputConflictPolicy}; unset
     * properties keep their defaults.
     *
     * @throws IllegalArgumentException when a property is set to an unparseable value
     */
    public static OrchestratorSettings fromSystemProperties() {
        var builder = builder();
        var timeout = System.getProperty(STEP_TIMEOUT_PROPERTY);
        if (timeout != null) {
            builder.stepTimeout(DurationParser.parse(timeout));
        }
        var depth = System.getProperty(MAX_DELEGATION_DEPTH_PROPERTY);
        if (depth != null && !depth.isBlank()) {
            try {
                builder.maxDelegationDepth(Integer.parseInt(depth.trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + MAX_DELEGATION_DEPTH_PROPERTY + ": " + depth, ex);
            }
        }
        var policy = System.getProperty(OUTPUT_CONFLICT_POLICY_PROPERTY);
        if (policy != null) {
            builder.outputConflictPolicy(OutputConflictPolicy.parse(policy));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Optional<Duration> stepTimeout = Optional.empty();
        private int maxDelegationDepth = WorkerLifecycleManager.DEFAULT_MAX_DELEGATION_DEPTH;
        private OutputConflictPolicy outputConflictPolicy = OutputConflictPolicy.LAST_WRITE_WINS;

        public Builder stepTimeout(Optional<Duration> stepTimeout) {
            this.stepTimeout = stepTimeout == null ? Optional.empty() : stepTimeout;
            return this;
        }

        public Builder stepTimeout(Duration stepTimeout) {
            return stepTimeout(Optional.ofNullable(stepTimeout));
        }

        public Builder maxDelegationDepth(int maxDelegationDepth) {
            this.maxDelegationDepth = maxDelegationDepth;
            return this;
        }

        public Builder outputConflictPolicy(OutputConflictPolicy outputConflictPolicy) {
            this.outputConflictPolicy = outputConflictPolicy;
            return this;
        }

        public OrchestratorSettings build() {
            return new OrchestratorSettings(stepTimeout, maxDelegationDepth, outputConflictPolicy);
        }
    }
}
