package io.stagewise.core.pipeline;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Pipeline-wide configuration: stage overrides keyed by stage order.
///
/// {@snippet :
/// PipelineConfig config = PipelineConfig.builder()
///         .stage(2, StageOverrides.maxTurns(10))
///         .firstStageTurnLimitPolicy(TurnLimitPolicy.CONTINUE_TO_VALIDATION)
///         .build();
/// }
///
/// @param stageOverrides overrides by stage order, never null
public record PipelineConfig(Map<Integer, StageOverrides> stageOverrides) {

    public static final PipelineConfig DEFAULT = new PipelineConfig(Map.of());

    public PipelineConfig {
        stageOverrides = stageOverrides != null ? Map.copyOf(stageOverrides) : Map.of();
    }

    public StageOverrides overridesFor(int order) {
        return stageOverrides.getOrDefault(order, StageOverrides.NONE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<Integer, StageOverrides> overrides = new HashMap<>();

        private Builder() {}

        public Builder stage(int order, StageOverrides stageOverrides) {
            overrides.put(order, Objects.requireNonNull(stageOverrides, "stageOverrides must not be null"));
            return this;
        }

        /// Sets what happens when the objective stage exhausts its turn budget.
        public Builder firstStageTurnLimitPolicy(TurnLimitPolicy policy) {
            StageOverrides current = overrides.getOrDefault(1, StageOverrides.NONE);
            overrides.put(1, new StageOverrides(
                    current.maxMessageTurns(), current.checklist(), current.criticGuide(), policy));
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(overrides);
        }
    }
}
