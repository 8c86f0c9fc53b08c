package io.stagewise.adapter.langchain4j;

import java.util.Objects;

/// One model in a fallback chain.
///
/// @param modelName provider model name, e.g. `claude-3-5-sonnet-latest`, not null
/// @param temperature sampling temperature, null to leave the provider default (reasoning
///     models reject the parameter)
public record ModelSpec(String modelName, Double temperature) {

    public ModelSpec {
        Objects.requireNonNull(modelName, "modelName must not be null");
    }

    public static ModelSpec of(String modelName, double temperature) {
        return new ModelSpec(modelName, temperature);
    }

    /// A model used with the provider's default temperature.
    public static ModelSpec of(String modelName) {
        return new ModelSpec(modelName, null);
    }
}
