package io.stagewise.server.config;

import io.stagewise.adapter.langchain4j.ModelSpec;
import java.util.ArrayList;
import java.util.List;

/// Parses model chain properties such as `claude-3-5-sonnet-latest:0.5, gpt-4o:0.1, o4-mini`.
///
/// Entries are comma-separated and tried in order; `:temperature` is optional.
final class ModelChains {

    private ModelChains() {}

    /// @param value property value, not blank
    /// @return the chain, never empty
    /// @throws IllegalArgumentException if the value is blank or a temperature is not a number
    static List<ModelSpec> parse(String value) {
        List<ModelSpec> chain = new ArrayList<>();
        if (value != null) {
            for (String entry : value.split(",")) {
                String trimmed = entry.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                int colon = trimmed.lastIndexOf(':');
                if (colon < 0) {
                    chain.add(ModelSpec.of(trimmed));
                    continue;
                }
                String temperature = trimmed.substring(colon + 1).strip();
                try {
                    chain.add(ModelSpec.of(trimmed.substring(0, colon).strip(), Double.parseDouble(temperature)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                            "Invalid temperature '" + temperature + "' in model chain: " + value, e);
                }
            }
        }
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Model chain must not be empty");
        }
        return chain;
    }
}
