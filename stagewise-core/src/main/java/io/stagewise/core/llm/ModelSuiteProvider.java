package io.stagewise.core.llm;

import java.util.Map;

/// Creates the {@link ModelSuite} of an environment from provider credentials.
///
/// Core ships no provider; the langchain4j adapter module implements this interface.
@FunctionalInterface
public interface ModelSuiteProvider {

    /// Creates generators for every role.
    ///
    /// @param credentials API keys by name (e.g. `ANTHROPIC_API_KEY`), not null
    /// @return the suite, never null
    /// @throws IllegalStateException if no credentials are available for a required role
    ModelSuite create(Map<String, String> credentials);
}
