package io.stagewise.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagewise.adapter.langchain4j.ModelSpec;
import org.junit.jupiter.api.Test;

class ModelChainsTest {

    @Test
    void shouldParseNamesWithOptionalTemperature() {
        assertThat(ModelChains.parse("claude-3-5-sonnet-latest:0.5, gpt-4o:0.1 ,o4-mini"))
                .containsExactly(
                        ModelSpec.of("claude-3-5-sonnet-latest", 0.5),
                        ModelSpec.of("gpt-4o", 0.1),
                        ModelSpec.of("o4-mini"));
    }

    @Test
    void shouldIgnoreEmptyEntries() {
        assertThat(ModelChains.parse("o3,,")).containsExactly(ModelSpec.of("o3"));
    }

    @Test
    void shouldRejectEmptyChain() {
        assertThatThrownBy(() -> ModelChains.parse(" , "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    void shouldRejectInvalidTemperature() {
        assertThatThrownBy(() -> ModelChains.parse("gpt-4o:warm"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("warm");
    }
}
