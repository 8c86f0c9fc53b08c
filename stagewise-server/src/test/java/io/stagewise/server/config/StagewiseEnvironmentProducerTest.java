package io.stagewise.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.stagewise.adapter.langchain4j.ModelRoles;
import io.stagewise.adapter.langchain4j.ModelSpec;
import io.stagewise.core.StagewiseEnvironment;
import io.stagewise.core.pipeline.PipelineConfig;
import io.stagewise.core.pipeline.StageOverrides;
import io.stagewise.core.pipeline.TurnLimitPolicy;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StagewiseEnvironmentProducerTest {

    private StagewiseEnvironmentProducer producer;
    private Config config;

    @BeforeEach
    void setUp() {
        producer = new StagewiseEnvironmentProducer();
        config = mock(Config.class);
        producer.config = config;
    }

    @Nested
    class ExtractProperties {

        @Test
        void shouldExtractCredentialProperties() {
            when(config.getPropertyNames())
                    .thenReturn(List.of(
                            "stagewise.credentials.ANTHROPIC_API_KEY",
                            "stagewise.credentials.OPENAI_API_KEY",
                            "quarkus.http.port"));
            when(config.getOptionalValue("stagewise.credentials.ANTHROPIC_API_KEY", String.class))
                    .thenReturn(Optional.of("sk-ant-123"));
            when(config.getOptionalValue("stagewise.credentials.OPENAI_API_KEY", String.class))
                    .thenReturn(Optional.of("sk-openai-456"));

            Properties props = producer.extractCredentialProperties();

            assertThat(props)
                    .containsEntry("stagewise.credentials.ANTHROPIC_API_KEY", "sk-ant-123")
                    .containsEntry("stagewise.credentials.OPENAI_API_KEY", "sk-openai-456")
                    .doesNotContainKey("quarkus.http.port");
        }
    }

    @Nested
    class Models {

        @Test
        void shouldUseDefaultsWhenUnset() {
            assertThat(producer.modelRoles()).isEqualTo(ModelRoles.defaults());
        }

        @Test
        void shouldOverrideSingleRole() {
            when(config.getOptionalValue("stagewise.models.agent", String.class))
                    .thenReturn(Optional.of("gpt-4o:0.2"));

            ModelRoles roles = producer.modelRoles();

            assertThat(roles.agent()).containsExactly(ModelSpec.of("gpt-4o", 0.2));
            assertThat(roles.critics()).isEqualTo(ModelRoles.defaults().critics());
        }

        @Test
        void shouldRejectWrongCriticCount() {
            when(config.getOptionalValue("stagewise.models.critics", String.class))
                    .thenReturn(Optional.of("o3"));

            assertThatThrownBy(() -> producer.modelRoles())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("critic");
        }
    }

    @Nested
    class StageOverridesFromConfig {

        @Test
        void shouldReadPerStageOverrides() {
            when(config.getOptionalValue("stagewise.stages.4.max-turns", Integer.class))
                    .thenReturn(Optional.of(50));
            when(config.getOptionalValue("stagewise.stages.1.turn-limit-policy", String.class))
                    .thenReturn(Optional.of("continue_to_validation"));

            PipelineConfig pipelineConfig = producer.pipelineConfig();

            assertThat(pipelineConfig.overridesFor(4)).isEqualTo(StageOverrides.maxTurns(50));
            assertThat(pipelineConfig.overridesFor(1).turnLimitPolicy())
                    .isEqualTo(TurnLimitPolicy.CONTINUE_TO_VALIDATION);
            assertThat(pipelineConfig.overridesFor(2)).isEqualTo(StageOverrides.NONE);
        }
    }

    @Nested
    class Cleanup {

        @Test
        void shouldNotThrowWhenEnvironmentIsNull() {
            assertThatCode(() -> producer.cleanup()).doesNotThrowAnyException();
        }

        @Test
        void shouldCloseEnvironmentOnCleanup() throws Exception {
            StagewiseEnvironment env = mock(StagewiseEnvironment.class);
            var envField = StagewiseEnvironmentProducer.class.getDeclaredField("environment");
            envField.setAccessible(true);
            envField.set(producer, env);

            producer.cleanup();

            verify(env).close();
        }
    }
}
