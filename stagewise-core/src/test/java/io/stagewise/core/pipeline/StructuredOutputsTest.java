package io.stagewise.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagewise.core.llm.GenerationException;
import io.stagewise.core.state.ArtifactSelection;
import io.stagewise.core.state.ObjectiveAssessment;
import io.stagewise.core.state.ValidationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StructuredOutputsTest {

    @Test
    void shouldBindValidationWithLenientBoolean() {
        ValidationResult result = StructuredOutputs.VALIDATION.bind(Map.of(
                "chain_of_thought_summary", "- ok",
                "pass_the_validation", "True"));

        assertThat(result.passed()).isTrue();
        assertThat(result.message()).isEmpty();
    }

    @Test
    void shouldRejectMissingVerdict() {
        assertThatThrownBy(() -> StructuredOutputs.VALIDATION.bind(Map.of("chain_of_thought_summary", "- ok")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("pass_the_validation");
    }

    @Test
    void shouldRejectNonBooleanVerdict() {
        assertThatThrownBy(() -> StructuredOutputs.VALIDATION.bind(Map.of(
                        "chain_of_thought_summary", "- ok",
                        "pass_the_validation", "maybe")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("does not fit the schema");
    }

    @Test
    void shouldDropSelectionsWithoutKey() {
        List<ArtifactSelection> selections = StructuredOutputs.SELECTIONS.bind(Map.of("variable_list", List.of(
                Map.of("key", "df_clean", "description", "cleaned houses"),
                Map.of("key", " ", "description", "nothing"))));

        assertThat(selections).containsExactly(new ArtifactSelection("df_clean", "cleaned houses"));
    }

    @Test
    void shouldBindAssessment() {
        ObjectiveAssessment assessment = StructuredOutputs.ASSESSMENT.bind(Map.of(
                "chain_of_thought", "clear",
                "is_request_answerable", true,
                "is_request_specific", false,
                "message_to_user", "Which suburbs?"));

        assertThat(assessment.ready()).isFalse();
        assertThat(assessment.messageToUser()).isEqualTo("Which suburbs?");
    }
}
