package io.stagewise.core.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OutputSchemaTest {

    private record Pick(String key, boolean keep) {}

    private final OutputSchema<Pick> schema = new OutputSchema<>(
            "Pick",
            "A kept variable",
            List.of(
                    SchemaField.string("key", "Variable name"),
                    SchemaField.bool("keep", ""),
                    SchemaField.optionalString("note", "Anything else")),
            raw -> new Pick(StructuredValues.string(raw, "key"), StructuredValues.bool(raw, "keep")));

    @Nested
    class Bind {

        @Test
        void shouldBindCoercedValues() {
            Pick pick = schema.bind(Map.of("key", "df", "keep", "yes"));

            assertThat(pick).isEqualTo(new Pick("df", true));
        }

        @Test
        void shouldRejectMissingRequiredField() {
            assertThatThrownBy(() -> schema.bind(Map.of("key", "df")))
                    .isInstanceOf(GenerationException.class)
                    .hasMessage("Generated Pick is missing required field 'keep'");
        }

        @Test
        void shouldAllowMissingOptionalField() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("key", "df");
            raw.put("keep", false);
            raw.put("note", null);

            assertThat(schema.bind(raw).keep()).isFalse();
        }

        @Test
        void shouldWrapBinderTypeErrors() {
            assertThatThrownBy(() -> schema.bind(Map.of("key", "df", "keep", 7)))
                    .isInstanceOf(GenerationException.class)
                    .hasMessage("Generated Pick does not fit the schema")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class JsonSchema {

        @Test
        void shouldRenderPropertiesAndRequiredFields() {
            Map<String, Object> rendered = schema.toJsonSchema();

            assertThat(rendered)
                    .containsEntry("type", "object")
                    .containsEntry("title", "Pick")
                    .containsEntry("description", "A kept variable")
                    .containsEntry("required", List.of("key", "keep"));
            assertThat(rendered)
                    .extractingByKey("properties", MAP)
                    .containsOnlyKeys("key", "keep", "note")
                    .extractingByKey("keep", MAP)
                    .containsOnlyKeys("type");
        }

        @Test
        void shouldNestItemSchemaForObjectLists() {
            OutputSchema<Object> lists = new OutputSchema<>(
                    "Selection",
                    null,
                    List.of(SchemaField.objectList("items", "", SchemaField.string("key", "name"))),
                    raw -> raw);

            assertThat(lists.toJsonSchema())
                    .extractingByKey("properties", MAP)
                    .extractingByKey("items", MAP)
                    .containsEntry("type", "array")
                    .extractingByKey("items", MAP)
                    .containsEntry("type", "object")
                    .containsEntry("required", List.of("key"));
        }
    }

    @Test
    void shouldRejectSchemaWithoutFields() {
        assertThatThrownBy(() -> new OutputSchema<>("Empty", "", List.of(), raw -> raw))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
