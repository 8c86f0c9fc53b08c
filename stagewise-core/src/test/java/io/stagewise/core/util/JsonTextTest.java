package io.stagewise.core.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonTextTest {

    @Test
    void shouldWriteCompactJson() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("suburb", "Kew");
        value.put("prices", List.of(1, 2.5));
        value.put("note", null);

        assertThat(JsonText.write(value)).isEqualTo("{\"suburb\":\"Kew\",\"prices\":[1,2.5],\"note\":null}");
    }

    @Test
    void shouldIndentPrettyJson() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("a", List.of(true));
        value.put("b", Map.of());

        assertThat(JsonText.writePretty(value)).isEqualTo("{\n  \"a\": [\n    true\n  ],\n  \"b\": {}\n}");
    }

    @Test
    void shouldEscapeControlCharacters() {
        assertThat(JsonText.write("say \"hi\"\n\tback\\slash\u0001"))
                .isEqualTo("\"say \\\"hi\\\"\\n\\tback\\\\slash\\u0001\"");
    }

    @Test
    void shouldWriteMissingNumbersAsNaN() {
        assertThat(JsonText.write(Arrays.<Object>asList(Double.NaN, 1.5))).isEqualTo("[NaN,1.5]");
    }
}
