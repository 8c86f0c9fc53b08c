package io.stagewise.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.ExecutionError;
import io.stagewise.core.sandbox.SandboxOutput;
import io.stagewise.core.state.ArtifactKind;
import io.stagewise.core.state.Table;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionFormatterTest {

    @Nested
    class TruncateMiddle {

        @Test
        void shouldKeepShortText() {
            assertThat(ExecutionFormatter.truncateMiddle("short", 10)).isEqualTo("short");
        }

        @Test
        void shouldKeepHeadAndTailAroundMarker() {
            String text = "a".repeat(600) + "b".repeat(600);

            String truncated = ExecutionFormatter.truncateMiddle(text, 1000);

            assertThat(truncated)
                    .startsWith("a".repeat(500) + " ... [TRUNCATED, 200 chars omitted] ... ")
                    .endsWith("b".repeat(500));
        }
    }

    @Test
    void shouldTruncateLongTraceback() {
        ExecutionError error = new ExecutionError("KeyError", "'price'", "x".repeat(5000));

        String formatted = ExecutionFormatter.format(CodeExecution.failed(error));

        assertThat(formatted).startsWith("KeyError: 'price'\n\n<traceback>\n");
        assertThat(formatted).contains("[TRUNCATED, 4027 chars omitted]");
        assertThat(formatted).endsWith("x\n</traceback>");
        assertThat(formatted.length()).isLessThan(1100);
    }

    @Test
    void shouldKeepShortTracebackIntact() {
        ExecutionError error = new ExecutionError("NameError", "name 'df2' is not defined", "Traceback: line 1");

        assertThat(ExecutionFormatter.formatError(error))
                .isEqualTo("NameError: name 'df2' is not defined\n\n<traceback>\nTraceback: line 1\n</traceback>");
    }

    @Test
    void shouldWrapStreamsAndResults() {
        Table table = new Table(List.of("n"), List.of(List.of(1), List.of(2), List.of(3), List.of(4)));
        CodeExecution execution = new CodeExecution(
                "hello",
                "warning",
                List.of(new SandboxOutput(ArtifactKind.TABLE, table), new SandboxOutput(ArtifactKind.JSON, Map.of("a", 1))),
                null);

        String formatted = ExecutionFormatter.format(execution);

        assertThat(formatted).startsWith("<stdout>\nhello\n</stdout>\n\n<stderr>\nwarning\n</stderr>\n\n<results>\n");
        assertThat(formatted).contains("DataFrame (4 rows x 1 columns):");
        assertThat(formatted).contains("{\"a\":1}");
        assertThat(formatted).doesNotContain("3  4");
    }

    @Test
    void shouldSayWhenThereIsNoOutput() {
        assertThat(ExecutionFormatter.format(new CodeExecution(null, null, null, null)))
                .isEqualTo(ExecutionFormatter.NO_OUTPUT);
    }

    @Test
    void shouldDescribeImagesBySize() {
        String rendered = ExecutionFormatter.formatOutputs(
                List.of(new SandboxOutput(ArtifactKind.IMAGE, new byte[] {1, 2, 3})));

        assertThat(rendered).isEqualTo("[PNG image, 3 bytes]");
    }
}
