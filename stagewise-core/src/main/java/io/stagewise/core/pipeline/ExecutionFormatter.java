package io.stagewise.core.pipeline;

import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.ExecutionError;
import io.stagewise.core.sandbox.SandboxOutput;
import io.stagewise.core.state.Table;
import io.stagewise.core.util.JsonText;
import java.util.ArrayList;
import java.util.List;

/// Turns sandbox results into the text the agent reads next.
public final class ExecutionFormatter {

    /// Character budget for tracebacks and rendered results.
    public static final int TRUNCATION_BUDGET = 1000;

    public static final String NO_OUTPUT = "No output from the code block.";

    private static final int TABLE_PREVIEW_ROWS = 3;

    private ExecutionFormatter() {}

    /// Shortens a string by collapsing its middle.
    ///
    /// Strings within the budget are returned unchanged. Otherwise the first and last
    /// `maxLength / 2` characters are kept around a marker stating how many characters
    /// exceed the budget.
    ///
    /// @param text the text, not null
    /// @param maxLength character budget, positive
    /// @return the text or its shortened form, never null
    public static String truncateMiddle(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int half = maxLength / 2;
        return text.substring(0, half)
                + " ... [TRUNCATED, "
                + (text.length() - maxLength)
                + " chars omitted] ... "
                + text.substring(text.length() - half);
    }

    /// Formats one code execution.
    ///
    /// @param execution the captured execution, not null
    /// @return agent-facing content, never null or empty
    public static String format(CodeExecution execution) {
        if (execution.hasError()) {
            return formatError(execution.error());
        }
        List<String> parts = new ArrayList<>();
        if (!execution.stdout().isEmpty()) {
            parts.add("<stdout>\n" + execution.stdout() + "\n</stdout>");
        }
        if (!execution.stderr().isEmpty()) {
            parts.add("<stderr>\n" + execution.stderr() + "\n</stderr>");
        }
        String results = formatOutputs(execution.outputs());
        if (!results.isEmpty()) {
            parts.add("<results>\n" + results + "\n</results>");
        }
        String content = String.join("\n\n", parts).strip();
        return content.isEmpty() ? NO_OUTPUT : content;
    }

    public static String formatError(ExecutionError error) {
        String traceback = "\n\n<traceback>\n" + error.traceback() + "\n</traceback>";
        return error.name() + ": " + error.message() + truncateMiddle(traceback, TRUNCATION_BUDGET);
    }

    /// Renders rich results, one per line; tables show their shape and first rows.
    ///
    /// @param outputs results in emission order, not null
    /// @return rendered results, empty when there are none
    public static String formatOutputs(List<SandboxOutput> outputs) {
        List<String> rendered = new ArrayList<>();
        for (SandboxOutput output : outputs) {
            switch (output.kind()) {
                case TABLE -> {
                    Table table = (Table) output.value();
                    rendered.add("DataFrame ("
                            + table.rowCount()
                            + " rows x "
                            + table.columnCount()
                            + " columns):\n"
                            + table.head(TABLE_PREVIEW_ROWS).render());
                }
                case JSON -> rendered.add(truncateMiddle(JsonText.write(output.value()), TRUNCATION_BUDGET));
                case IMAGE -> rendered.add("[PNG image, " + ((byte[]) output.value()).length + " bytes]");
                default -> rendered.add(truncateMiddle(String.valueOf(output.value()), TRUNCATION_BUDGET));
            }
        }
        return String.join("\n", rendered);
    }
}
