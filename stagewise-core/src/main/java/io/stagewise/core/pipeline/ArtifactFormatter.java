package io.stagewise.core.pipeline;

import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ArtifactKind;
import io.stagewise.core.state.Table;
import io.stagewise.core.util.JsonText;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Describes artifacts to the text generator: name, description and a data sample.
///
/// Samples are short by default; the untruncated form feeds the final report.
public final class ArtifactFormatter {

    static final int SAMPLE_ROWS = 3;
    static final int FULL_SAMPLE_ROWS = 30;
    static final int SAMPLE_LENGTH = 1000;
    static final int FULL_SAMPLE_LENGTH = 10000;

    private ArtifactFormatter() {}

    /// Describes each artifact as tagged name, description and sample blocks.
    ///
    /// @param artifacts artifacts in state order, not null
    /// @param truncate whether to use short samples
    /// @return descriptions joined by newlines, empty when there are no artifacts
    public static String describe(Collection<Artifact> artifacts, boolean truncate) {
        return artifacts.stream()
                .map(a -> "<variable_name>"
                        + a.key()
                        + "</variable_name>\n<description>"
                        + a.description()
                        + "</description>\n<sample_data>"
                        + sample(a, truncate)
                        + "</sample_data>")
                .collect(Collectors.joining("\n"));
    }

    static String sample(Artifact artifact, boolean truncate) {
        int length = truncate ? SAMPLE_LENGTH : FULL_SAMPLE_LENGTH;
        return switch (artifact.kind()) {
            case TABLE -> artifact.asTable().head(truncate ? SAMPLE_ROWS : FULL_SAMPLE_ROWS).render();
            case JSON -> ExecutionFormatter.truncateMiddle(JsonText.writePretty(artifact.value()), length);
            case TEXT, STRING -> ExecutionFormatter.truncateMiddle((String) artifact.value(), length);
            case IMAGE -> "[PNG image, " + ((byte[]) artifact.value()).length + " bytes]";
        };
    }

    /// Profiles the first table artifact: shape, per-column type and missing counts, numeric
    /// statistics and the most frequent value of text columns.
    ///
    /// @param artifacts artifacts in state order, not null
    /// @return a `<dataframe_info>` block, or empty when no table artifact exists
    public static String tableProfile(Collection<Artifact> artifacts) {
        Objects.requireNonNull(artifacts, "artifacts must not be null");
        for (Artifact artifact : artifacts) {
            if (artifact.kind() == ArtifactKind.TABLE) {
                return "<dataframe_info>" + profile(artifact.asTable()) + "</dataframe_info>";
            }
        }
        return "";
    }

    private static String profile(Table table) {
        List<String> sections = new ArrayList<>();
        int rows = table.rowCount();
        sections.add("Shape: (" + rows + ", " + table.columnCount() + ") (rows x columns)");
        for (int c = 0; c < table.columnCount(); c++) {
            List<Object> values = column(table, c);
            long nonNull = values.stream().filter(Objects::nonNull).count();
            long missing = rows - nonNull;
            double pct = rows > 0 ? missing * 100.0 / rows : 0;
            sections.add(String.format(Locale.ROOT, "%s: %s | Non-null: %d | Missing: %d (%.1f%%)",
                    table.columns().get(c), typeOf(values), nonNull, missing, pct));
        }
        for (int c = 0; c < table.columnCount(); c++) {
            List<Object> values = column(table, c);
            String type = typeOf(values);
            String name = table.columns().get(c);
            if (type.equals("int64") || type.equals("float64")) {
                sections.add(numericSummary(name, values));
            } else if (type.equals("object")) {
                sections.add(categoricalSummary(name, values));
            }
        }
        return String.join("\n\n", sections);
    }

    private static List<Object> column(Table table, int index) {
        List<Object> values = new ArrayList<>(table.rowCount());
        table.rows().forEach(row -> values.add(row.get(index)));
        return values;
    }

    private static String typeOf(List<Object> values) {
        List<Object> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return "object";
        }
        if (present.stream().allMatch(Boolean.class::isInstance)) {
            return "bool";
        }
        if (present.stream().allMatch(Long.class::isInstance)) {
            return "int64";
        }
        if (present.stream().allMatch(Number.class::isInstance)) {
            return "float64";
        }
        return "object";
    }

    private static String numericSummary(String name, List<Object> values) {
        List<Double> numbers = values.stream()
                .filter(Objects::nonNull)
                .map(v -> ((Number) v).doubleValue())
                .toList();
        double min = numbers.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN);
        double max = numbers.stream().mapToDouble(Double::doubleValue).max().orElse(Double.NaN);
        double mean = numbers.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
        return String.format(Locale.ROOT, "%s: count %d | mean %.3f | min %.3f | max %.3f",
                name, numbers.size(), mean, min, max);
    }

    private static String categoricalSummary(String name, List<Object> values) {
        Map<String, Integer> counts = new HashMap<>();
        List<String> order = new ArrayList<>();
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            String key = String.valueOf(value);
            if (counts.merge(key, 1, Integer::sum) == 1) {
                order.add(key);
            }
        }
        if (counts.isEmpty()) {
            return name + ": 0 unique values";
        }
        String top = order.get(0);
        for (String key : order) {
            if (counts.get(key) > counts.get(top)) {
                top = key;
            }
        }
        return name + ": " + counts.size() + " unique values | Most frequent: '" + top + "' ("
                + counts.get(top) + " times)";
    }
}
