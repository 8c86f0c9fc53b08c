package io.stagewise.core.state;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Period;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Row/column table reconstructed from a tabular sandbox result.
///
/// Cells are normalized on construction so that a table survives a serialization round
/// trip unchanged:
/// - integral numbers become `Long`, other numbers become `Double` (`NaN` becomes `null`,
///   infinities are kept)
/// - temporal values (dates, periods, durations) become their string form
/// - enums become their name
/// - nested maps and lists are normalized recursively
///
/// @param columns ordered column names, not null
/// @param rows rows in order; each row has exactly one cell per column, cells may be null
public record Table(List<String> columns, List<List<Object>> rows) {

    public Table {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        columns = List.copyOf(columns);
        if (new LinkedHashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
        List<List<Object>> normalized = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row == null || row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row " + i + " does not have " + columns.size() + " cells");
            }
            List<Object> cells = new ArrayList<>(row.size());
            for (Object cell : row) {
                cells.add(normalizeValue(cell));
            }
            normalized.add(Collections.unmodifiableList(cells));
        }
        rows = Collections.unmodifiableList(normalized);
    }

    /// Builds a table from record-oriented data: one map per row, keyed by column name.
    ///
    /// Column order follows first appearance across the records. Missing keys become null cells.
    ///
    /// @param records row maps, not null
    /// @return the table, never null
    public static Table fromRecords(List<? extends Map<String, ?>> records) {
        Objects.requireNonNull(records, "records must not be null");
        LinkedHashSet<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            columns.addAll(record.keySet());
        }
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(record.get(column));
            }
            rows.add(row);
        }
        return new Table(new ArrayList<>(columns), rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    /// Returns the first `limit` rows as a new table.
    ///
    /// @param limit maximum number of rows, non-negative
    /// @return a table with at most `limit` rows, never null
    public Table head(int limit) {
        return new Table(columns, rows.subList(0, Math.min(limit, rows.size())));
    }

    /// Returns the rows as column-keyed maps, preserving column order.
    ///
    /// @return list of row maps, never null
    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                record.put(columns.get(i), row.get(i));
            }
            records.add(record);
        }
        return records;
    }

    /// Renders the table as aligned plain text with a leading row index column.
    ///
    /// @return text rendering, never null
    public String render() {
        List<List<String>> lines = new ArrayList<>();
        List<String> header = new ArrayList<>();
        header.add("");
        header.addAll(columns);
        lines.add(header);
        for (int r = 0; r < rows.size(); r++) {
            List<String> line = new ArrayList<>();
            line.add(String.valueOf(r));
            for (Object cell : rows.get(r)) {
                line.add(cell == null ? "NaN" : String.valueOf(cell));
            }
            lines.add(line);
        }

        int[] widths = new int[header.size()];
        for (List<String> line : lines) {
            for (int c = 0; c < line.size(); c++) {
                widths[c] = Math.max(widths[c], line.get(c).length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int l = 0; l < lines.size(); l++) {
            List<String> line = lines.get(l);
            for (int c = 0; c < line.size(); c++) {
                if (c > 0) {
                    sb.append("  ");
                }
                String value = line.get(c);
                sb.append(" ".repeat(widths[c] - value.length())).append(value);
            }
            if (l < lines.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /// Normalizes a single cell or nested value to its serialization-stable form.
    ///
    /// @param value the raw value, may be null
    /// @return the normalized value, may be null
    public static Object normalizeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Double d) {
            return d.isNaN() ? null : d;
        }
        if (value instanceof Float f) {
            return f.isNaN() ? null : f.doubleValue();
        }
        if (value instanceof BigDecimal bd) {
            return bd.doubleValue();
        }
        if (value instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? (Object) bi.longValue() : bi.toString();
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof TemporalAccessor
                || value instanceof Period
                || value instanceof Duration
                || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), normalizeValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(normalizeValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value.toString();
    }
}
