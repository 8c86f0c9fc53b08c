package io.stagewise.server.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.stagewise.core.state.Table;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/// Loads CSV files from a configured data directory into {@link Table}s.
///
/// The first line is the header. Cells are typed the way a data-frame reader would: empty
/// cells become null, integers become `Long`, decimals become `Double`, `true`/`false`
/// become `Boolean`, anything else stays a string.
///
/// ### Contracts
/// - **Precondition**: file names are relative to the data directory
/// - **Postcondition**: paths escaping the data directory are rejected
///
/// @implNote Thread-safe. Stateless beyond the shared {@link CsvMapper}.
public class CsvTableLoader {

    private static final Logger LOG = Logger.getLogger(CsvTableLoader.class);

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final Path dataDirectory;

    /// @param dataDirectory directory CSV files are read from, not null
    public CsvTableLoader(Path dataDirectory) {
        this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory must not be null")
                .toAbsolutePath()
                .normalize();
    }

    /// Reads a CSV file.
    ///
    /// @param fileName path relative to the data directory, not null
    /// @return the table, never null
    /// @throws IllegalArgumentException if the path escapes the data directory or the file
    ///     does not exist
    /// @throws UncheckedIOException if the file cannot be read or parsed
    public Table load(String fileName) {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Path file = dataDirectory.resolve(fileName).normalize();
        if (!file.startsWith(dataDirectory)) {
            throw new IllegalArgumentException("Data file is outside the data directory: " + fileName);
        }
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Data file not found: " + fileName);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Table table = read(reader);
            LOG.infov("Loaded {0}: {1} rows x {2} columns", fileName, table.rowCount(), table.columnCount());
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read data file " + fileName, e);
        }
    }

    /// Parses CSV text with a header line.
    static Table read(Reader reader) throws IOException {
        List<String> columns = new ArrayList<>();
        List<List<Object>> rows = new ArrayList<>();
        try (MappingIterator<String[]> lines =
                MAPPER.readerFor(String[].class).with(CsvSchema.emptySchema()).readValues(reader)) {
            if (!lines.hasNext()) {
                return new Table(List.of(), List.of());
            }
            columns.addAll(List.of(lines.next()));
            while (lines.hasNext()) {
                String[] line = lines.next();
                if (line.length == 1 && line[0].isEmpty()) {
                    continue;
                }
                List<Object> row = new ArrayList<>(columns.size());
                for (int i = 0; i < columns.size(); i++) {
                    row.add(i < line.length ? typed(line[i]) : null);
                }
                rows.add(row);
            }
        }
        return new Table(columns, rows);
    }

    static Object typed(String cell) {
        if (cell == null || cell.isEmpty() || cell.equalsIgnoreCase("nan")) {
            return null;
        }
        if (cell.equalsIgnoreCase("true") || cell.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(cell);
        }
        if (INTEGER.matcher(cell).matches()) {
            try {
                return Long.parseLong(cell);
            } catch (NumberFormatException overflow) {
                return Double.parseDouble(cell);
            }
        }
        if (DECIMAL.matcher(cell).matches()) {
            return Double.parseDouble(cell);
        }
        return cell;
    }
}
