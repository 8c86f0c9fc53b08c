package io.stagewise.core.pipeline;

import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ArtifactKind;
import io.stagewise.core.state.Table;
import io.stagewise.core.util.JsonText;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Prepares a fresh sandbox session: one file per artifact plus a script that binds each file
/// to a variable named after the artifact.
///
/// | Kind | File | Binding |
/// |------|------|---------|
/// | `TABLE` | `{key}.csv` | `pd.read_csv` |
/// | `JSON` | `{key}.json` | `json.load` |
/// | `TEXT`, `STRING` | `{key}.txt` | `open(...).read()` |
///
/// Image artifacts cannot be rebound and are not preloaded.
public final class SandboxBootstrap {

    private static final Logger logger = Logger.getLogger(SandboxBootstrap.class.getName());

    public static final String DEFAULT_DIRECTORY = "/tmp";

    private final String directory;

    public SandboxBootstrap(String directory) {
        this.directory = Objects.requireNonNullElse(directory, DEFAULT_DIRECTORY);
    }

    /// A file to write before the bootstrap script runs.
    ///
    /// @param artifact the artifact the file holds, not null
    /// @param path absolute path inside the session, not null
    /// @param content file bytes, not null
    public record PreloadFile(Artifact artifact, String path, byte[] content) {}

    /// Renders the preload files for the given artifacts.
    ///
    /// @param artifacts artifacts in state order, not null
    /// @return one file per loadable artifact, in artifact order
    public List<PreloadFile> files(Collection<Artifact> artifacts) {
        List<PreloadFile> files = new ArrayList<>();
        for (Artifact artifact : artifacts) {
            if (artifact.kind() == ArtifactKind.IMAGE) {
                logger.warning("Skipping preload of image artifact: " + artifact.key());
                continue;
            }
            String path = directory + "/" + artifact.key() + "." + artifact.kind().fileExtension();
            files.add(new PreloadFile(artifact, path, content(artifact).getBytes(StandardCharsets.UTF_8)));
        }
        return files;
    }

    /// Builds the script binding every preload file to its artifact name.
    ///
    /// @param files files returned by {@link #files}, not null
    /// @return python source, never null
    public static String script(List<PreloadFile> files) {
        List<String> lines = new ArrayList<>();
        lines.add("import pandas as pd");
        lines.add("import json");
        for (PreloadFile file : files) {
            String key = file.artifact().key();
            switch (file.artifact().kind()) {
                case TABLE -> lines.add(key + " = pd.read_csv('" + file.path() + "')");
                case JSON -> lines.add("with open('" + file.path() + "', 'r') as f: " + key + " = json.load(f)");
                case TEXT, STRING -> lines.add(key + " = open('" + file.path() + "', 'r').read()");
                case IMAGE -> throw new IllegalArgumentException("Image artifacts cannot be preloaded: " + key);
            }
        }
        return String.join("\n", lines);
    }

    private static String content(Artifact artifact) {
        return switch (artifact.kind()) {
            case TABLE -> toCsv(artifact.asTable());
            case JSON -> JsonText.writePretty(artifact.value());
            case TEXT, STRING -> (String) artifact.value();
            case IMAGE -> throw new IllegalArgumentException("Image artifacts cannot be preloaded");
        };
    }

    static String toCsv(Table table) {
        StringBuilder csv = new StringBuilder();
        appendRow(csv, new ArrayList<>(table.columns()));
        for (List<Object> row : table.rows()) {
            appendRow(csv, row);
        }
        return csv.toString();
    }

    private static void appendRow(StringBuilder csv, List<?> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            Object cell = cells.get(i);
            if (cell == null) {
                continue;
            }
            String text = cell instanceof Map || cell instanceof List ? JsonText.write(cell) : cell.toString();
            if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")) {
                csv.append('"').append(text.replace("\"", "\"\"")).append('"');
            } else {
                csv.append(text);
            }
        }
        csv.append('\n');
    }
}
