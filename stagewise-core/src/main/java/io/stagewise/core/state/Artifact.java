package io.stagewise.core.state;

import java.util.Objects;

/// A named, typed value produced during a stage and carried forward to later stages.
///
/// Artifacts are keyed by name inside {@link PipelineState}; writing an artifact whose key
/// already exists replaces the earlier value in place.
///
/// ### Value types per kind
/// | Kind | Java type |
/// |------|-----------|
/// | `TABLE` | {@link Table} |
/// | `JSON` | `Map`, `List`, or a scalar |
/// | `TEXT`, `STRING` | `String` |
/// | `IMAGE` | `byte[]` (PNG bytes) |
///
/// @param key artifact name, also the binding name inside the sandbox, not null
/// @param kind declared kind, not null
/// @param description human-readable description shown to later stages, never null
/// @param value the payload, may be null only for `JSON`
public record Artifact(String key, ArtifactKind kind, String description, Object value) {

    public Artifact {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        description = description != null ? description : "";
        switch (kind) {
            case TABLE -> requireType(key, kind, value, Table.class);
            case TEXT, STRING -> requireType(key, kind, value, String.class);
            case IMAGE -> requireType(key, kind, value, byte[].class);
            case JSON -> {
                // any JSON-like value
            }
        }
    }

    public static Artifact table(String key, String description, Table table) {
        return new Artifact(key, ArtifactKind.TABLE, description, table);
    }

    public static Artifact json(String key, String description, Object value) {
        return new Artifact(key, ArtifactKind.JSON, description, value);
    }

    public static Artifact text(String key, String description, String value) {
        return new Artifact(key, ArtifactKind.TEXT, description, value);
    }

    /// Returns the value as a table.
    ///
    /// @return the table payload, never null
    /// @throws IllegalStateException if this artifact is not a table
    public Table asTable() {
        if (kind != ArtifactKind.TABLE) {
            throw new IllegalStateException("Artifact '" + key + "' is " + kind + ", not TABLE");
        }
        return (Table) value;
    }

    private static void requireType(String key, ArtifactKind kind, Object value, Class<?> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                    "Artifact '"
                            + key
                            + "' of kind "
                            + kind
                            + " requires a "
                            + type.getSimpleName()
                            + " value");
        }
    }
}
