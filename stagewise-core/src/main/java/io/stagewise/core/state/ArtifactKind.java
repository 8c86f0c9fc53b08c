package io.stagewise.core.state;

/// Declared kind of an {@link Artifact} value.
///
/// Each kind carries the wire name used by the sandbox and the file extension used when the
/// artifact is preloaded into an execution session.
public enum ArtifactKind {
    TABLE("dataframe", "csv"),
    JSON("json", "json"),
    TEXT("text", "txt"),
    STRING("string", "txt"),
    IMAGE("png", "png");

    private final String wireName;
    private final String fileExtension;

    ArtifactKind(String wireName, String fileExtension) {
        this.wireName = wireName;
        this.fileExtension = fileExtension;
    }

    public String wireName() {
        return wireName;
    }

    public String fileExtension() {
        return fileExtension;
    }

    /// Resolves a kind from its wire name or enum name, case-insensitively.
    ///
    /// @param value the wire name (`dataframe`, `json`, ...) or constant name, not null
    /// @return the matching kind, never null
    /// @throws IllegalArgumentException if nothing matches
    public static ArtifactKind fromWireName(String value) {
        for (ArtifactKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown artifact kind: " + value);
    }
}
