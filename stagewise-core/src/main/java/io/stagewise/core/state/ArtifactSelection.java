package io.stagewise.core.state;

import java.util.Objects;

/// A named sandbox value chosen to persist beyond the current stage.
///
/// @param key binding name inside the sandbox session, not null
/// @param description why the value matters, becomes the artifact description, never null
public record ArtifactSelection(String key, String description) {

    public ArtifactSelection {
        Objects.requireNonNull(key, "key must not be null");
        description = description != null ? description : "";
    }
}
