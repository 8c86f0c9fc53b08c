package io.stagewise.core.sandbox;

import io.stagewise.core.state.ArtifactKind;
import java.util.Objects;

/// One rich result produced by executed code.
///
/// Values follow the {@link io.stagewise.core.state.Artifact} typing: a
/// {@link io.stagewise.core.state.Table} for tables, a `String` for text, PNG bytes for
/// images and maps, lists or scalars for JSON.
///
/// @param kind classified kind, not null
/// @param value the payload
public record SandboxOutput(ArtifactKind kind, Object value) {

    public SandboxOutput {
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
