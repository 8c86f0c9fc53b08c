package io.stagewise.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ArtifactTest {

    @Test
    void shouldRequireTableValueForTableKind() {
        assertThatThrownBy(() -> new Artifact("df", ArtifactKind.TABLE, "", "not a table"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a Table");
    }

    @Test
    void shouldAcceptNullJsonAndDefaultDescription() {
        Artifact artifact = Artifact.json("result", null, null);

        assertThat(artifact.description()).isEmpty();
        assertThat(artifact.value()).isNull();
    }

    @Test
    void shouldExposeTablePayload() {
        Table table = new Table(List.of("a"), List.of(List.of(1)));

        assertThat(Artifact.table("df", "frame", table).asTable()).isSameAs(table);
        assertThatThrownBy(() -> Artifact.text("t", "", "x").asTable())
                .isInstanceOf(IllegalStateException.class);
    }
}
