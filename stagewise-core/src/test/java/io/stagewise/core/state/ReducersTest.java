package io.stagewise.core.state;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ReducersTest {

    @Test
    void shouldReplaceWithUpdate() {
        Reducer<String> reducer = Reducers.replace();

        assertThat(reducer.reduce("old", "new")).isEqualTo("new");
        assertThat(reducer.reduce("old", null)).isNull();
    }

    @Test
    void shouldAppendAndResetOnSentinel() {
        Reducer<List<String>> reducer = Reducers.appendWithReset("RESET");

        assertThat(reducer.reduce(List.of("a"), List.of("b", "c"))).containsExactly("a", "b", "c");
        assertThat(reducer.reduce(List.of("a"), List.of("RESET", "b"))).containsExactly("b");
        assertThat(reducer.reduce(List.of("a", "b"), List.of("RESET"))).isEmpty();
        assertThat(reducer.reduce(null, null)).isEmpty();
    }

    @Test
    void shouldUpsertByKeyKeepingPosition() {
        Reducer<List<String>> reducer = Reducers.upsertBy(s -> s.charAt(0));

        List<String> merged = reducer.reduce(List.of("a1", "b1", "c1"), List.of("b2", "d1", "b3"));

        assertThat(merged).containsExactly("a1", "b3", "c1", "d1");
    }
}
