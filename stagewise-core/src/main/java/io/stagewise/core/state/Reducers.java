package io.stagewise.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// Stock {@link Reducer} implementations.
///
/// All reducers return new collections; inputs are never mutated.
public final class Reducers {

    private Reducers() {}

    /// Full replacement: the update wins.
    ///
    /// @param <T> field type
    /// @return replacing reducer, never null
    public static <T> Reducer<T> replace() {
        return (current, update) -> update;
    }

    /// Ordered append where a sentinel element clears everything accumulated before it.
    ///
    /// Elements of the update are processed in order, so `[RESET, a, b]` yields `[a, b]` and a
    /// single-element `[RESET]` clears the list.
    ///
    /// @param sentinel element that resets the list, not null
    /// @param <E> element type
    /// @return appending reducer, never null
    public static <E> Reducer<List<E>> appendWithReset(E sentinel) {
        Objects.requireNonNull(sentinel, "sentinel must not be null");
        return (current, update) -> {
            List<E> result = current != null ? new ArrayList<>(current) : new ArrayList<>();
            if (update != null) {
                for (E element : update) {
                    if (sentinel.equals(element)) {
                        result.clear();
                    } else {
                        result.add(element);
                    }
                }
            }
            return Collections.unmodifiableList(result);
        };
    }

    /// Keyed upsert: updates replace existing entries in place, new keys are appended.
    ///
    /// When the update holds the same key more than once, the last occurrence wins.
    ///
    /// @param keyFunction extracts the key of an element, not null
    /// @param <K> key type
    /// @param <E> element type
    /// @return upserting reducer, never null
    public static <K, E> Reducer<List<E>> upsertBy(Function<E, K> keyFunction) {
        Objects.requireNonNull(keyFunction, "keyFunction must not be null");
        return (current, update) -> {
            Map<K, E> merged = new LinkedHashMap<>();
            if (current != null) {
                current.forEach(e -> merged.put(keyFunction.apply(e), e));
            }
            if (update != null) {
                update.forEach(e -> merged.put(keyFunction.apply(e), e));
            }
            return List.copyOf(merged.values());
        };
    }
}
