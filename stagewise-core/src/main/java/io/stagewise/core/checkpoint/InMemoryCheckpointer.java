package io.stagewise.core.checkpoint;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// Process-local {@link Checkpointer}; contents are lost when the process exits.
public class InMemoryCheckpointer implements Checkpointer {

    private final Map<String, List<Checkpoint>> store = new ConcurrentHashMap<>();

    @Override
    public void put(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint must not be null");
        store.computeIfAbsent(checkpoint.sessionId(), id -> new CopyOnWriteArrayList<>())
                .add(checkpoint);
    }

    @Override
    public Optional<Checkpoint> getLatest(String sessionId) {
        List<Checkpoint> checkpoints = store.get(sessionId);
        if (checkpoints == null || checkpoints.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(checkpoints.get(checkpoints.size() - 1));
    }

    @Override
    public List<Checkpoint> history(String sessionId) {
        List<Checkpoint> checkpoints = store.get(sessionId);
        return checkpoints != null ? List.copyOf(checkpoints) : List.of();
    }

    @Override
    public boolean delete(String sessionId) {
        return store.remove(sessionId) != null;
    }
}
