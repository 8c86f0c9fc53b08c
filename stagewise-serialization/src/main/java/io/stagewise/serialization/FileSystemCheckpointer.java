package io.stagewise.serialization;

import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.checkpoint.Checkpointer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// {@link Checkpointer} writing one JSON file per checkpoint under a directory per session.
///
/// Layout: `{root}/{sessionId}/{sequence}.json` with the sequence zero-padded to 20 digits,
/// so lexical order is sequence order. Each file is written to a temporary name and moved
/// into place, so readers never see a partial checkpoint.
///
/// @implNote Thread-safe for distinct sessions. Writes of one session are serialized by the
/// executor, which runs one superstep per session at a time.
public class FileSystemCheckpointer implements Checkpointer {

    private static final Logger logger = Logger.getLogger(FileSystemCheckpointer.class.getName());

    private static final String SUFFIX = ".json";

    private final Path root;

    public FileSystemCheckpointer(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    @Override
    public void put(Checkpoint checkpoint) {
        Path dir = sessionDir(checkpoint.sessionId());
        Path target = dir.resolve(String.format("%020d%s", checkpoint.sequence(), SUFFIX));
        try {
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, "checkpoint", ".tmp");
            Files.writeString(temp, StateSerializer.toJson(checkpoint), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint " + target, e);
        }
        logger.fine("Wrote checkpoint " + checkpoint.sessionId() + "#" + checkpoint.sequence());
    }

    @Override
    public Optional<Checkpoint> getLatest(String sessionId) {
        List<Path> files = files(sessionId);
        if (files.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(read(files.get(files.size() - 1)));
    }

    @Override
    public List<Checkpoint> history(String sessionId) {
        List<Checkpoint> checkpoints = new ArrayList<>();
        for (Path file : files(sessionId)) {
            checkpoints.add(read(file));
        }
        return checkpoints;
    }

    @Override
    public boolean delete(String sessionId) {
        Path dir = sessionDir(sessionId);
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoints of " + sessionId, e);
        }
        logger.info("Deleted checkpoints of session " + sessionId);
        return true;
    }

    private Path sessionDir(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Path dir = root.resolve(sessionId).normalize();
        if (!dir.getParent().equals(root.normalize())) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return dir;
    }

    private List<Path> files(String sessionId) {
        Path dir = sessionDir(sessionId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checkpoints of " + sessionId, e);
        }
    }

    private Checkpoint read(Path file) {
        try {
            return StateSerializer.checkpointFromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + file, e);
        }
    }
}
