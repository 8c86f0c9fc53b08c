package io.stagewise.core.checkpoint;

import java.util.List;
import java.util.Optional;

/// Durable, append-style checkpoint storage keyed by session id.
///
/// ### Contracts
/// - `put` appends; earlier checkpoints of the session stay readable through `history`
/// - `getLatest` returns the checkpoint with the highest sequence
/// - Implementations must be thread-safe across sessions
///
/// @see InMemoryCheckpointer
public interface Checkpointer {

    /// Appends a checkpoint.
    ///
    /// @param checkpoint the checkpoint, not null
    void put(Checkpoint checkpoint);

    /// Returns the latest checkpoint of a session.
    ///
    /// @param sessionId session id, not null
    /// @return the latest checkpoint, or empty for an unknown session
    Optional<Checkpoint> getLatest(String sessionId);

    /// Returns every checkpoint of a session, oldest first.
    ///
    /// @param sessionId session id, not null
    /// @return checkpoints in sequence order, empty for an unknown session
    List<Checkpoint> history(String sessionId);

    /// Removes all checkpoints of a session.
    ///
    /// @param sessionId session id, not null
    /// @return true if anything was removed
    boolean delete(String sessionId);
}
