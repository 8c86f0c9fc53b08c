package io.stagewise.server.persistence;

import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.checkpoint.Checkpointer;
import io.stagewise.serialization.StateSerializer;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed {@link Checkpointer}.
///
/// Each checkpoint is one row keyed by `(session_id, sequence)`; the full checkpoint is stored
/// as JSONB in `payload`, with `status` and `created_at` copied out for inspection queries.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_checkpoints` has run
/// - **Postcondition**: `put` is idempotent per `(session_id, sequence)`
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection via {@link JdbcSupport}.
///
/// @see StateSerializer for the payload format
public class JdbcCheckpointer implements Checkpointer {

    private static final String SQL_PUT =
            """
            INSERT INTO stagewise.checkpoints (session_id, sequence, status, payload, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (session_id, sequence)
            DO UPDATE SET
                status     = EXCLUDED.status,
                payload    = EXCLUDED.payload,
                created_at = EXCLUDED.created_at
            """;

    private static final String SQL_LATEST =
            """
            SELECT payload FROM stagewise.checkpoints
            WHERE session_id = ?
            ORDER BY sequence DESC
            LIMIT 1
            """;

    private static final String SQL_HISTORY =
            """
            SELECT payload FROM stagewise.checkpoints
            WHERE session_id = ?
            ORDER BY sequence
            """;

    private static final String SQL_DELETE = "DELETE FROM stagewise.checkpoints WHERE session_id = ?";

    private final JdbcSupport jdbc;

    /// @param dataSource the JDBC connection pool, not null
    public JdbcCheckpointer(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public void put(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint must not be null");
        String payload = StateSerializer.toJson(checkpoint);
        jdbc.update(
                SQL_PUT,
                ps -> {
                    ps.setString(1, checkpoint.sessionId());
                    ps.setLong(2, checkpoint.sequence());
                    ps.setString(3, checkpoint.status().name());
                    ps.setString(4, payload);
                    ps.setObject(5, OffsetDateTime.ofInstant(checkpoint.createdAt(), ZoneOffset.UTC));
                },
                "Failed to save checkpoint " + checkpoint.sequence() + " of session " + checkpoint.sessionId());
    }

    @Override
    public Optional<Checkpoint> getLatest(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return jdbc.queryOne(
                SQL_LATEST,
                ps -> ps.setString(1, sessionId),
                JdbcCheckpointer::mapCheckpoint,
                "Failed to load latest checkpoint of session " + sessionId);
    }

    @Override
    public List<Checkpoint> history(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return jdbc.queryList(
                SQL_HISTORY,
                ps -> ps.setString(1, sessionId),
                JdbcCheckpointer::mapCheckpoint,
                "Failed to load checkpoint history of session " + sessionId);
    }

    @Override
    public boolean delete(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return jdbc.update(
                        SQL_DELETE, ps -> ps.setString(1, sessionId), "Failed to delete session " + sessionId)
                > 0;
    }

    private static Checkpoint mapCheckpoint(ResultSet rs) throws SQLException {
        return StateSerializer.checkpointFromJson(rs.getString("payload"));
    }
}
