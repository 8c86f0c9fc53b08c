package io.stagewise.server.persistence;

import java.io.Serial;

/// Unchecked exception for database persistence failures.
///
/// Wraps {@link java.sql.SQLException} so that {@link io.stagewise.core.checkpoint.Checkpointer},
/// which declares no checked exceptions, can be backed by JDBC.
///
/// @see JdbcCheckpointer
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3390528174120396418L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
