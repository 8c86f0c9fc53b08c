package io.stagewise.server.persistence;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Small JDBC helper that owns connection handling and {@link SQLException} translation.
///
/// SQL is always a `static final` constant of the caller; parameters are bound through a
/// {@link StatementPreparer}, never concatenated.
///
/// ### Contracts
/// - **Precondition**: {@link DataSource} is a valid pooled data source
/// - **Postcondition**: every acquired connection is released via try-with-resources
///
/// @implNote Thread-safe. Each call acquires and releases its own connection.
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Executes an INSERT, UPDATE or DELETE statement.
    ///
    /// @return number of affected rows
    /// @throws PersistenceException if the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Executes a SELECT returning zero or one mapped row.
    ///
    /// @throws PersistenceException if the query fails
    <T> Optional<T> queryOne(String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Executes a SELECT returning zero or more mapped rows, in result order.
    ///
    /// @throws PersistenceException if the query fails
    <T> List<T> queryList(String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<T>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Binds parameters to a {@link PreparedStatement} before execution.
    @FunctionalInterface
    interface StatementPreparer {
        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps the current {@link ResultSet} row to a value.
    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
