package nexa.taskapi.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import nexa.taskapi.config.TaskApiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool, schema management and transaction scoping.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; {@link #inTransaction} owns commit and rollback.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    /**
     * A unit of work executed on a connection inside one transaction.
     */
    @FunctionalInterface
    public interface TransactionWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    public Database(TaskApiConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("nexa-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for committing and closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Run {@code work} in a single transaction: commit if it returns, roll back
     * if it throws anything, and always return the connection to the pool.
     *
     * @param description short label used in the failure message
     * @throws StoreException if the work or the commit fails with an SQLException
     */
    public <T> T inTransaction(String description, TransactionWork<T> work) {
        try (Connection conn = getConnection()) {
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (Throwable t) {
                rollback(conn, t);
                throw t;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + description, e);
        }
    }

    private static void rollback(Connection conn, Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
            cause.addSuppressed(e);
        }
    }

    /**
     * Initialize database schema.
     */
    private void initSchema() {
        inTransaction("initialize database schema", conn -> {
            try (Statement st = conn.createStatement()) {
                st.execute("""
                            CREATE TABLE IF NOT EXISTS tasks (
                                id          VARCHAR(64) PRIMARY KEY,
                                type        VARCHAR(255) NOT NULL,
                                payload     CLOB NOT NULL,
                                status      VARCHAR(32) DEFAULT 'pending',
                                created_at  TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,
                                updated_at  TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
                            )
                        """);
            }
            return null;
        });
        log.info("Database schema initialized");
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
