package nexa.taskapi.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import nexa.taskapi.model.Task;
import nexa.taskapi.repository.TaskRepository;
import nexa.taskapi.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of TaskRepository.
 * The payload is stored as JSON text; every call runs in its own transaction.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;
    private final Clock clock;

    public JdbcTaskRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcTaskRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Task insert(String type, JsonNode payload) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .payload(payload)
                .status(Task.STATUS_PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        String sql = """
                    INSERT INTO tasks (id, type, payload, status, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        String payloadJson = writePayload(task);

        return db.inTransaction("insert task " + task.id(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, task.id());
                ps.setString(2, task.type());
                ps.setString(3, payloadJson);
                ps.setString(4, task.status());
                setTimestamp(ps, 5, task.createdAt());
                setTimestamp(ps, 6, task.updatedAt());
                ps.executeUpdate();
            }
            log.debug("Inserted task {} of type '{}'", task.id(), task.type());
            return task;
        });
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT id, type, payload, status, created_at, updated_at FROM tasks WHERE id = ?";

        return db.inTransaction("find task " + taskId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, taskId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(mapRow(rs));
                    }
                }
            }
            return Optional.empty();
        });
    }

    // ==================== Helpers ====================

    private Task mapRow(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        return Task.builder()
                .id(id)
                .type(rs.getString("type"))
                .payload(readPayload(id, rs.getString("payload")))
                .status(rs.getString("status"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }

    private static String writePayload(Task task) {
        try {
            return Jsons.mapper().writeValueAsString(task.payload());
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize payload of task " + task.id(), e);
        }
    }

    private static JsonNode readPayload(String taskId, String json) {
        try {
            return Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt payload stored for task " + taskId, e);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, instant.atOffset(ZoneOffset.UTC));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }
}
