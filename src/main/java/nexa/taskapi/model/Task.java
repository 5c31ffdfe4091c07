package nexa.taskapi.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a submitted task record.
 * Tasks are created once and only read afterwards; nothing in this service
 * executes them or moves them out of {@link #STATUS_PENDING}.
 */
public final class Task {

    /** Status assigned at creation */
    public static final String STATUS_PENDING = "pending";

    /** Task type that gets a mock route optimization result on fetch */
    public static final String TYPE_OPTIMIZE_ROUTE = "optimize_route";

    private final String id;
    private final String type;
    private final JsonNode payload; // caller-owned JSON object
    private final String status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public JsonNode payload() {
        return payload;
    }

    public String status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if this task should be shown with a route optimization result */
    public boolean isRouteOptimization() {
        return TYPE_OPTIMIZE_ROUTE.equals(type);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String type;
        private JsonNode payload;
        private String status = STATUS_PENDING;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type='" + type + "', status='" + status + "'}";
    }
}
