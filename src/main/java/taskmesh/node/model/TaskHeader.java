package taskmesh.node.model;

import taskmesh.node.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable advertisement of a task available on the network.
 * The registry replaces a header with {@link #withTtl(double, Instant)} on
 * every check instead of mutating it.
 */
public final class TaskHeader {
    private final String taskId;
    private final String ownerId;
    private final PeerAddress ownerAddress;
    private final String environment;
    private final double ttl; // seconds left
    private final Instant lastChecked;
    private final Duration subtaskTimeout;
    private final String minVersion;

    private TaskHeader(Builder builder) {
        this.taskId = requireText(builder.taskId, "taskId");
        this.ownerId = requireText(builder.ownerId, "ownerId");
        this.ownerAddress = new PeerAddress(builder.ownerHost, builder.ownerPort);
        this.environment = requireText(builder.environment, "environment");
        this.ttl = builder.ttl;
        this.lastChecked = builder.lastChecked;
        this.subtaskTimeout = builder.subtaskTimeout;
        this.minVersion = builder.minVersion;
        if (subtaskTimeout != null && subtaskTimeout.isNegative()) {
            throw new ValidationException("subtaskTimeout must not be negative");
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    public String taskId() {
        return taskId;
    }

    public String ownerId() {
        return ownerId;
    }

    public PeerAddress ownerAddress() {
        return ownerAddress;
    }

    public String environment() {
        return environment;
    }

    public double ttl() {
        return ttl;
    }

    public Instant lastChecked() {
        return lastChecked;
    }

    public Duration subtaskTimeout() {
        return subtaskTimeout;
    }

    public String minVersion() {
        return minVersion;
    }

    public boolean isExpired() {
        return ttl <= 0;
    }

    /** Copy with a new remaining TTL, stamped at {@code checkedAt}. */
    public TaskHeader withTtl(double newTtl, Instant checkedAt) {
        return toBuilder().ttl(newTtl).lastChecked(checkedAt).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .ownerId(ownerId)
                .ownerAddress(ownerAddress.host(), ownerAddress.port())
                .environment(environment)
                .ttl(ttl)
                .lastChecked(lastChecked)
                .subtaskTimeout(subtaskTimeout)
                .minVersion(minVersion);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String ownerId;
        private String ownerHost;
        private int ownerPort;
        private String environment;
        private double ttl;
        private Instant lastChecked;
        private Duration subtaskTimeout;
        private String minVersion;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder ownerAddress(String host, int port) {
            this.ownerHost = host;
            this.ownerPort = port;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder ttl(double ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder lastChecked(Instant lastChecked) {
            this.lastChecked = lastChecked;
            return this;
        }

        public Builder subtaskTimeout(Duration subtaskTimeout) {
            this.subtaskTimeout = subtaskTimeout;
            return this;
        }

        public Builder minVersion(String minVersion) {
            this.minVersion = minVersion;
            return this;
        }

        public TaskHeader build() {
            return new TaskHeader(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskHeader header))
            return false;
        return Objects.equals(taskId, header.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId);
    }

    @Override
    public String toString() {
        return "TaskHeader{taskId='" + taskId + "', owner=" + ownerId + "@" + ownerAddress + ", ttl=" + ttl + "}";
    }
}
