package taskmesh.node.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskmesh.node.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;

/**
 * Wire shape of a task advertisement as gossiped between peers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskHeaderMessage(
        @JsonProperty("id") String id,
        @JsonProperty("clientId") String clientId,
        @JsonProperty("address") String address,
        @JsonProperty("port") Integer port,
        @JsonProperty("environment") String environment,
        @JsonProperty("ttl") Double ttl,
        @JsonProperty("subtaskTimeout") Double subtaskTimeout,
        @JsonProperty("minVersion") String minVersion) {

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new ValidationException("id is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("clientId is required");
        }
        if (address == null || address.isBlank()) {
            throw new ValidationException("address is required");
        }
        if (port == null) {
            throw new ValidationException("port is required");
        }
        if (environment == null || environment.isBlank()) {
            throw new ValidationException("environment is required");
        }
        if (ttl == null || ttl.isNaN()) {
            throw new ValidationException("ttl is required");
        }
        if (subtaskTimeout != null && (subtaskTimeout.isNaN() || subtaskTimeout < 0)) {
            throw new ValidationException("subtaskTimeout must be non-negative");
        }
    }

    /** Validate and build a header first checked at {@code receivedAt}. */
    public TaskHeader toHeader(Instant receivedAt) {
        validate();
        return TaskHeader.builder()
                .taskId(id)
                .ownerId(clientId)
                .ownerAddress(address, port)
                .environment(environment)
                .ttl(ttl)
                .lastChecked(receivedAt)
                .subtaskTimeout(subtaskTimeout == null ? null : Duration.ofMillis(Math.round(subtaskTimeout * 1000)))
                .minVersion(minVersion)
                .build();
    }

    public static TaskHeaderMessage from(TaskHeader header) {
        Duration timeout = header.subtaskTimeout();
        return new TaskHeaderMessage(
                header.taskId(),
                header.ownerId(),
                header.ownerAddress().host(),
                header.ownerAddress().port(),
                header.environment(),
                header.ttl(),
                timeout == null ? null : timeout.toMillis() / 1000.0,
                header.minVersion());
    }
}
