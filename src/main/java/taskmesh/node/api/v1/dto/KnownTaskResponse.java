package taskmesh.node.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskmesh.node.model.TaskHeaderSummary;

/**
 * One entry of GET /api/v1/tasks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KnownTaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("ownerId") String ownerId,
        @JsonProperty("address") String address,
        @JsonProperty("port") int port,
        @JsonProperty("environment") String environment,
        @JsonProperty("ttl") double ttl,
        @JsonProperty("subtaskTimeout") Double subtaskTimeout,
        @JsonProperty("minVersion") String minVersion,
        @JsonProperty("local") boolean local) {

    public static KnownTaskResponse from(TaskHeaderSummary summary) {
        return new KnownTaskResponse(
                summary.taskId(),
                summary.ownerId(),
                summary.address(),
                summary.port(),
                summary.environment(),
                summary.ttl(),
                summary.subtaskTimeout() == null ? null : summary.subtaskTimeout().toMillis() / 1000.0,
                summary.minVersion(),
                summary.local());
    }
}
