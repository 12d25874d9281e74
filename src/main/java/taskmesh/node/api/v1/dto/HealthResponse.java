package taskmesh.node.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskmesh.node.NodeStatus;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("knownTasks") Integer knownTasks,
        @JsonProperty("supportedTasks") Integer supportedTasks,
        @JsonProperty("activeTasks") Integer activeTasks,
        @JsonProperty("waitingResults") Integer waitingResults,
        @JsonProperty("pendingVerifications") Integer pendingVerifications,
        @JsonProperty("error") String error) {

    public static HealthResponse healthy(NodeStatus status, String uptime) {
        return new HealthResponse("healthy", status.nodeId(), uptime,
                status.knownTasks(), status.supportedTasks(), status.activeTasks(),
                status.waitingResults(), status.pendingVerifications(), null);
    }

    public static HealthResponse unhealthy(String nodeId, String error) {
        return new HealthResponse("unhealthy", nodeId, null, null, null, null, null, null, error);
    }
}
