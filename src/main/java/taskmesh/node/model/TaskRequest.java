package taskmesh.node.model;

/**
 * Message sent to a task owner asking for a subtask of {@code taskId}.
 */
public record TaskRequest(String nodeId, String taskId, NodeCapabilities capabilities) {
}
