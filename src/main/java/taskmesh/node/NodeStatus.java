package taskmesh.node;

/**
 * Counters describing the node at one point of the coordination loop.
 */
public record NodeStatus(
        String nodeId,
        int knownTasks,
        int supportedTasks,
        int activeTasks,
        int waitingResults,
        int pendingVerifications) {
}
