package taskmesh.node.model;

import java.time.Duration;

/**
 * Read-only view of a task header handed to presentation layers.
 *
 * @param local true when the task is published by this node
 */
public record TaskHeaderSummary(
        String taskId,
        String ownerId,
        String address,
        int port,
        String environment,
        double ttl,
        Duration subtaskTimeout,
        String minVersion,
        boolean local) {

    public static TaskHeaderSummary from(TaskHeader header, boolean local) {
        return new TaskHeaderSummary(
                header.taskId(),
                header.ownerId(),
                header.ownerAddress().host(),
                header.ownerAddress().port(),
                header.environment(),
                header.ttl(),
                header.subtaskTimeout(),
                header.minVersion(),
                local);
    }
}
