package taskmesh.node.spi;

import taskmesh.node.model.TaskHeader;

import java.util.List;

/**
 * Tasks published by this node.
 */
public interface LocalTaskManager {

    /** True when {@code taskId} belongs to a task this node published. */
    boolean isOwnTask(String taskId);

    /** Headers of the tasks this node currently advertises. */
    List<TaskHeader> ownTaskHeaders();

    /**
     * Raw trust weight for a subtask, usually derived from its estimated
     * complexity. Callers clamp it.
     */
    double trustModifier(String subtaskId);
}
