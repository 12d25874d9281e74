package taskmesh.node.spi;

/**
 * Local executor that asks for work and computes subtasks.
 */
public interface LocalTaskComputer {

    void taskRequestRejected(String taskId, String reason);

    void resourceRequestRejected(String subtaskId, String reason);
}
