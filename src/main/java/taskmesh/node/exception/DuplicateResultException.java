package taskmesh.node.exception;

/**
 * A result for the same subtask was queued twice.
 */
public class DuplicateResultException extends MarketplaceException {

    private final String subtaskId;

    public DuplicateResultException(String subtaskId) {
        super("Result for subtask " + subtaskId + " is already waiting for delivery");
        this.subtaskId = subtaskId;
    }

    public String subtaskId() {
        return subtaskId;
    }
}
