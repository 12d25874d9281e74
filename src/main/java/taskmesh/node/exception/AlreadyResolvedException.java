package taskmesh.node.exception;

/**
 * A subtask outcome (accept or reject) arrived for a subtask whose outcome
 * was already settled. Indicates the two peers are out of sync.
 */
public class AlreadyResolvedException extends MarketplaceException {

    private final String subtaskId;

    public AlreadyResolvedException(String subtaskId, String resolution) {
        super("Subtask " + subtaskId + " already resolved as " + resolution);
        this.subtaskId = subtaskId;
    }

    public String subtaskId() {
        return subtaskId;
    }
}
