package taskmesh.node.registry;

import taskmesh.node.model.TaskHeader;

/**
 * Bookkeeping for a remote task this node has outstanding requests for.
 * Owned by {@link TaskHeaderRegistry}; only the registry changes the count.
 */
public final class ActiveTaskEntry {
    private final String taskId;
    private final TaskHeader header;
    private int outstandingRequests;

    ActiveTaskEntry(TaskHeader header) {
        this.taskId = header.taskId();
        this.header = header;
    }

    public String taskId() {
        return taskId;
    }

    /** Header as it was when the first request was made. */
    public TaskHeader header() {
        return header;
    }

    public int outstandingRequests() {
        return outstandingRequests;
    }

    void increment() {
        outstandingRequests++;
    }

    void decrement() {
        if (outstandingRequests > 0) {
            outstandingRequests--;
        }
    }

    @Override
    public String toString() {
        return "ActiveTaskEntry{taskId='" + taskId + "', requests=" + outstandingRequests + "}";
    }
}
