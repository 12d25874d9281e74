package taskmesh.node.spi;

import taskmesh.node.model.PeerAddress;
import taskmesh.node.model.ResultType;
import taskmesh.node.model.TaskRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Established channel to one peer. Implementations frame and send protocol
 * messages; delivery of one-way notices is best effort.
 */
public interface PeerSession {

    PeerAddress peer();

    void requestTask(TaskRequest request);

    void requestResource(String subtaskId, String resourceDescriptor);

    /**
     * Report a computed result to its owner.
     *
     * @return completes once the owner acknowledged the report
     */
    CompletableFuture<Void> reportComputedTask(String subtaskId, String payload, ResultType resultType,
            PeerAddress replyTo);

    void sendRewardForTask(String subtaskId, long amount);

    void sendResultRejected(String subtaskId);
}
