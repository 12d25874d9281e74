package taskmesh.node.delivery;

import taskmesh.node.model.PeerAddress;
import taskmesh.node.model.ResultType;

import java.time.Duration;
import java.time.Instant;

/**
 * A computed result waiting to be handed to its task owner.
 * Delivery bookkeeping is changed only by {@link ResultDeliveryQueue}.
 */
public final class WaitingTaskResult {
    private final String subtaskId;
    private final String taskId;
    private final String payload;
    private final ResultType resultType;
    private final PeerAddress owner;

    private Instant lastSendAttempt = Instant.EPOCH;
    private Duration retryDelay = Duration.ZERO;
    private boolean inFlight;
    private int attempts;

    WaitingTaskResult(String subtaskId, String taskId, String payload, ResultType resultType, PeerAddress owner) {
        this.subtaskId = subtaskId;
        this.taskId = taskId;
        this.payload = payload;
        this.resultType = resultType;
        this.owner = owner;
    }

    public String subtaskId() {
        return subtaskId;
    }

    public String taskId() {
        return taskId;
    }

    public String payload() {
        return payload;
    }

    public ResultType resultType() {
        return resultType;
    }

    public PeerAddress owner() {
        return owner;
    }

    public Instant lastSendAttempt() {
        return lastSendAttempt;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public boolean inFlight() {
        return inFlight;
    }

    public int attempts() {
        return attempts;
    }

    boolean isDue(Instant now) {
        return !inFlight && Duration.between(lastSendAttempt, now).compareTo(retryDelay) > 0;
    }

    void markInFlight() {
        inFlight = true;
        attempts++;
    }

    void markFailed(Instant at, Duration delay) {
        inFlight = false;
        lastSendAttempt = at;
        retryDelay = delay;
    }

    void release() {
        inFlight = false;
    }

    @Override
    public String toString() {
        return "WaitingTaskResult{subtaskId='" + subtaskId + "', owner=" + owner + ", inFlight=" + inFlight
                + ", attempts=" + attempts + "}";
    }
}
