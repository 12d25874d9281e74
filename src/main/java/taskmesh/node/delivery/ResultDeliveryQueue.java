package taskmesh.node.delivery;

import taskmesh.node.exception.DuplicateResultException;
import taskmesh.node.exception.ValidationException;
import taskmesh.node.model.PeerAddress;
import taskmesh.node.model.ResultType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results computed here and waiting for delivery to their owners.
 *
 * A failed attempt keeps the entry and backs off by the configured maximum
 * resending delay; only an acknowledged delivery removes it. At most one
 * attempt per subtask is in flight.
 *
 * Not thread-safe: driven from the node's coordination loop.
 */
public class ResultDeliveryQueue {

    private static final Logger log = LoggerFactory.getLogger(ResultDeliveryQueue.class);

    private final Map<String, WaitingTaskResult> results = new LinkedHashMap<>();
    private final Duration maxResendDelay;

    public ResultDeliveryQueue(Duration maxResendDelay) {
        this.maxResendDelay = maxResendDelay;
    }

    /**
     * Queue a result for delivery.
     *
     * @throws ValidationException       if a field is missing
     * @throws DuplicateResultException if the subtask is already queued
     */
    public WaitingTaskResult enqueue(String subtaskId, String taskId, String payload, ResultType resultType,
            String ownerAddress, int ownerPort) {
        if (subtaskId == null || subtaskId.isBlank()) {
            throw new ValidationException("subtaskId is required");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("taskId is required");
        }
        if (payload == null) {
            throw new ValidationException("result payload is required");
        }
        if (resultType == null) {
            throw new ValidationException("resultType is required");
        }
        PeerAddress owner = new PeerAddress(ownerAddress, ownerPort);
        if (results.containsKey(subtaskId)) {
            throw new DuplicateResultException(subtaskId);
        }

        WaitingTaskResult result = new WaitingTaskResult(subtaskId, taskId, payload, resultType, owner);
        results.put(subtaskId, result);
        log.info("Result for subtask {} queued for {}", subtaskId, owner);
        return result;
    }

    /**
     * Start an attempt for every result that is idle and past its retry delay.
     *
     * @return number of attempts started
     */
    public int flush(Instant now, ResultDeliverer deliverer) {
        // the deliverer may acknowledge synchronously
        List<WaitingTaskResult> due = new ArrayList<>();
        for (WaitingTaskResult result : results.values()) {
            if (result.isDue(now)) {
                due.add(result);
            }
        }

        for (WaitingTaskResult result : due) {
            result.markInFlight();
            log.debug("Sending result for subtask {} (attempt {})", result.subtaskId(), result.attempts());
            try {
                deliverer.deliver(result);
            } catch (RuntimeException e) {
                log.warn("Delivery of subtask {} failed to start: {}", result.subtaskId(), e.getMessage());
                result.markFailed(now, maxResendDelay);
            }
        }
        return due.size();
    }

    /**
     * Owner confirmed the result; forget it.
     *
     * @return false if the subtask was not queued
     */
    public boolean acknowledge(String subtaskId) {
        WaitingTaskResult removed = results.remove(subtaskId);
        if (removed == null) {
            log.warn("Acknowledgment for unknown result {}", subtaskId);
            return false;
        }
        log.info("Result for subtask {} delivered after {} attempt(s)", subtaskId, removed.attempts());
        return true;
    }

    /**
     * Attempt failed; keep the result and wait the full resend delay.
     *
     * @return false if the subtask was not queued
     */
    public boolean deliveryFailed(String subtaskId, Instant at) {
        WaitingTaskResult result = results.get(subtaskId);
        if (result == null) {
            log.warn("Delivery failure for unknown result {}", subtaskId);
            return false;
        }
        result.markFailed(at, maxResendDelay);
        log.warn("Cannot deliver result for subtask {} to {}, retrying in {}",
                subtaskId, result.owner(), maxResendDelay);
        return true;
    }

    /**
     * Put every in-flight result back to idle. Only safe once nothing can
     * complete the pending attempts any more.
     *
     * @return number of results released
     */
    public int releaseInFlight() {
        int released = 0;
        for (WaitingTaskResult result : results.values()) {
            if (result.inFlight()) {
                result.release();
                released++;
            }
        }
        return released;
    }

    public Optional<WaitingTaskResult> get(String subtaskId) {
        return Optional.ofNullable(results.get(subtaskId));
    }

    public int size() {
        return results.size();
    }

    public int inFlightCount() {
        int count = 0;
        for (WaitingTaskResult result : results.values()) {
            if (result.inFlight()) {
                count++;
            }
        }
        return count;
    }
}
