package taskmesh.node.trust;

import taskmesh.node.model.TrustRole;
import taskmesh.node.spi.LocalTaskManager;
import taskmesh.node.spi.ReputationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns verification outcomes into bounded trust deltas.
 *
 * Computing trust is graded by the subtask's trust modifier, so bigger
 * subtasks move it further. Requesting trust always moves by {@code maxTrust}.
 */
public class TrustLedger {

    private static final Logger log = LoggerFactory.getLogger(TrustLedger.class);

    private final ReputationSink sink;
    private final LocalTaskManager taskManager;
    private final double minTrust;
    private final double maxTrust;

    public TrustLedger(ReputationSink sink, LocalTaskManager taskManager, double minTrust, double maxTrust) {
        if (minTrust > maxTrust) {
            throw new IllegalArgumentException("minTrust must not exceed maxTrust");
        }
        this.sink = sink;
        this.taskManager = taskManager;
        this.minTrust = minTrust;
        this.maxTrust = maxTrust;
    }

    /** Clamp a raw trust modifier into [minTrust, maxTrust]. NaN counts as minTrust. */
    public double boundedDelta(double raw) {
        if (Double.isNaN(raw)) {
            return minTrust;
        }
        return Math.min(Math.max(raw, minTrust), maxTrust);
    }

    public void increaseComputing(String peerId, String subtaskId) {
        double delta = boundedDelta(taskManager.trustModifier(subtaskId));
        log.debug("Increasing computing trust of {} by {} for subtask {}", peerId, delta, subtaskId);
        sink.apply(peerId, TrustRole.COMPUTING, delta);
    }

    public void decreaseComputing(String peerId, String subtaskId) {
        double delta = boundedDelta(taskManager.trustModifier(subtaskId));
        log.debug("Decreasing computing trust of {} by {} for subtask {}", peerId, delta, subtaskId);
        sink.apply(peerId, TrustRole.COMPUTING, -delta);
    }

    public void increaseRequesting(String peerId) {
        log.debug("Increasing requesting trust of {} by {}", peerId, maxTrust);
        sink.apply(peerId, TrustRole.REQUESTING, maxTrust);
    }

    public void decreaseRequesting(String peerId) {
        log.debug("Decreasing requesting trust of {} by {}", peerId, maxTrust);
        sink.apply(peerId, TrustRole.REQUESTING, -maxTrust);
    }

    public double minTrust() {
        return minTrust;
    }

    public double maxTrust() {
        return maxTrust;
    }
}
