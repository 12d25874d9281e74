package taskmesh.node.spi;

import taskmesh.node.model.TrustRole;

/**
 * Receives signed trust deltas for a peer.
 */
@FunctionalInterface
public interface ReputationSink {

    void apply(String peerId, TrustRole role, double delta);
}
