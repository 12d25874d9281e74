package taskmesh.node.model;

import java.util.Objects;

/**
 * Peer that computed one of our subtasks, and where to reach it.
 */
public record ComputingPeer(String nodeId, PeerAddress address) {

    public ComputingPeer {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        Objects.requireNonNull(address, "address is required");
    }
}
