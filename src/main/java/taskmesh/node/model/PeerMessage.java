package taskmesh.node.model;

import java.time.Instant;

/**
 * One entry of the recent protocol message log.
 */
public record PeerMessage(Direction direction, String type, Instant timestamp, PeerAddress peer, String description) {

    public enum Direction {
        SENT,
        RECEIVED
    }
}
