package taskmesh.node.exception;

import taskmesh.node.model.PeerAddress;

/**
 * Raised by the transport when a session to a peer cannot be opened or a
 * message cannot be sent over it.
 */
public class ConnectionFailureException extends MarketplaceException {

    private final PeerAddress peer;

    public ConnectionFailureException(PeerAddress peer, String message) {
        super("Connection to " + peer + " failed: " + message);
        this.peer = peer;
    }

    public ConnectionFailureException(PeerAddress peer, String message, Throwable cause) {
        super("Connection to " + peer + " failed: " + message, cause);
        this.peer = peer;
    }

    public PeerAddress peer() {
        return peer;
    }
}
