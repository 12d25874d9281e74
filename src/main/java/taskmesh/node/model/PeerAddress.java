package taskmesh.node.model;

import taskmesh.node.exception.ValidationException;

/**
 * Network endpoint of a peer's task server.
 */
public record PeerAddress(String host, int port) {

    public PeerAddress {
        if (host == null || host.isBlank()) {
            throw new ValidationException("host is required");
        }
        if (port <= 0 || port > 65535) {
            throw new ValidationException("port must be between 1 and 65535, got " + port);
        }
    }

    public static PeerAddress of(String host, int port) {
        return new PeerAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
