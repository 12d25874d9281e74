package taskmesh.node.spi;

import taskmesh.node.model.PeerAddress;

import java.util.concurrent.CompletableFuture;

/**
 * Transport entry point: opens a request/response channel to a peer.
 * The future fails with a
 * {@link taskmesh.node.exception.ConnectionFailureException} when the peer
 * cannot be reached. It may complete on any thread.
 */
@FunctionalInterface
public interface SessionOpener {

    CompletableFuture<PeerSession> open(PeerAddress peer);
}
