package taskmesh.node.model;

/**
 * Role a peer played in an interaction, each tracked with its own trust score.
 */
public enum TrustRole {
    /** Peer computed a subtask for us */
    COMPUTING,
    /** Peer requested work from us and verified it */
    REQUESTING
}
