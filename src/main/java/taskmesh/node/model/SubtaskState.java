package taskmesh.node.model;

/**
 * Progress of a subtask through the request/verify protocol.
 */
public enum SubtaskState {
    /** Resources for the subtask were requested from the owner */
    REQUESTED,
    /** Owner granted the resources */
    RESOURCE_GRANTED,
    /** Local computation running */
    COMPUTING,
    /** Result handed to a session, waiting for the owner's acknowledgment */
    RESULT_SUBMITTED,
    /** Owner acknowledged the result and is verifying it */
    VERIFICATION_PENDING,
    /** Result accepted */
    ACCEPTED,
    /** Resource request or result rejected */
    REJECTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED;
    }
}
