package taskmesh.node.model;

/**
 * How a computed result is carried to the task owner.
 */
public enum ResultType {
    /** Result bytes travel inline in the report message */
    DATA,
    /** Result is a set of files fetched through the resource layer */
    FILES
}
