package taskmesh.node.exception;

/**
 * Thrown when a task header or a computed result is malformed.
 * Callers log it and leave their state untouched.
 */
public class ValidationException extends MarketplaceException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
