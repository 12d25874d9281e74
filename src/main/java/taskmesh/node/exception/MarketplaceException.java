package taskmesh.node.exception;

/**
 * Base exception for the marketplace node.
 */
public class MarketplaceException extends RuntimeException {

    public MarketplaceException(String message) {
        super(message);
    }

    public MarketplaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
