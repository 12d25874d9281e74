package taskmesh.node.exception;

/**
 * Reward value could not be turned into a payment.
 */
public class PaymentException extends MarketplaceException {

    public PaymentException(String message) {
        super(message);
    }

    public PaymentException(String message, Throwable cause) {
        super(message, cause);
    }
}
