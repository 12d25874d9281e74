package taskmesh.node.spi;

/**
 * Reference to a payment issued by the {@link PaymentService}.
 */
public record PaymentHandle(String paymentId, String subtaskId, long amount) {
}
