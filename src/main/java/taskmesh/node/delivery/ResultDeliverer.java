package taskmesh.node.delivery;

/**
 * Starts one delivery attempt. The attempt reports back through
 * {@link ResultDeliveryQueue#acknowledge(String)} or
 * {@link ResultDeliveryQueue#deliveryFailed(String, java.time.Instant)}.
 */
@FunctionalInterface
public interface ResultDeliverer {

    void deliver(WaitingTaskResult result);
}
