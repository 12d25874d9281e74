package taskmesh.node.spi;

import taskmesh.node.exception.PaymentException;

/**
 * Opaque payment backend.
 */
public interface PaymentService {

    /**
     * Pay {@code amount} for a verified subtask.
     *
     * @throws PaymentException when the backend refuses the payment
     */
    PaymentHandle pay(String subtaskId, long amount);

    /** Price agreed for a subtask of one of our tasks. */
    long rewardFor(String subtaskId);

    /** Record a reward announced by a requester for work we computed. */
    void receiveReward(String subtaskId, long amount);
}
