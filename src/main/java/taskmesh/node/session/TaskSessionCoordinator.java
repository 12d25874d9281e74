package taskmesh.node.session;

import taskmesh.node.config.NodeConfig;
import taskmesh.node.delivery.ResultDeliveryQueue;
import taskmesh.node.delivery.WaitingTaskResult;
import taskmesh.node.exception.AlreadyResolvedException;
import taskmesh.node.exception.ConnectionFailureException;
import taskmesh.node.exception.PaymentException;
import taskmesh.node.model.ComputingPeer;
import taskmesh.node.model.NodeCapabilities;
import taskmesh.node.model.PeerAddress;
import taskmesh.node.model.ResultType;
import taskmesh.node.model.SubtaskState;
import taskmesh.node.model.TaskHeader;
import taskmesh.node.model.TaskRequest;
import taskmesh.node.registry.ActiveTaskEntry;
import taskmesh.node.registry.TaskHeaderRegistry;
import taskmesh.node.spi.LocalTaskComputer;
import taskmesh.node.spi.PaymentHandle;
import taskmesh.node.spi.PaymentService;
import taskmesh.node.spi.PeerSession;
import taskmesh.node.spi.SessionOpener;
import taskmesh.node.trust.TrustLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Request/accept/reject/verify protocol for subtasks, on both sides of the
 * exchange.
 *
 * Computing side: ask owners for work, fetch resources, deliver results and
 * react to the owner's verdict. Requester side: accept or reject results
 * computed by others, pay, and adjust their computing trust.
 *
 * Every method must run on the coordination loop. Session futures complete
 * on transport threads and are re-dispatched onto {@code loop} before any
 * state is touched.
 */
public class TaskSessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TaskSessionCoordinator.class);
    private static final String CONNECTION_FAILED = "Connection failed";

    private final String nodeId;
    private final PeerAddress replyAddress;
    private final TaskHeaderRegistry registry;
    private final TrustLedger trustLedger;
    private final ResultDeliveryQueue deliveryQueue;
    private final SessionOpener sessionOpener;
    private final PaymentService paymentService;
    private final LocalTaskComputer taskComputer;
    private final MessageLog messages;
    private final Executor loop;
    private final Clock clock;
    private final boolean evictOnConnectionFailure;
    private final Duration resolvedRetention;

    // subtaskId -> taskId, results waiting for the owner's verdict
    private final Map<String, String> pendingVerifications = new HashMap<>();
    private final SubtaskOutcomes computed = new SubtaskOutcomes();
    private final SubtaskOutcomes requested = new SubtaskOutcomes();

    public TaskSessionCoordinator(NodeConfig config, TaskHeaderRegistry registry, TrustLedger trustLedger,
            ResultDeliveryQueue deliveryQueue, SessionOpener sessionOpener, PaymentService paymentService,
            LocalTaskComputer taskComputer, MessageLog messages, Executor loop, Clock clock) {
        this.nodeId = config.nodeId();
        this.replyAddress = config.taskServerAddress();
        this.evictOnConnectionFailure = config.evictOnConnectionFailure();
        this.resolvedRetention = config.removedTaskCooldown();
        this.registry = registry;
        this.trustLedger = trustLedger;
        this.deliveryQueue = deliveryQueue;
        this.sessionOpener = sessionOpener;
        this.paymentService = paymentService;
        this.taskComputer = taskComputer;
        this.messages = messages;
        this.loop = loop;
        this.clock = clock;
    }

    // ---- computing side: asking for work ----

    /**
     * Ask the owner of a random supported task for a subtask.
     *
     * @return the chosen task id, empty if nothing is supported
     */
    public Optional<String> requestRandomTask(NodeCapabilities capabilities) {
        Optional<String> taskId = registry.pickRandomSupported();
        taskId.ifPresent(id -> requestTask(id, capabilities));
        return taskId;
    }

    /**
     * Open a session to the task owner and request a subtask. A connection
     * failure evicts the task header.
     *
     * @return completes once the outcome has been applied on the loop
     */
    public CompletableFuture<Void> requestTask(String taskId, NodeCapabilities capabilities) {
        TaskHeader header = registry.header(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task " + taskId));
        registry.incrementRequests(taskId);
        PeerAddress owner = header.ownerAddress();

        return open(owner).handleAsync((session, error) -> {
            if (error != null) {
                taskRequestConnectionFailed(taskId, owner, error);
                return null;
            }
            if (!registry.contains(taskId)) {
                log.info("Task {} was removed while connecting, dropping request", taskId);
                registry.decrementRequests(taskId);
                return null;
            }
            try {
                session.requestTask(new TaskRequest(nodeId, taskId, capabilities));
                messages.sent("TaskRequest", owner, "Requesting subtask of " + taskId);
            } catch (ConnectionFailureException e) {
                taskRequestConnectionFailed(taskId, owner, e);
            }
            return null;
        }, loop);
    }

    private void taskRequestConnectionFailed(String taskId, PeerAddress owner, Throwable error) {
        log.warn("Cannot connect to task {} owner at {}: {}", taskId, owner, unwrap(error).getMessage());
        registry.decrementRequests(taskId);
        if (!registry.contains(taskId)) {
            log.debug("Task {} already removed, ignoring request failure", taskId);
            return;
        }
        taskComputer.taskRequestRejected(taskId, CONNECTION_FAILED);
        evict(taskId);
    }

    /** The owner answered our task request with a refusal. */
    public void taskRequestRefused(String taskId, String reason) {
        log.info("Task request for {} refused: {}", taskId, reason);
        registry.activeEntry(taskId)
                .ifPresent(entry -> messages.received("CannotAssignTask", entry.header().ownerAddress(), reason));
        registry.decrementRequests(taskId);
        taskComputer.taskRequestRejected(taskId, reason);
    }

    /**
     * Ask the owner for the resources of a granted subtask. A connection
     * failure evicts the task header.
     */
    public CompletableFuture<Void> requestResource(String taskId, String subtaskId, String resourceDescriptor,
            PeerAddress owner) {
        computed.transition(subtaskId, SubtaskState.REQUESTED);

        return open(owner).handleAsync((session, error) -> {
            if (error != null) {
                resourceRequestConnectionFailed(taskId, subtaskId, owner, error);
                return null;
            }
            try {
                session.requestResource(subtaskId, resourceDescriptor);
                messages.sent("ResourceRequest", owner, "Resources for subtask " + subtaskId);
            } catch (ConnectionFailureException e) {
                resourceRequestConnectionFailed(taskId, subtaskId, owner, e);
            }
            return null;
        }, loop);
    }

    private void resourceRequestConnectionFailed(String taskId, String subtaskId, PeerAddress owner,
            Throwable error) {
        log.warn("Cannot connect to task {} owner at {} for resources: {}",
                taskId, owner, unwrap(error).getMessage());
        settle(computed, subtaskId, SubtaskState.REJECTED);
        if (!registry.contains(taskId)) {
            log.debug("Task {} already removed, ignoring failed resource request for {}", taskId, subtaskId);
            return;
        }
        taskComputer.resourceRequestRejected(subtaskId, CONNECTION_FAILED);
        evict(taskId);
    }

    /** Owner's answer to a resource request. */
    public void resourceRequestResult(String subtaskId, boolean granted, String reason) {
        if (granted) {
            computed.transition(subtaskId, SubtaskState.RESOURCE_GRANTED);
            log.debug("Resources for subtask {} granted", subtaskId);
            return;
        }
        log.info("Resources for subtask {} rejected: {}", subtaskId, reason);
        settle(computed, subtaskId, SubtaskState.REJECTED);
        taskComputer.resourceRequestRejected(subtaskId, reason);
    }

    public void computationStarted(String subtaskId) {
        computed.transition(subtaskId, SubtaskState.COMPUTING);
    }

    private void evict(String taskId) {
        if (!evictOnConnectionFailure) {
            return;
        }
        log.warn("Removing task {} from task list", taskId);
        registry.remove(taskId);
    }

    // ---- computing side: results ----

    /** Queue a computed result for delivery to its owner. */
    public WaitingTaskResult submitResult(String subtaskId, String taskId, String payload, ResultType resultType,
            String ownerAddress, int ownerPort) {
        return deliveryQueue.enqueue(subtaskId, taskId, payload, resultType, ownerAddress, ownerPort);
    }

    /**
     * One delivery attempt for a queued result; plugged into
     * {@link ResultDeliveryQueue#flush}.
     */
    public CompletableFuture<Void> deliverResult(WaitingTaskResult result) {
        String subtaskId = result.subtaskId();
        PeerAddress owner = result.owner();

        return open(owner)
                .thenComposeAsync(session -> {
                    messages.sent("ReportComputedTask", owner, "Result of subtask " + subtaskId);
                    return session.reportComputedTask(subtaskId, result.payload(), result.resultType(),
                            replyAddress);
                }, loop)
                .<Void>handleAsync((ack, error) -> {
                    if (error != null) {
                        log.warn("Cannot deliver result of subtask {} to {}: {}",
                                subtaskId, owner, unwrap(error).getMessage());
                        deliveryQueue.deliveryFailed(subtaskId, clock.instant());
                    } else {
                        resultDelivered(result);
                    }
                    return null;
                }, loop)
                .whenComplete((ignored, error) -> {
                    if (error != null && unwrap(error) instanceof RejectedExecutionException) {
                        // loop is gone, nothing else touches the queue now
                        log.warn("Coordination loop stopped during delivery of subtask {}", subtaskId);
                        deliveryQueue.deliveryFailed(subtaskId, clock.instant());
                    }
                });
    }

    private void resultDelivered(WaitingTaskResult result) {
        String subtaskId = result.subtaskId();
        deliveryQueue.acknowledge(subtaskId);
        computed.transition(subtaskId, SubtaskState.RESULT_SUBMITTED);
        String previous = pendingVerifications.putIfAbsent(subtaskId, result.taskId());
        if (previous != null) {
            log.warn("Subtask {} was already waiting for verification of task {}", subtaskId, previous);
        }
        computed.transition(subtaskId, SubtaskState.VERIFICATION_PENDING);
        log.info("Result of subtask {} submitted, waiting for verification", subtaskId);
    }

    // ---- computing side: verdicts ----

    /**
     * The task owner accepted our result.
     *
     * @return false if we were not waiting for this verdict
     * @throws AlreadyResolvedException if a verdict was already applied
     */
    public boolean verificationAccepted(String subtaskId, String reward) {
        String taskId = consumePendingVerification(subtaskId, SubtaskState.ACCEPTED);
        if (taskId == null) {
            return false;
        }
        log.info("Subtask {} result accepted", subtaskId);
        ownerAddressOf(taskId).ifPresent(owner ->
                messages.received("SubtaskResultAccepted", owner, "Subtask " + subtaskId + ", reward " + reward));
        recordReward(subtaskId, reward);

        Optional<String> requester = requesterOf(taskId);
        registry.decrementRequests(taskId);
        requester.ifPresentOrElse(trustLedger::increaseRequesting,
                () -> log.warn("No requester known for task {}", taskId));
        return true;
    }

    /**
     * The task owner rejected our result. Its task is dropped from the list.
     *
     * @return false if we were not waiting for this verdict
     * @throws AlreadyResolvedException if a verdict was already applied
     */
    public boolean verificationRejected(String subtaskId, String reason) {
        String taskId = consumePendingVerification(subtaskId, SubtaskState.REJECTED);
        if (taskId == null) {
            return false;
        }
        log.info("Subtask {} result rejected: {}", subtaskId, reason);
        ownerAddressOf(taskId).ifPresent(owner ->
                messages.received("SubtaskResultRejected", owner, "Subtask " + subtaskId + ": " + reason));

        Optional<String> requester = requesterOf(taskId);
        registry.decrementRequests(taskId);
        requester.ifPresentOrElse(trustLedger::decreaseRequesting,
                () -> log.warn("No requester known for task {}", taskId));
        registry.remove(taskId);
        return true;
    }

    private String consumePendingVerification(String subtaskId, SubtaskState verdict) {
        String taskId = pendingVerifications.remove(subtaskId);
        if (taskId == null) {
            if (computed.isResolved(subtaskId)) {
                throw new AlreadyResolvedException(subtaskId,
                        computed.state(subtaskId).map(Enum::name).orElse("unknown"));
            }
            log.warn("Wasn't waiting for verification result for subtask {}", subtaskId);
            return null;
        }
        computed.resolve(subtaskId, verdict, clock.instant());
        return taskId;
    }

    private Optional<String> requesterOf(String taskId) {
        Optional<String> owner = registry.activeEntry(taskId).map(ActiveTaskEntry::header).map(TaskHeader::ownerId);
        if (owner.isPresent()) {
            return owner;
        }
        return registry.header(taskId).map(TaskHeader::ownerId);
    }

    private Optional<PeerAddress> ownerAddressOf(String taskId) {
        Optional<PeerAddress> owner = registry.activeEntry(taskId).map(e -> e.header().ownerAddress());
        if (owner.isPresent()) {
            return owner;
        }
        return registry.header(taskId).map(TaskHeader::ownerAddress);
    }

    private void recordReward(String subtaskId, String reward) {
        try {
            long amount = parseReward(subtaskId, reward);
            log.info("Getting {} for subtask {}", amount, subtaskId);
            paymentService.receiveReward(subtaskId, amount);
        } catch (PaymentException e) {
            log.error("Wrong reward for subtask {}: {}", subtaskId, e.getMessage());
        }
    }

    // ---- requester side ----

    /** Accept a result at the price agreed for the subtask. */
    public boolean accept(String subtaskId, ComputingPeer peer) {
        return accept(subtaskId, peer, Long.toString(paymentService.rewardFor(subtaskId)));
    }

    /**
     * Accept a result computed by {@code peer}: pay and raise its computing
     * trust. Trust is adjusted even when the payment cannot be made.
     *
     * @return true if the payment was issued
     * @throws AlreadyResolvedException if the subtask was already accepted or
     *                                  rejected
     */
    public boolean accept(String subtaskId, ComputingPeer peer, String reward) {
        requested.resolve(subtaskId, SubtaskState.ACCEPTED, clock.instant());
        boolean paid = payForSubtask(subtaskId, peer, reward);
        trustLedger.increaseComputing(peer.nodeId(), subtaskId);
        return paid;
    }

    private boolean payForSubtask(String subtaskId, ComputingPeer peer, String reward) {
        long amount;
        try {
            amount = parseReward(subtaskId, reward);
            PaymentHandle handle = paymentService.pay(subtaskId, amount);
            log.info("Paying {} for subtask {} (payment {})", amount, subtaskId, handle.paymentId());
        } catch (PaymentException e) {
            log.warn("Payment for subtask {} failed: {}", subtaskId, e.getMessage());
            return false;
        }
        notifyPeer(peer.address(), "RewardForTask", subtaskId,
                session -> session.sendRewardForTask(subtaskId, amount));
        return true;
    }

    /**
     * Reject a result computed by {@code peer} and lower its computing trust.
     *
     * @throws AlreadyResolvedException if the subtask was already accepted or
     *                                  rejected
     */
    public void reject(String subtaskId, ComputingPeer peer, String reason) {
        requested.resolve(subtaskId, SubtaskState.REJECTED, clock.instant());
        log.info("Rejecting result of subtask {} from {}: {}", subtaskId, peer.nodeId(), reason);
        trustLedger.decreaseComputing(peer.nodeId(), subtaskId);
        notifyPeer(peer.address(), "ResultRejected", subtaskId,
                session -> session.sendResultRejected(subtaskId));
    }

    private void notifyPeer(PeerAddress peer, String type, String subtaskId, Consumer<PeerSession> send) {
        open(peer).handleAsync((session, error) -> {
            if (error != null) {
                log.warn("Cannot connect to {} to deliver {} for subtask {}: {}",
                        peer, type, subtaskId, unwrap(error).getMessage());
                return null;
            }
            try {
                send.accept(session);
                messages.sent(type, peer, "Subtask " + subtaskId);
            } catch (ConnectionFailureException e) {
                log.warn("Cannot deliver {} for subtask {}: {}", type, subtaskId, e.getMessage());
            }
            return null;
        }, loop);
    }

    static long parseReward(String subtaskId, String reward) {
        if (reward == null || reward.isBlank()) {
            throw new PaymentException("Missing reward for subtask " + subtaskId);
        }
        long amount;
        try {
            amount = Long.parseLong(reward.trim());
        } catch (NumberFormatException e) {
            throw new PaymentException("Wrong reward amount " + reward + " for subtask " + subtaskId, e);
        }
        if (amount < 0) {
            throw new PaymentException("Negative reward " + amount + " for subtask " + subtaskId);
        }
        return amount;
    }

    // ---- housekeeping ----

    /**
     * Forget settled computing-side subtasks older than the retention window.
     * Accept and reject decisions are kept for the node's lifetime so a
     * subtask is never paid or penalised twice.
     */
    public int purgeResolved(Instant now) {
        Instant cutoff = now.minus(resolvedRetention);
        return computed.purgeResolvedBefore(cutoff);
    }

    public Optional<SubtaskState> subtaskState(String subtaskId) {
        return computed.state(subtaskId);
    }

    public Optional<SubtaskState> requesterOutcome(String subtaskId) {
        return requested.state(subtaskId);
    }

    public boolean isAwaitingVerification(String subtaskId) {
        return pendingVerifications.containsKey(subtaskId);
    }

    public int pendingVerificationCount() {
        return pendingVerifications.size();
    }

    // ---- sessions ----

    private CompletableFuture<PeerSession> open(PeerAddress peer) {
        try {
            CompletableFuture<PeerSession> opening = sessionOpener.open(peer);
            if (opening == null) {
                return CompletableFuture.failedFuture(new ConnectionFailureException(peer, "no session"));
            }
            return opening;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void settle(SubtaskOutcomes outcomes, String subtaskId, SubtaskState state) {
        if (!outcomes.isResolved(subtaskId)) {
            outcomes.resolve(subtaskId, state, clock.instant());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
