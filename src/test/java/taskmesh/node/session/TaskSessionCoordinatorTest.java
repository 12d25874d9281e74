package taskmesh.node.session;

import taskmesh.node.config.NodeConfig;
import taskmesh.node.delivery.ResultDeliveryQueue;
import taskmesh.node.exception.AlreadyResolvedException;
import taskmesh.node.exception.ConnectionFailureException;
import taskmesh.node.exception.PaymentException;
import taskmesh.node.model.ComputingPeer;
import taskmesh.node.model.NodeCapabilities;
import taskmesh.node.model.PeerAddress;
import taskmesh.node.model.ResultType;
import taskmesh.node.model.SubtaskState;
import taskmesh.node.model.TrustRole;
import taskmesh.node.registry.TaskHeaderRegistry;
import taskmesh.node.support.FakePeerSession;
import taskmesh.node.support.FakeSessionOpener;
import taskmesh.node.support.FakeTaskManager;
import taskmesh.node.support.MutableClock;
import taskmesh.node.support.RecordingPaymentService;
import taskmesh.node.support.RecordingReputationSink;
import taskmesh.node.support.RecordingTaskComputer;
import taskmesh.node.trust.TrustLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static taskmesh.node.support.TestHeaders.OWNER_HOST;
import static taskmesh.node.support.TestHeaders.OWNER_PORT;
import static taskmesh.node.support.TestHeaders.header;

/**
 * Coordinator driven synchronously: sessions complete inline and the loop
 * is a direct executor.
 */
class TaskSessionCoordinatorTest {

    private static final PeerAddress OWNER = new PeerAddress(OWNER_HOST, OWNER_PORT);
    private static final ComputingPeer WORKER = new ComputingPeer("worker-1", new PeerAddress("10.0.0.9", 40102));
    private static final NodeCapabilities CAPS = new NodeCapabilities(1000.0, 1024, 2048, 4);

    private MutableClock clock;
    private NodeConfig config;
    private FakeTaskManager taskManager;
    private TaskHeaderRegistry registry;
    private RecordingReputationSink reputation;
    private ResultDeliveryQueue queue;
    private FakeSessionOpener sessions;
    private RecordingPaymentService payments;
    private RecordingTaskComputer computer;
    private MessageLog messages;
    private TaskSessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        config = NodeConfig.defaults()
                .withNodeId("node-test")
                .withTaskServerAddress("10.0.0.1", 40102);
        taskManager = new FakeTaskManager();
        registry = new TaskHeaderRegistry(taskManager, header -> true, config.removedTaskCooldown(), clock);
        reputation = new RecordingReputationSink();
        queue = new ResultDeliveryQueue(config.maxResultSendingDelay());
        sessions = new FakeSessionOpener();
        payments = new RecordingPaymentService();
        computer = new RecordingTaskComputer();
        messages = new MessageLog(5, clock);
        coordinator = newCoordinator(config);
    }

    private TaskSessionCoordinator newCoordinator(NodeConfig cfg) {
        TrustLedger ledger = new TrustLedger(reputation, taskManager, cfg.minTrust(), cfg.maxTrust());
        return new TaskSessionCoordinator(cfg, registry, ledger, queue, sessions, payments, computer, messages,
                Runnable::run, clock);
    }

    /** Walk a subtask of task t1 up to the point where the owner must answer. */
    private void deliverResult(String subtaskId) {
        if (!registry.contains("t1")) {
            registry.add(header("t1", 100));
        }
        coordinator.requestTask("t1", CAPS);
        coordinator.submitResult(subtaskId, "t1", "42", ResultType.DATA, OWNER_HOST, OWNER_PORT);
        queue.flush(clock.instant(), coordinator::deliverResult);
    }

    // ---- task requests ----

    @Test
    void taskRequestIsSentToOwner() {
        registry.add(header("t1", 100));

        CompletableFuture<Void> done = coordinator.requestTask("t1", CAPS);

        assertTrue(done.isDone());
        FakePeerSession session = sessions.session(OWNER);
        assertEquals(1, session.taskRequests.size());
        assertEquals("node-test", session.taskRequests.get(0).nodeId());
        assertEquals(1, registry.activeEntry("t1").orElseThrow().outstandingRequests());
        assertEquals("TaskRequest", messages.snapshot().get(0).type());
    }

    @Test
    @DisplayName("Connection failure on a task request evicts the header and its idle entry")
    void connectionFailureEvictsTask() {
        registry.add(header("t1", 100));
        sessions.unreachable(OWNER);

        coordinator.requestTask("t1", CAPS);

        assertFalse(registry.contains("t1"));
        assertTrue(registry.activeEntry("t1").isEmpty());
        assertTrue(registry.isInCooldown("t1"));
        assertEquals(1, computer.taskRejections.size());
        assertEquals("Connection failed", computer.taskRejections.get(0).reason());
    }

    @Test
    void connectionFailureKeepsTaskWhenEvictionDisabled() {
        coordinator = newCoordinator(config.withEvictOnConnectionFailure(false));
        registry.add(header("t1", 100));
        sessions.unreachable(OWNER);

        coordinator.requestTask("t1", CAPS);

        assertTrue(registry.contains("t1"));
        assertEquals(0, registry.activeEntry("t1").orElseThrow().outstandingRequests());
        assertEquals(1, computer.taskRejections.size());
    }

    @Test
    void requestForUnknownTaskFails() {
        assertThrows(IllegalArgumentException.class, () -> coordinator.requestTask("ghost", CAPS));
        assertEquals(0, sessions.openCount());
    }

    @Test
    void headerRemovedWhileConnectingDropsTheRequest() {
        registry.add(header("t1", 100));
        sessions.holdOpenings(true);
        coordinator.requestTask("t1", CAPS);

        registry.remove("t1");
        sessions.releaseHeld();

        assertTrue(sessions.session(OWNER).taskRequests.isEmpty());
        assertTrue(registry.activeEntry("t1").isEmpty());
    }

    @Test
    void failureAfterHeaderExpiredOnlyReleasesCounter() {
        registry.add(header("t1", 10));
        sessions.holdOpenings(true);
        sessions.unreachable(OWNER);
        coordinator.requestTask("t1", CAPS);

        clock.advanceSeconds(11);
        registry.tick(clock.instant());
        sessions.releaseHeld();

        assertTrue(registry.activeEntry("t1").isEmpty());
        assertTrue(computer.taskRejections.isEmpty());
    }

    @Test
    void refusedTaskRequestReleasesCounter() {
        registry.add(header("t1", 100));
        coordinator.requestTask("t1", CAPS);

        coordinator.taskRequestRefused("t1", "no subtasks left");

        assertEquals(0, registry.activeEntry("t1").orElseThrow().outstandingRequests());
        assertEquals("no subtasks left", computer.taskRejections.get(0).reason());
    }

    @Test
    void randomRequestPicksSupportedTask() {
        assertTrue(coordinator.requestRandomTask(CAPS).isEmpty());

        registry.add(header("t1", 100));

        assertEquals("t1", coordinator.requestRandomTask(CAPS).orElseThrow());
        assertEquals(1, sessions.session(OWNER).taskRequests.size());
    }

    // ---- resources ----

    @Test
    void resourceRequestConnectionFailureRejectsSubtask() {
        registry.add(header("t1", 100));
        sessions.unreachable(OWNER);

        coordinator.requestResource("t1", "s1", "bundle.zip", OWNER);

        assertEquals(SubtaskState.REJECTED, coordinator.subtaskState("s1").orElseThrow());
        assertEquals("s1", computer.resourceRejections.get(0).id());
        assertFalse(registry.contains("t1"));
    }

    @Test
    @DisplayName("Late resource failure for a retracted task neither signals nor extends the cool-down")
    void resourceFailureAfterRetractionIsIgnored() {
        registry.add(header("t1", 100));
        registry.remove("t1");

        clock.advanceSeconds(200);
        sessions.unreachable(OWNER);
        coordinator.requestResource("t1", "s1", "bundle.zip", OWNER);

        assertTrue(computer.resourceRejections.isEmpty());
        assertEquals(SubtaskState.REJECTED, coordinator.subtaskState("s1").orElseThrow());

        clock.advanceSeconds(60);
        registry.tick(clock.instant());
        assertTrue(registry.add(header("t1", 100)));
    }

    @Test
    void resourceGrantAdvancesSubtask() {
        coordinator.requestResource("t1", "s1", "bundle.zip", OWNER);
        assertEquals(SubtaskState.REQUESTED, coordinator.subtaskState("s1").orElseThrow());

        coordinator.resourceRequestResult("s1", true, null);
        assertEquals(SubtaskState.RESOURCE_GRANTED, coordinator.subtaskState("s1").orElseThrow());

        coordinator.computationStarted("s1");
        assertEquals(SubtaskState.COMPUTING, coordinator.subtaskState("s1").orElseThrow());
    }

    @Test
    void resourceDenialNotifiesLocalComputer() {
        coordinator.requestResource("t1", "s1", "bundle.zip", OWNER);

        coordinator.resourceRequestResult("s1", false, "too big");

        assertEquals(SubtaskState.REJECTED, coordinator.subtaskState("s1").orElseThrow());
        assertEquals("too big", computer.resourceRejections.get(0).reason());
    }

    // ---- delivery and verification ----

    @Test
    void deliveredResultAwaitsVerification() {
        deliverResult("s1");

        assertEquals(0, queue.size());
        assertTrue(coordinator.isAwaitingVerification("s1"));
        assertEquals(SubtaskState.VERIFICATION_PENDING, coordinator.subtaskState("s1").orElseThrow());
        assertEquals(new PeerAddress("10.0.0.1", 40102), sessions.session(OWNER).replyAddresses.get("s1"));
    }

    @Test
    void failedDeliveryStaysQueuedWithBackoff() {
        sessions.session(OWNER).failReports(true);

        deliverResult("s1");

        assertEquals(1, queue.size());
        assertFalse(queue.get("s1").orElseThrow().inFlight());
        assertEquals(Duration.ofSeconds(100), queue.get("s1").orElseThrow().retryDelay());
        assertFalse(coordinator.isAwaitingVerification("s1"));
    }

    @Test
    void failedDeliveryDoesNotMarkResultSubmitted() {
        sessions.session(OWNER).failReports(true);
        coordinator.computationStarted("s1");

        deliverResult("s1");

        assertEquals(SubtaskState.COMPUTING, coordinator.subtaskState("s1").orElseThrow());
    }

    @Test
    void stoppedLoopLeavesResultIdleForRetry() {
        TrustLedger ledger = new TrustLedger(reputation, taskManager, 0.0, 1.0);
        coordinator = new TaskSessionCoordinator(config, registry, ledger, queue, sessions, payments, computer,
                messages, r -> {
                    throw new RejectedExecutionException("loop stopped");
                }, clock);
        coordinator.submitResult("s1", "t1", "42", ResultType.DATA, OWNER_HOST, OWNER_PORT);

        queue.flush(clock.instant(), coordinator::deliverResult);

        assertEquals(0, queue.inFlightCount());
        assertEquals(1, queue.size());
        assertTrue(sessions.session(OWNER).reports.isEmpty());
    }

    @Test
    void acceptedVerificationRaisesRequesterTrustAndRecordsReward() {
        deliverResult("s1");

        assertTrue(coordinator.verificationAccepted("s1", "25"));

        assertEquals(1.0, reputation.total("owner-t1", TrustRole.REQUESTING));
        assertEquals(25L, payments.received.get("s1"));
        assertEquals(SubtaskState.ACCEPTED, coordinator.subtaskState("s1").orElseThrow());
        assertEquals(0, registry.activeEntry("t1").orElseThrow().outstandingRequests());
    }

    @Test
    void rejectedVerificationLowersTrustAndDropsTask() {
        deliverResult("s1");

        assertTrue(coordinator.verificationRejected("s1", "wrong answer"));

        assertEquals(-1.0, reputation.total("owner-t1", TrustRole.REQUESTING));
        assertFalse(registry.contains("t1"));
        assertTrue(registry.activeEntry("t1").isEmpty());
    }

    @Test
    @DisplayName("A second verdict for the same subtask is refused")
    void doubleVerificationIsRefused() {
        deliverResult("s1");
        coordinator.verificationRejected("s1", "wrong answer");

        assertThrows(AlreadyResolvedException.class, () -> coordinator.verificationAccepted("s1", "10"));
        assertEquals(-1.0, reputation.total("owner-t1", TrustRole.REQUESTING));
    }

    @Test
    void verificationForUnknownSubtaskIsIgnored() {
        assertFalse(coordinator.verificationAccepted("ghost", "10"));
        assertFalse(coordinator.verificationRejected("ghost", "bad"));
        assertTrue(reputation.deltas.isEmpty());
    }

    @Test
    void headerExpiringMidVerificationReapsEntryOnVerdict() {
        deliverResult("s1");
        clock.advanceSeconds(101);
        registry.tick(clock.instant());
        assertTrue(registry.activeEntry("t1").isPresent());

        coordinator.verificationAccepted("s1", "5");

        assertTrue(registry.activeEntry("t1").isEmpty());
        assertEquals(1.0, reputation.total("owner-t1", TrustRole.REQUESTING));
    }

    @Test
    void unreadableRewardStillCountsAsAccepted() {
        deliverResult("s1");

        assertTrue(coordinator.verificationAccepted("s1", "lots"));

        assertTrue(payments.received.isEmpty());
        assertEquals(1.0, reputation.total("owner-t1", TrustRole.REQUESTING));
    }

    // ---- requester side ----

    @Test
    void acceptPaysAndNotifiesWorker() {
        taskManager.trustModifier("s1", 0.4);

        assertTrue(coordinator.accept("s1", WORKER, "30"));

        assertEquals(30L, payments.payments.get(0).amount());
        assertEquals(30L, sessions.session(WORKER.address()).rewards.get("s1"));
        assertEquals(0.4, reputation.total("worker-1", TrustRole.COMPUTING), 1e-9);
        assertEquals(SubtaskState.ACCEPTED, coordinator.requesterOutcome("s1").orElseThrow());
    }

    @Test
    void acceptWithoutRewardUsesAgreedPrice() {
        payments.price("s1", 12);

        coordinator.accept("s1", WORKER);

        assertEquals(12L, payments.payments.get(0).amount());
    }

    @Test
    void invalidRewardSkipsPaymentButKeepsTrust() {
        assertFalse(coordinator.accept("s1", WORKER, "-3"));

        assertTrue(payments.payments.isEmpty());
        assertTrue(sessions.session(WORKER.address()).rewards.isEmpty());
        assertEquals(0.5, reputation.total("worker-1", TrustRole.COMPUTING), 1e-9);
    }

    @Test
    void refusedPaymentKeepsTrust() {
        payments.refusePayments();

        assertFalse(coordinator.accept("s1", WORKER, "10"));
        assertEquals(0.5, reputation.total("worker-1", TrustRole.COMPUTING), 1e-9);
    }

    @Test
    void unreachableWorkerDoesNotUndoAcceptance() {
        sessions.unreachable(WORKER.address());

        assertTrue(coordinator.accept("s1", WORKER, "10"));
        assertEquals(1, payments.payments.size());
    }

    @Test
    void rejectLowersTrustAndNotifiesWorker() {
        coordinator.reject("s1", WORKER, "checksum mismatch");

        assertEquals(-0.5, reputation.total("worker-1", TrustRole.COMPUTING), 1e-9);
        assertEquals(1, sessions.session(WORKER.address()).rejectionNotices.size());
    }

    @Test
    void acceptAndRejectAreMutuallyExclusive() {
        coordinator.accept("s1", WORKER, "10");

        assertThrows(AlreadyResolvedException.class, () -> coordinator.reject("s1", WORKER, "late"));
        assertThrows(AlreadyResolvedException.class, () -> coordinator.accept("s1", WORKER, "10"));
        assertEquals(1, payments.payments.size());
    }

    @Test
    void rewardParsing() {
        assertEquals(7L, TaskSessionCoordinator.parseReward("s", " 7 "));
        assertThrows(PaymentException.class, () -> TaskSessionCoordinator.parseReward("s", null));
        assertThrows(PaymentException.class, () -> TaskSessionCoordinator.parseReward("s", "1.5"));
        assertThrows(PaymentException.class, () -> TaskSessionCoordinator.parseReward("s", "-1"));
    }

    // ---- housekeeping ----

    @Test
    void settledComputingOutcomesArePurgedAfterRetention() {
        deliverResult("s1");
        coordinator.verificationAccepted("s1", "10");

        assertEquals(0, coordinator.purgeResolved(clock.instant().plusSeconds(100)));
        assertEquals(1, coordinator.purgeResolved(clock.instant().plusSeconds(241)));
        assertTrue(coordinator.subtaskState("s1").isEmpty());
    }

    @Test
    @DisplayName("An accepted subtask cannot be paid again once the retention window has passed")
    void acceptedSubtaskStaysSettledAfterRetention() {
        coordinator.accept("s1", WORKER, "10");

        clock.advanceSeconds(300);
        assertEquals(0, coordinator.purgeResolved(clock.instant()));

        assertThrows(AlreadyResolvedException.class, () -> coordinator.accept("s1", WORKER, "10"));
        assertThrows(AlreadyResolvedException.class, () -> coordinator.reject("s1", WORKER, "late"));
        assertEquals(SubtaskState.ACCEPTED, coordinator.requesterOutcome("s1").orElseThrow());
        assertEquals(1, payments.payments.size());
        assertEquals(0.5, reputation.total("worker-1", TrustRole.COMPUTING), 1e-9);
    }

    @Test
    void openerThrowingSynchronouslyCountsAsConnectionFailure() {
        TrustLedger ledger = new TrustLedger(reputation, taskManager, 0.0, 1.0);
        coordinator = new TaskSessionCoordinator(config, registry, ledger, queue,
                peer -> {
                    throw new ConnectionFailureException(peer, "no route");
                },
                payments, computer, messages, Runnable::run, clock);
        registry.add(header("t1", 100));

        coordinator.requestTask("t1", CAPS);

        assertFalse(registry.contains("t1"));
    }
}
