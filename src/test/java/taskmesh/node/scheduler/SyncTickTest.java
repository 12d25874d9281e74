package taskmesh.node.scheduler;

import taskmesh.node.config.NodeConfig;
import taskmesh.node.delivery.ResultDeliveryQueue;
import taskmesh.node.model.ResultType;
import taskmesh.node.registry.TaskHeaderRegistry;
import taskmesh.node.session.MessageLog;
import taskmesh.node.session.TaskSessionCoordinator;
import taskmesh.node.spi.SyncHook;
import taskmesh.node.support.FakeSessionOpener;
import taskmesh.node.support.FakeTaskManager;
import taskmesh.node.support.MutableClock;
import taskmesh.node.support.RecordingPaymentService;
import taskmesh.node.support.RecordingReputationSink;
import taskmesh.node.support.RecordingTaskComputer;
import taskmesh.node.trust.TrustLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static taskmesh.node.support.TestHeaders.header;

class SyncTickTest {

    private MutableClock clock;
    private TaskHeaderRegistry registry;
    private ResultDeliveryQueue queue;
    private TaskSessionCoordinator coordinator;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        NodeConfig config = NodeConfig.defaults();
        FakeTaskManager taskManager = new FakeTaskManager();
        registry = new TaskHeaderRegistry(taskManager, header -> true, config.removedTaskCooldown(), clock);
        queue = new ResultDeliveryQueue(config.maxResultSendingDelay());
        coordinator = new TaskSessionCoordinator(config, registry,
                new TrustLedger(new RecordingReputationSink(), taskManager, 0.0, 1.0), queue,
                new FakeSessionOpener(), new RecordingPaymentService(), new RecordingTaskComputer(),
                new MessageLog(5, clock), Runnable::run, clock);
        calls = new ArrayList<>();
    }

    @Test
    void tickExpiresHeadersFlushesResultsThenRunsHooks() {
        registry.add(header("t1", 10));
        queue.enqueue("s1", "t1", "42", ResultType.DATA, "10.0.0.7", 40102);
        clock.advanceSeconds(11);

        SyncHook gossip = SyncHook.of("gossip", () -> {
            calls.add("gossip:" + registry.contains("t1") + ":" + queue.size());
        });
        new SyncTick(registry, queue, coordinator, List.of(gossip), clock).run();

        assertFalse(registry.contains("t1"));
        assertEquals(0, queue.size());
        assertEquals(List.of("gossip:false:0"), calls);
    }

    @Test
    void failingStepDoesNotStopLaterOnes() {
        SyncHook broken = SyncHook.of("broken", () -> {
            throw new IllegalStateException("boom");
        });
        SyncHook after = SyncHook.of("after", () -> calls.add("after"));

        new SyncTick(registry, queue, coordinator, List.of(broken, after), clock).run();

        assertEquals(List.of("after"), calls);
    }

    @Test
    void submitCompletesWithResultOrFailure() throws Exception {
        assertEquals(3, NodeScheduler.submitTo(Runnable::run, () -> 3).get());

        var failed = NodeScheduler.submitTo(Runnable::run, () -> {
            throw new IllegalArgumentException("bad");
        });
        assertTrue(failed.isCompletedExceptionally());
    }
}
