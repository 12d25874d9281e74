package taskmesh.node;

import taskmesh.node.config.NodeConfig;
import taskmesh.node.delivery.ResultDeliveryQueue;
import taskmesh.node.delivery.WaitingTaskResult;
import taskmesh.node.exception.MarketplaceException;
import taskmesh.node.model.ComputingPeer;
import taskmesh.node.model.PeerAddress;
import taskmesh.node.model.PeerMessage;
import taskmesh.node.model.ResultType;
import taskmesh.node.model.SubtaskState;
import taskmesh.node.model.TaskHeaderSummary;
import taskmesh.node.registry.TaskHeaderRegistry;
import taskmesh.node.scheduler.NodeScheduler;
import taskmesh.node.scheduler.SyncTick;
import taskmesh.node.server.NodeHttpServer;
import taskmesh.node.session.MessageLog;
import taskmesh.node.session.TaskSessionCoordinator;
import taskmesh.node.spi.CapabilityFilter;
import taskmesh.node.spi.LocalTaskComputer;
import taskmesh.node.spi.LocalTaskManager;
import taskmesh.node.spi.PaymentService;
import taskmesh.node.spi.ReputationSink;
import taskmesh.node.spi.SessionOpener;
import taskmesh.node.spi.SyncHook;
import taskmesh.node.trust.InMemoryTrustScores;
import taskmesh.node.trust.TrustLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Composition root of a marketplace node.
 *
 * Wires registry, trust ledger, delivery queue and session coordinator
 * around one coordination loop. Every mutation is submitted to the loop and
 * returns a future that completes with the result or the exception thrown
 * on the loop.
 *
 * Usage:
 *
 * <pre>
 * MarketplaceNode node = MarketplaceNode.builder(NodeConfig.fromEnv())
 *         .sessionOpener(transport)
 *         .paymentService(payments)
 *         .taskManager(tasks)
 *         .taskComputer(computer)
 *         .build();
 * node.start();
 * // ...
 * node.close();
 * </pre>
 */
public final class MarketplaceNode implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceNode.class);
    private static final long READ_TIMEOUT_SEC = 5;

    private final NodeConfig config;
    private final Clock clock;
    private final Instant startedAt;
    private final TaskHeaderRegistry registry;
    private final TrustLedger trustLedger;
    private final ResultDeliveryQueue deliveryQueue;
    private final MessageLog messages;
    private final TaskSessionCoordinator coordinator;
    private final SyncTick syncTick;
    private final Executor loop;

    // absent when the caller supplies its own loop
    private final NodeScheduler scheduler;
    private final boolean httpEnabled;
    private NodeHttpServer httpServer;

    private MarketplaceNode(Builder b) {
        this.config = b.config;
        this.clock = b.clock;
        this.startedAt = clock.instant();

        log.info("Initializing node with config: {}", config);

        ReputationSink sink = b.reputationSink != null
                ? b.reputationSink
                : new InMemoryTrustScores(config.minTrust(), config.maxTrust());

        this.registry = new TaskHeaderRegistry(b.taskManager, b.capabilityFilter,
                config.removedTaskCooldown(), clock);
        this.trustLedger = new TrustLedger(sink, b.taskManager, config.minTrust(), config.maxTrust());
        this.deliveryQueue = new ResultDeliveryQueue(config.maxResultSendingDelay());
        this.messages = new MessageLog(config.recentMessageCapacity(), clock);

        // the tick needs the coordinator, the coordinator needs the loop
        Executor callerLoop = b.loop;
        Runnable tick = () -> runTick();
        this.scheduler = callerLoop == null ? new NodeScheduler(tick, config) : null;
        this.loop = callerLoop != null ? callerLoop : scheduler.executor();

        this.coordinator = new TaskSessionCoordinator(config, registry, trustLedger, deliveryQueue,
                b.sessionOpener, b.paymentService, b.taskComputer, messages, loop, clock);
        this.syncTick = new SyncTick(registry, deliveryQueue, coordinator, b.syncHooks, clock);
        this.httpEnabled = b.httpEnabled;
    }

    public static Builder builder(NodeConfig config) {
        return new Builder(config);
    }

    private void runTick() {
        syncTick.run();
    }

    // ---- lifecycle ----

    /**
     * Start the periodic tick and, if enabled, the status HTTP server.
     */
    public synchronized void start() {
        if (scheduler != null) {
            scheduler.start();
        }
        if (httpEnabled && httpServer == null) {
            httpServer = new NodeHttpServer(this, config);
            httpServer.start();
        }
        log.info("Node {} started", config.nodeId());
    }

    public synchronized void stop() {
        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
            httpServer = null;
        }
        if (scheduler != null) {
            scheduler.stop();
            // attempts cut off by the shutdown are retried after a restart
            int released = deliveryQueue.releaseInFlight();
            if (released > 0) {
                log.info("{} result deliveries interrupted by shutdown", released);
            }
        }
        log.info("Node {} stopped", config.nodeId());
    }

    @Override
    public void close() {
        stop();
    }

    /** Bound HTTP port, empty when the server is not running. */
    public synchronized Optional<Integer> httpPort() {
        return httpServer == null ? Optional.empty() : Optional.of(httpServer.port());
    }

    // ---- advertisements ----

    /** Ingest an advertisement received from a peer. */
    public CompletableFuture<Boolean> onTaskHeaderReceived(Map<String, Object> message) {
        return submit(() -> registry.addFromMessage(message));
    }

    /** The owner withdrew its task. */
    public CompletableFuture<Void> onTaskHeaderRetracted(String taskId) {
        return submit(() -> {
            log.info("Task {} retracted by its owner", taskId);
            registry.remove(taskId);
            return null;
        });
    }

    // ---- computing side ----

    /** Request a subtask of {@code taskId} with this node's capabilities. */
    public CompletableFuture<Void> requestTask(String taskId) {
        return submitCompose(() -> coordinator.requestTask(taskId, config.capabilities()));
    }

    /** Request a subtask of a random supported task. */
    public CompletableFuture<Optional<String>> requestRandomTask() {
        return submit(() -> coordinator.requestRandomTask(config.capabilities()));
    }

    public CompletableFuture<Void> onTaskRequestRefused(String taskId, String reason) {
        return submit(() -> {
            coordinator.taskRequestRefused(taskId, reason);
            return null;
        });
    }

    public CompletableFuture<Void> requestResource(String taskId, String subtaskId, String resourceDescriptor,
            PeerAddress owner) {
        return submitCompose(() -> coordinator.requestResource(taskId, subtaskId, resourceDescriptor, owner));
    }

    public CompletableFuture<Void> onResourceRequestResult(String subtaskId, boolean ok, String reason) {
        return submit(() -> {
            coordinator.resourceRequestResult(subtaskId, ok, reason);
            return null;
        });
    }

    public CompletableFuture<Void> computationStarted(String subtaskId) {
        return submit(() -> {
            coordinator.computationStarted(subtaskId);
            return null;
        });
    }

    /** Queue a computed result; the next tick starts delivering it. */
    public CompletableFuture<WaitingTaskResult> submitResult(String subtaskId, String taskId, String payload,
            ResultType resultType, String ownerAddress, int ownerPort) {
        return submit(() -> coordinator.submitResult(subtaskId, taskId, payload, resultType,
                ownerAddress, ownerPort));
    }

    /**
     * The owner's verdict on a result we delivered.
     *
     * @param rewardOrReason reward amount when accepted, reason when rejected
     */
    public CompletableFuture<Boolean> onVerificationResult(String subtaskId, boolean accepted,
            String rewardOrReason) {
        return submit(() -> accepted
                ? coordinator.verificationAccepted(subtaskId, rewardOrReason)
                : coordinator.verificationRejected(subtaskId, rewardOrReason));
    }

    // ---- requester side ----

    public CompletableFuture<Boolean> accept(String subtaskId, ComputingPeer peer) {
        return submit(() -> coordinator.accept(subtaskId, peer));
    }

    public CompletableFuture<Boolean> accept(String subtaskId, ComputingPeer peer, String reward) {
        return submit(() -> coordinator.accept(subtaskId, peer, reward));
    }

    public CompletableFuture<Void> reject(String subtaskId, ComputingPeer peer, String reason) {
        return submit(() -> {
            coordinator.reject(subtaskId, peer, reason);
            return null;
        });
    }

    // ---- read model ----

    /** Run one sync tick now, outside the fixed schedule. */
    public CompletableFuture<Void> tickNow() {
        return submit(() -> {
            syncTick.run();
            return null;
        });
    }

    /**
     * Remote and locally owned task headers. Must not be called from the
     * coordination loop.
     */
    public List<TaskHeaderSummary> listKnownTasks() {
        return await(submit(registry::snapshot));
    }

    /** Most recent protocol messages, oldest first. */
    public List<PeerMessage> recentMessages() {
        return messages.snapshot();
    }

    public NodeStatus status() {
        return await(submit(() -> new NodeStatus(
                config.nodeId(),
                registry.size(),
                registry.supportedCount(),
                registry.activeCount(),
                deliveryQueue.size(),
                coordinator.pendingVerificationCount())));
    }

    public Optional<SubtaskState> subtaskState(String subtaskId) {
        return await(submit(() -> coordinator.subtaskState(subtaskId)));
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    public NodeConfig config() {
        return config;
    }

    // ---- loop plumbing ----

    private <T> CompletableFuture<T> submit(Callable<T> work) {
        return NodeScheduler.submitTo(loop, work);
    }

    private <T> CompletableFuture<T> submitCompose(Callable<CompletableFuture<T>> work) {
        return submit(work).thenCompose(Function.identity());
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(READ_TIMEOUT_SEC, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketplaceException("Interrupted while reading node state", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new MarketplaceException("Reading node state failed", cause);
        } catch (TimeoutException e) {
            throw new MarketplaceException("Coordination loop did not answer within " + READ_TIMEOUT_SEC + "s", e);
        }
    }

    /**
     * Builder for {@link MarketplaceNode}.
     */
    public static final class Builder {
        private final NodeConfig config;
        private SessionOpener sessionOpener;
        private PaymentService paymentService;
        private LocalTaskManager taskManager;
        private LocalTaskComputer taskComputer;
        private CapabilityFilter capabilityFilter = header -> true;
        private ReputationSink reputationSink;
        private Clock clock = Clock.systemUTC();
        private final List<SyncHook> syncHooks = new ArrayList<>();
        private Executor loop;
        private boolean httpEnabled = true;

        private Builder(NodeConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder sessionOpener(SessionOpener sessionOpener) {
            this.sessionOpener = sessionOpener;
            return this;
        }

        public Builder paymentService(PaymentService paymentService) {
            this.paymentService = paymentService;
            return this;
        }

        public Builder taskManager(LocalTaskManager taskManager) {
            this.taskManager = taskManager;
            return this;
        }

        public Builder taskComputer(LocalTaskComputer taskComputer) {
            this.taskComputer = taskComputer;
            return this;
        }

        public Builder capabilityFilter(CapabilityFilter capabilityFilter) {
            this.capabilityFilter = capabilityFilter;
            return this;
        }

        public Builder reputationSink(ReputationSink reputationSink) {
            this.reputationSink = reputationSink;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder syncHook(SyncHook hook) {
            this.syncHooks.add(hook);
            return this;
        }

        /**
         * Run coordination on {@code loop} instead of an owned scheduler
         * thread. No periodic tick is scheduled; use {@link #tickNow()}.
         */
        public Builder loop(Executor loop) {
            this.loop = loop;
            return this;
        }

        public Builder httpEnabled(boolean httpEnabled) {
            this.httpEnabled = httpEnabled;
            return this;
        }

        public MarketplaceNode build() {
            Objects.requireNonNull(sessionOpener, "sessionOpener");
            Objects.requireNonNull(paymentService, "paymentService");
            Objects.requireNonNull(taskManager, "taskManager");
            Objects.requireNonNull(taskComputer, "taskComputer");
            Objects.requireNonNull(capabilityFilter, "capabilityFilter");
            Objects.requireNonNull(clock, "clock");
            return new MarketplaceNode(this);
        }
    }
}
