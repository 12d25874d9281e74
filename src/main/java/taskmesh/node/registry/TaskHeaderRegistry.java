package taskmesh.node.registry;

import taskmesh.node.exception.ValidationException;
import taskmesh.node.model.TaskHeader;
import taskmesh.node.model.TaskHeaderMessage;
import taskmesh.node.model.TaskHeaderSummary;
import taskmesh.node.spi.CapabilityFilter;
import taskmesh.node.spi.LocalTaskManager;
import taskmesh.node.util.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Task advertisements known to this node, with time-to-live expiry.
 *
 * Not thread-safe: every call must come from the node's coordination loop.
 * Readers elsewhere use {@link #snapshot()}.
 */
public class TaskHeaderRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskHeaderRegistry.class);

    private final Map<String, TaskHeader> headers = new LinkedHashMap<>();
    private final List<String> supportedTasks = new ArrayList<>();
    private final Map<String, Instant> removedTasks = new HashMap<>();
    private final Map<String, ActiveTaskEntry> activeTasks = new HashMap<>();

    private final LocalTaskManager taskManager;
    private final CapabilityFilter capabilityFilter;
    private final Duration removedTaskCooldown;
    private final Clock clock;
    private final Random random;

    public TaskHeaderRegistry(LocalTaskManager taskManager, CapabilityFilter capabilityFilter,
            Duration removedTaskCooldown, Clock clock) {
        this(taskManager, capabilityFilter, removedTaskCooldown, clock, new Random());
    }

    public TaskHeaderRegistry(LocalTaskManager taskManager, CapabilityFilter capabilityFilter,
            Duration removedTaskCooldown, Clock clock, Random random) {
        this.taskManager = taskManager;
        this.capabilityFilter = capabilityFilter;
        this.removedTaskCooldown = removedTaskCooldown;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Add an advertisement.
     *
     * @return false if the task is already known, is ours, or was removed
     *         within the cool-down window
     * @throws ValidationException if the header carries no positive TTL
     */
    public boolean add(TaskHeader header) {
        if (header.isExpired()) {
            throw new ValidationException("ttl must be positive for task " + header.taskId());
        }
        String taskId = header.taskId();
        if (headers.containsKey(taskId)) {
            return false;
        }
        if (taskManager.isOwnTask(taskId)) {
            return false;
        }
        Instant now = clock.instant();
        if (inCooldown(taskId, now)) {
            log.debug("Ignoring task {} removed less than {} ago", taskId, removedTaskCooldown);
            return false;
        }

        log.info("Adding task {}", taskId);
        headers.put(taskId, header.lastChecked() == null ? header.withTtl(header.ttl(), now) : header);
        if (capabilityFilter.supports(header)) {
            supportedTasks.add(taskId);
        }
        return true;
    }

    /**
     * Add an advertisement received from the network. Malformed input is
     * logged and reported as not added.
     */
    public boolean addFromMessage(Map<String, Object> message) {
        try {
            TaskHeaderMessage parsed;
            try {
                parsed = JsonMapper.mapper().convertValue(message, TaskHeaderMessage.class);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("unreadable task header: " + e.getMessage(), e);
            }
            if (parsed == null) {
                throw new ValidationException("empty task header");
            }
            return add(parsed.toHeader(clock.instant()));
        } catch (ValidationException e) {
            log.error("Wrong task header received: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Forget a task. The active entry is dropped only when no request is
     * outstanding; otherwise verification completion reaps it later.
     * Removing a task that is already gone keeps its original removal time.
     */
    public void remove(String taskId) {
        boolean known = headers.remove(taskId) != null;
        supportedTasks.remove(taskId);
        if (known || !removedTasks.containsKey(taskId)) {
            removedTasks.put(taskId, clock.instant());
        }

        ActiveTaskEntry entry = activeTasks.get(taskId);
        if (entry != null && entry.outstandingRequests() <= 0) {
            activeTasks.remove(taskId);
        }
    }

    /**
     * Age every header by the time elapsed since it was last checked and
     * drop the dead ones, then forget removal records past the cool-down.
     *
     * @return number of headers removed
     */
    public int tick(Instant now) {
        List<String> dead = new ArrayList<>();
        for (Map.Entry<String, TaskHeader> e : headers.entrySet()) {
            TaskHeader header = e.getValue();
            if (taskManager.isOwnTask(header.taskId())) {
                log.info("Task {} is now handled locally", header.taskId());
                dead.add(header.taskId());
                continue;
            }
            double elapsed = Duration.between(header.lastChecked(), now).toMillis() / 1000.0;
            TaskHeader aged = header.withTtl(header.ttl() - elapsed, now);
            e.setValue(aged);
            if (aged.isExpired()) {
                log.warn("Task {} dies", header.taskId());
                dead.add(header.taskId());
            }
        }
        dead.forEach(this::remove);

        for (Iterator<Map.Entry<String, Instant>> it = removedTasks.entrySet().iterator(); it.hasNext();) {
            if (Duration.between(it.next().getValue(), now).compareTo(removedTaskCooldown) > 0) {
                it.remove();
            }
        }
        return dead.size();
    }

    /** Uniform random pick among supported tasks. */
    public Optional<String> pickRandomSupported() {
        if (supportedTasks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(supportedTasks.get(random.nextInt(supportedTasks.size())));
    }

    public boolean contains(String taskId) {
        return headers.containsKey(taskId);
    }

    public boolean isSupported(String taskId) {
        return supportedTasks.contains(taskId);
    }

    public Optional<TaskHeader> header(String taskId) {
        return Optional.ofNullable(headers.get(taskId));
    }

    public boolean isInCooldown(String taskId) {
        return inCooldown(taskId, clock.instant());
    }

    private boolean inCooldown(String taskId, Instant now) {
        Instant removedAt = removedTasks.get(taskId);
        return removedAt != null && Duration.between(removedAt, now).compareTo(removedTaskCooldown) <= 0;
    }

    // ---- active tasks ----

    /**
     * Count one more outstanding request for a known task, creating its
     * entry if needed.
     */
    public ActiveTaskEntry incrementRequests(String taskId) {
        ActiveTaskEntry entry = activeTasks.get(taskId);
        if (entry == null) {
            TaskHeader header = headers.get(taskId);
            if (header == null) {
                throw new IllegalArgumentException("Unknown task " + taskId);
            }
            entry = new ActiveTaskEntry(header);
            activeTasks.put(taskId, entry);
        }
        entry.increment();
        return entry;
    }

    /**
     * Release one outstanding request. The entry is deleted once nothing is
     * outstanding and the header is gone.
     *
     * @return false if there was no entry for the task
     */
    public boolean decrementRequests(String taskId) {
        ActiveTaskEntry entry = activeTasks.get(taskId);
        if (entry == null) {
            return false;
        }
        entry.decrement();
        if (entry.outstandingRequests() <= 0 && !headers.containsKey(taskId)) {
            activeTasks.remove(taskId);
            log.debug("Stopped tracking task {}", taskId);
        }
        return true;
    }

    public Optional<ActiveTaskEntry> activeEntry(String taskId) {
        return Optional.ofNullable(activeTasks.get(taskId));
    }

    // ---- read model ----

    public int size() {
        return headers.size();
    }

    public int supportedCount() {
        return supportedTasks.size();
    }

    public int activeCount() {
        return activeTasks.size();
    }

    /** Immutable copy of remote headers followed by our own published tasks. */
    public List<TaskHeaderSummary> snapshot() {
        List<TaskHeaderSummary> list = new ArrayList<>(headers.size());
        for (TaskHeader header : headers.values()) {
            list.add(TaskHeaderSummary.from(header, false));
        }
        for (TaskHeader header : taskManager.ownTaskHeaders()) {
            list.add(TaskHeaderSummary.from(header, true));
        }
        return List.copyOf(list);
    }
}
