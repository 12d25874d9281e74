package taskmesh.node.scheduler;

import taskmesh.node.delivery.ResultDeliveryQueue;
import taskmesh.node.registry.TaskHeaderRegistry;
import taskmesh.node.session.TaskSessionCoordinator;
import taskmesh.node.spi.SyncHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodic housekeeping run on the coordination loop.
 *
 * Order per tick:
 * 1. expire task headers
 * 2. start delivery attempts for due results
 * 3. forget settled subtasks past retention
 * 4. run the sync hooks
 *
 * A failing step is logged and does not stop the later ones.
 */
public class SyncTick implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SyncTick.class);

    private final TaskHeaderRegistry registry;
    private final ResultDeliveryQueue deliveryQueue;
    private final TaskSessionCoordinator coordinator;
    private final List<SyncHook> hooks;
    private final Clock clock;

    public SyncTick(TaskHeaderRegistry registry, ResultDeliveryQueue deliveryQueue,
            TaskSessionCoordinator coordinator, List<SyncHook> hooks, Clock clock) {
        this.registry = registry;
        this.deliveryQueue = deliveryQueue;
        this.coordinator = coordinator;
        this.hooks = List.copyOf(hooks);
        this.clock = clock;
    }

    @Override
    public void run() {
        Instant now = clock.instant();

        step("header expiry", () -> {
            int removed = registry.tick(now);
            if (removed > 0) {
                log.debug("{} task header(s) removed", removed);
            }
        });
        step("result delivery", () -> deliveryQueue.flush(now, coordinator::deliverResult));
        step("outcome purge", () -> coordinator.purgeResolved(now));

        for (SyncHook hook : hooks) {
            step(hook.name(), hook::sync);
        }
    }

    private void step(String name, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            log.error("Sync step {} failed", name, e);
        }
    }
}
