package com.eventpool;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Thread-safe EventRegistry implementation suitable for concurrent environments.
 *
 * <p>This implementation uses:
 * <ul>
 *   <li>A single monitor guarding the tables of every event</li>
 *   <li>Snapshots of the subscriptions to invoke, taken under the monitor</li>
 *   <li>AtomicLong for metrics counters</li>
 * </ul>
 *
 * <p>Thread-safety guarantees:
 * <ul>
 *   <li>All public methods are thread-safe</li>
 *   <li>Each operation is a critical section over the tables, so both tables of an event
 *       always change together</li>
 *   <li>Handlers are invoked on the emitting thread, outside the monitor</li>
 *   <li>A one-shot handler fires at most once even when its event is emitted concurrently</li>
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * ThreadSafeEventRegistry registry = new ThreadSafeEventRegistry();
 *
 * // Can be called from multiple threads safely
 * registry.subscribe("price", onPrice);
 *
 * // Can emit from any thread
 * registry.emit("price", "ACME", 101.5);
 * }</pre>
 *
 * @see AbstractEventRegistry
 * @see ThreadUnsafeEventRegistry
 */
public class ThreadSafeEventRegistry extends AbstractEventRegistry {

    private final Object monitor = new Object();

    /**
     * Thread-safe metrics counters.
     */
    private final AtomicLong totalEventsEmitted = new AtomicLong(0);
    private final AtomicLong reclaimedHandlerCount = new AtomicLong(0);
    private final AtomicLong handlerErrorCount = new AtomicLong(0);

    /**
     * Creates a new ThreadSafeEventRegistry that isolates handler failures.
     */
    public ThreadSafeEventRegistry() {
        super();
    }

    /**
     * Creates a new ThreadSafeEventRegistry with custom configuration.
     *
     * @param isolateHandlerFailures if true, a RuntimeException thrown by a handler is logged
     *        and the remaining handlers still run
     */
    public ThreadSafeEventRegistry(boolean isolateHandlerFailures) {
        super(isolateHandlerFailures);
    }

    @Override
    protected <T> T guarded(Supplier<T> action) {
        synchronized (monitor) {
            return action.get();
        }
    }

    @Override
    protected void addToMetric(MetricType metric, long delta) {
        switch (metric) {
            case TOTAL_EVENTS_EMITTED:
                totalEventsEmitted.addAndGet(delta);
                break;
            case RECLAIMED_HANDLER_COUNT:
                reclaimedHandlerCount.addAndGet(delta);
                break;
            case HANDLER_ERROR_COUNT:
                handlerErrorCount.addAndGet(delta);
                break;
        }
    }

    @Override
    protected long getMetricValue(MetricType metric) {
        switch (metric) {
            case TOTAL_EVENTS_EMITTED:
                return totalEventsEmitted.get();
            case RECLAIMED_HANDLER_COUNT:
                return reclaimedHandlerCount.get();
            case HANDLER_ERROR_COUNT:
                return handlerErrorCount.get();
            default:
                return 0;
        }
    }

    /**
     * Gets detailed metrics about the registry state.
     * The subscription counts are read in one critical section and are consistent with each
     * other.
     *
     * @return a map of metric names to their values
     */
    public Map<String, Object> getDetailedMetrics() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("totalEventsEmitted", getTotalEventsEmitted());
        metrics.put("reclaimedHandlerCount", getReclaimedHandlerCount());
        metrics.put("handlerErrorCount", getHandlerErrorCount());
        guarded(() -> {
            metrics.put("totalSubscriberCount", getTotalSubscriberCount());
            metrics.put("eventCount", getEventNames().size());

            Map<String, Integer> perEventCounts = new HashMap<>();
            for (String event : getEventNames()) {
                perEventCounts.put(event, getSubscriberCount(event));
            }
            metrics.put("subscribersPerEvent", perEventCounts);
            return null;
        });
        return metrics;
    }
}
