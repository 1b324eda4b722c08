package com.eventpool;

import java.util.function.Supplier;

/**
 * Thread-unsafe EventRegistry implementation for cooperative, single-threaded callers.
 *
 * <p>This implementation runs every operation directly against the tables, with no locking.
 * It's ideal for:
 * <ul>
 *   <li>Event-loop style applications where all work happens on one thread</li>
 *   <li>UI event handling in single-threaded GUI frameworks</li>
 *   <li>Test environments</li>
 *   <li>Scenarios where external synchronization is provided</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> This implementation is NOT thread-safe. All access must be
 * from a single thread or externally synchronized. For concurrent access, use
 * {@link ThreadSafeEventRegistry} instead.
 *
 * <p><b>Performance Characteristics:</b>
 * <ul>
 *   <li>Subscribing, unsubscribing by handler or by identifier: O(1)</li>
 *   <li>Emitting: O(n) where n is the number of subscriptions of the event</li>
 *   <li>Purging a reclaimed handler: O(n) scan of the event's reverse table</li>
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * ThreadUnsafeEventRegistry registry = new ThreadUnsafeEventRegistry();
 *
 * Handler onOrder = args -> processOrder((Order) args[0]);
 * registry.subscribe("order", onOrder);
 * registry.emit("order", order);
 * }</pre>
 *
 * @see AbstractEventRegistry
 * @see ThreadSafeEventRegistry
 */
public class ThreadUnsafeEventRegistry extends AbstractEventRegistry {

    // Metrics - simple primitives since we're single-threaded
    private long totalEventsEmitted = 0;
    private long reclaimedHandlerCount = 0;
    private long handlerErrorCount = 0;

    /**
     * Creates a new ThreadUnsafeEventRegistry that isolates handler failures.
     */
    public ThreadUnsafeEventRegistry() {
        super();
    }

    /**
     * Creates a new ThreadUnsafeEventRegistry with custom configuration.
     *
     * @param isolateHandlerFailures if true, a RuntimeException thrown by a handler is logged
     *        and the remaining handlers still run
     */
    public ThreadUnsafeEventRegistry(boolean isolateHandlerFailures) {
        super(isolateHandlerFailures);
    }

    @Override
    protected <T> T guarded(Supplier<T> action) {
        return action.get();
    }

    @Override
    protected void addToMetric(MetricType metric, long delta) {
        switch (metric) {
            case TOTAL_EVENTS_EMITTED:
                totalEventsEmitted += delta;
                break;
            case RECLAIMED_HANDLER_COUNT:
                reclaimedHandlerCount += delta;
                break;
            case HANDLER_ERROR_COUNT:
                handlerErrorCount += delta;
                break;
        }
    }

    @Override
    protected long getMetricValue(MetricType metric) {
        switch (metric) {
            case TOTAL_EVENTS_EMITTED:
                return totalEventsEmitted;
            case RECLAIMED_HANDLER_COUNT:
                return reclaimedHandlerCount;
            case HANDLER_ERROR_COUNT:
                return handlerErrorCount;
            default:
                return 0;
        }
    }
}
