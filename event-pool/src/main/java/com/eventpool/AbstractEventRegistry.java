package com.eventpool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for EventRegistry implementations providing shared functionality.
 *
 * <p>This class owns the per-event tables and contains the logic for subscription management,
 * reconciliation with reclaimed handlers, emission and metrics. Concrete implementations decide
 * how the tables are guarded and how metrics are counted.
 *
 * <p>Subclasses must implement:
 * <ul>
 *   <li>{@link #guarded(Supplier)} - to run an action against the tables with the mutual
 *       exclusion appropriate to their threading model</li>
 *   <li>{@link #addToMetric(MetricType, long)} - for metric updates</li>
 *   <li>{@link #getMetricValue(MetricType)} - for metric reads</li>
 * </ul>
 *
 * <p>Handlers are never invoked from inside {@link #guarded(Supplier)}. Emission snapshots the
 * references to invoke, releases the tables, and only then calls the handlers, so a handler may
 * subscribe, unsubscribe or emit on the same registry.
 */
public abstract class AbstractEventRegistry implements EventRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractEventRegistry.class);

    static final String DUMP_START = "======= EventRegistry.debugDump() start =======";
    static final String DUMP_END = "======= EventRegistry.debugDump() end =======";
    static final String RECLAIMED = "reclaimed";

    /**
     * Types of metrics tracked by the registry.
     */
    protected enum MetricType {
        TOTAL_EVENTS_EMITTED,
        RECLAIMED_HANDLER_COUNT,
        HANDLER_ERROR_COUNT
    }

    // Event name -> tables; only touched inside guarded()
    private final Map<String, EventTables> events = new LinkedHashMap<>();

    private final boolean isolateHandlerFailures;

    /**
     * Creates a new AbstractEventRegistry that isolates handler failures.
     */
    protected AbstractEventRegistry() {
        this(true);
    }

    /**
     * Creates a new AbstractEventRegistry with custom configuration.
     *
     * @param isolateHandlerFailures if true, a RuntimeException thrown by a handler is logged
     *        and the remaining handlers still run; if false, it propagates to the emitter
     */
    protected AbstractEventRegistry(boolean isolateHandlerFailures) {
        this.isolateHandlerFailures = isolateHandlerFailures;
    }

    /**
     * Runs an action against the tables.
     * Implementations must provide the mutual exclusion their threading model requires.
     *
     * @param action the action, which must not invoke handlers
     * @param <T> the result type
     * @return the result of the action
     */
    protected abstract <T> T guarded(Supplier<T> action);

    /**
     * Adds to a metric.
     *
     * @param metric the metric to update
     * @param delta the amount to add
     */
    protected abstract void addToMetric(MetricType metric, long delta);

    /**
     * Gets the value of a metric.
     *
     * @param metric the metric to get
     * @return the current value of the metric
     */
    protected abstract long getMetricValue(MetricType metric);

    protected final void incrementMetric(MetricType metric) {
        addToMetric(metric, 1);
    }

    @Override
    public SubscriptionId subscribe(String event, @Nonnull Handler handler) {
        return subscribeInternal(event, handler, false);
    }

    @Override
    public SubscriptionId subscribeOnce(String event, @Nonnull Handler handler) {
        return subscribeInternal(event, handler, true);
    }

    private SubscriptionId subscribeInternal(String event, Handler handler, boolean once) {
        Objects.requireNonNull(handler, "Handler must not be null");

        SubscriptionId id = guarded(() ->
            events.computeIfAbsent(event, k -> new EventTables()).add(event, handler, once));
        LOGGER.debug("Subscribed {} to '{}' as {}{}", describe(handler), event, id, once ? " (once)" : "");
        return id;
    }

    @Override
    public boolean unsubscribe(String event, Handler handler) {
        if (handler == null) {
            return false;
        }
        boolean removed = guarded(() -> {
            EventTables tables = events.get(event);
            if (tables == null || !tables.remove(handler)) {
                return false;
            }
            dropIfEmpty(event, tables);
            return true;
        });
        if (removed) {
            LOGGER.debug("Unsubscribed {} from '{}'", describe(handler), event);
        }
        return removed;
    }

    @Override
    public boolean unsubscribeById(SubscriptionId id) {
        if (id == null) {
            return false;
        }
        boolean removed = guarded(() -> removeSubscription(id));
        if (removed) {
            LOGGER.debug("Unsubscribed {}", id);
        }
        return removed;
    }

    /**
     * Removes a subscription by identifier. Must be called inside {@link #guarded(Supplier)}.
     */
    private boolean removeSubscription(SubscriptionId id) {
        // The identifier names its event, so the owning tables are found without a scan
        EventTables tables = events.get(id.getEvent());
        if (tables == null || !tables.removeById(id)) {
            return false;
        }
        dropIfEmpty(id.getEvent(), tables);
        return true;
    }

    @Override
    public int removeAllListeners(String event) {
        int removed = guarded(() -> {
            EventTables tables = events.remove(event);
            return tables == null ? 0 : tables.subscriptionCount();
        });
        if (removed > 0) {
            LOGGER.debug("Removed {} subscription(s) from '{}'", removed, event);
        }
        return removed;
    }

    @Override
    public int removeAll() {
        int removed = guarded(() -> {
            int count = 0;
            for (EventTables tables : events.values()) {
                count += tables.subscriptionCount();
            }
            events.clear();
            return count;
        });
        LOGGER.debug("Removed all {} subscription(s)", removed);
        return removed;
    }

    @Override
    public void emit(String event, Object... args) {
        incrementMetric(MetricType.TOTAL_EVENTS_EMITTED);

        List<HandlerReference> targets = guarded(() -> {
            clean(event);
            EventTables tables = events.get(event);
            return tables == null ? Collections.<HandlerReference>emptyList() : tables.snapshot();
        });
        if (targets.isEmpty()) {
            LOGGER.trace("No subscribers for '{}'", event);
            return;
        }

        for (HandlerReference reference : targets) {
            Handler handler = reference.get();
            if (handler == null) {
                // Reclaimed after the snapshot was taken
                continue;
            }
            if (reference.isOnce() && !guarded(() -> removeSubscription(reference.getId()))) {
                // Already fired or cancelled
                continue;
            }
            invoke(event, reference.getId(), handler, args);
        }
    }

    private void invoke(String event, SubscriptionId id, Handler handler, Object[] args) {
        try {
            handler.handle(args);
        } catch (RuntimeException e) {
            incrementMetric(MetricType.HANDLER_ERROR_COUNT);
            if (!isolateHandlerFailures) {
                throw e;
            }
            LOGGER.warn("Handler {} ({}) threw exception while handling '{}'",
                describe(handler), id, event, e);
        } catch (Error e) {
            incrementMetric(MetricType.HANDLER_ERROR_COUNT);
            LOGGER.error("Handler {} ({}) threw Error while handling '{}'",
                describe(handler), id, event, e);
            throw e;
        }
    }

    @Override
    public int sweep() {
        int purged = guarded(() -> {
            int count = 0;
            for (String event : new ArrayList<>(events.keySet())) {
                count += clean(event);
            }
            return count;
        });
        if (purged > 0) {
            LOGGER.debug("Sweep purged {} reclaimed handler(s)", purged);
        }
        return purged;
    }

    /**
     * Purges the reclaimed subscriptions of one event. Must be called inside
     * {@link #guarded(Supplier)}.
     *
     * @return the number of purged subscriptions
     */
    private int clean(String event) {
        EventTables tables = events.get(event);
        if (tables == null) {
            return 0;
        }
        int purged = tables.purgeReclaimed();
        if (purged > 0) {
            addToMetric(MetricType.RECLAIMED_HANDLER_COUNT, purged);
            LOGGER.debug("Purged {} reclaimed handler(s) from '{}'", purged, event);
            dropIfEmpty(event, tables);
        }
        return purged;
    }

    private void dropIfEmpty(String event, EventTables tables) {
        if (tables.isEmpty()) {
            events.remove(event, tables);
        }
    }

    @Override
    public String debugDump() {
        List<String> lines = guarded(() -> {
            List<String> result = new ArrayList<>();
            for (Map.Entry<String, EventTables> entry : events.entrySet()) {
                for (HandlerReference reference : entry.getValue().snapshot()) {
                    Handler handler = reference.get();
                    result.add(String.format("event: %s | id: %s | handler: %s",
                        entry.getKey(), reference.getId(),
                        handler == null ? RECLAIMED : describe(handler)));
                }
            }
            return result;
        });

        StringBuilder dump = new StringBuilder(DUMP_START).append(System.lineSeparator());
        for (String line : lines) {
            dump.append(line).append(System.lineSeparator());
        }
        dump.append(DUMP_END);
        LOGGER.debug("{}", dump);
        return dump.toString();
    }

    private static String describe(Handler handler) {
        Class<?> type = handler.getClass();
        String name = type.getSimpleName().isEmpty() ? type.getName() : type.getSimpleName();
        return String.format("%s@%s", name, Integer.toHexString(System.identityHashCode(handler)));
    }

    // Introspection and metrics

    /**
     * Gets the number of subscriptions of an event, including any not yet purged after their
     * handler was reclaimed.
     *
     * @param event the event name
     * @return the subscription count
     */
    public int getSubscriberCount(String event) {
        return guarded(() -> {
            EventTables tables = events.get(event);
            return tables == null ? 0 : tables.subscriptionCount();
        });
    }

    /**
     * Gets the total number of subscriptions across all events.
     *
     * @return the total subscription count
     */
    public int getTotalSubscriberCount() {
        return guarded(() -> {
            int count = 0;
            for (EventTables tables : events.values()) {
                count += tables.subscriptionCount();
            }
            return count;
        });
    }

    /**
     * Gets a snapshot of the event names that currently have tables, in creation order.
     *
     * @return the event names
     */
    public Set<String> getEventNames() {
        return guarded(() -> Collections.unmodifiableSet(new LinkedHashSet<>(events.keySet())));
    }

    /**
     * Gets the total number of emit calls.
     *
     * @return the emit count
     */
    public long getTotalEventsEmitted() {
        return getMetricValue(MetricType.TOTAL_EVENTS_EMITTED);
    }

    /**
     * Gets the number of subscriptions purged because their handler was reclaimed.
     *
     * @return the reclaimed handler count
     */
    public long getReclaimedHandlerCount() {
        return getMetricValue(MetricType.RECLAIMED_HANDLER_COUNT);
    }

    /**
     * Gets the number of handler invocations that threw.
     *
     * @return the handler error count
     */
    public long getHandlerErrorCount() {
        return getMetricValue(MetricType.HANDLER_ERROR_COUNT);
    }

    public boolean isIsolatingHandlerFailures() {
        return isolateHandlerFailures;
    }

    int getReverseEntryCount(String event) {
        return guarded(() -> {
            EventTables tables = events.get(event);
            return tables == null ? 0 : tables.reverseCount();
        });
    }

    HandlerReference referenceOf(SubscriptionId id) {
        return guarded(() -> {
            EventTables tables = events.get(id.getEvent());
            return tables == null ? null : tables.get(id);
        });
    }
}
