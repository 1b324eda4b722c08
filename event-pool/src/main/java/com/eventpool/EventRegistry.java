package com.eventpool;

import javax.annotation.Nonnull;

/**
 * Publish/subscribe registry keyed by event name that holds its handlers weakly.
 *
 * <p>Implementations differ in their threading model:
 * <ul>
 *   <li>{@link ThreadUnsafeEventRegistry} - for single-threaded, event-loop style callers</li>
 *   <li>{@link ThreadSafeEventRegistry} - for concurrent environments</li>
 * </ul>
 *
 * <p><b>Design Decisions:</b>
 * <ul>
 *   <li><b>Event names:</b> plain strings, compared with {@code equals}, never validated;
 *       {@code null} is a name like any other</li>
 *   <li><b>Handlers:</b> {@link Handler} takes a variable argument list, so one handler type
 *       fits every event regardless of its payload</li>
 *   <li><b>Liveness:</b> the registry never owns a handler. Reclaimed handlers are purged lazily,
 *       at the latest on the next emission of their event or on {@link #sweep()}</li>
 *   <li><b>Removal:</b> every removal path tolerates unknown events, handlers and identifiers,
 *       so teardown code can unsubscribe without tracking what it already removed</li>
 * </ul>
 */
public interface EventRegistry {

    /**
     * Subscribes a handler to an event.
     *
     * <p>If the same handler is already subscribed to the event, the handler is re-keyed to the
     * new identifier. The earlier subscription keeps receiving events until it is removed by
     * identifier, by bulk removal, or purged once the handler is reclaimed.
     *
     * @param event the event name
     * @param handler the handler, held weakly
     * @return the identifier of the new subscription
     * @throws NullPointerException if handler is null
     */
    SubscriptionId subscribe(String event, @Nonnull Handler handler);

    /**
     * Subscribes a handler that is invoked at most once, on the first emission that reaches it.
     *
     * <p>The subscription removes itself before the handler runs. The returned identifier can be
     * passed to {@link #unsubscribeById(SubscriptionId)} to cancel it before it fires. It is kept
     * apart from any regular subscription of the same handler, so
     * {@link #unsubscribe(String, Handler)} neither cancels it nor is blocked by it.
     *
     * @param event the event name
     * @param handler the handler, held weakly
     * @return the identifier of the one-shot subscription
     * @throws NullPointerException if handler is null
     */
    SubscriptionId subscribeOnce(String event, @Nonnull Handler handler);

    /**
     * Removes the subscription of a handler from an event.
     *
     * @param event the event name
     * @param handler the handler to remove
     * @return true if a subscription was removed, false if there was nothing to remove
     */
    boolean unsubscribe(String event, Handler handler);

    /**
     * Removes the subscription with the given identifier, whether or not its handler is still
     * alive.
     *
     * @param id the identifier returned by a subscribe call
     * @return true if a subscription was removed, false if the identifier is unknown
     */
    boolean unsubscribeById(SubscriptionId id);

    /**
     * Drops every subscription of an event together with the event's tables.
     *
     * @param event the event name
     * @return the number of subscriptions dropped
     */
    int removeAllListeners(String event);

    /**
     * Drops every subscription of every event.
     *
     * @return the number of subscriptions dropped
     */
    int removeAll();

    /**
     * Emits an event to every live handler subscribed to it, in subscription order.
     *
     * <p>Subscriptions whose handler has been reclaimed are purged first. Emitting an event that
     * has no subscribers does nothing.
     *
     * @param event the event name
     * @param args the arguments passed unchanged to each handler
     */
    void emit(String event, Object... args);

    /**
     * Purges the subscriptions of every event whose handler has been reclaimed.
     *
     * @return the number of subscriptions purged
     */
    int sweep();

    /**
     * Renders every subscription as a line of event name, identifier, and handler name (or
     * "reclaimed"). For diagnostics only; has no effect on the registry.
     *
     * @return the human-readable listing
     */
    String debugDump();
}
