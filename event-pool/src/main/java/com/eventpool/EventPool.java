package com.eventpool;

import javax.annotation.Nonnull;

/**
 * Process-wide event pool.
 *
 * <p>All operations delegate to one shared {@link ThreadSafeEventRegistry}, created on first
 * use. The class only has static members and cannot be instantiated.
 *
 * <pre>{@code
 * Handler onSaved = args -> refresh();
 * EventPool.subscribe("document-saved", onSaved);
 * EventPool.emit("document-saved", document);
 * EventPool.unsubscribe("document-saved", onSaved);
 * }</pre>
 *
 * @see EventRegistry
 */
public final class EventPool {

    private static final class Holder {
        static final ThreadSafeEventRegistry INSTANCE = new ThreadSafeEventRegistry();
    }

    private EventPool() {
        throw new EventPoolException("EventPool is a static class and cannot be instantiated.");
    }

    /**
     * Gets the registry shared by the whole process.
     *
     * @return the shared registry
     */
    public static ThreadSafeEventRegistry shared() {
        return Holder.INSTANCE;
    }

    /**
     * @see EventRegistry#subscribe(String, Handler)
     */
    public static SubscriptionId subscribe(String event, @Nonnull Handler handler) {
        return shared().subscribe(event, handler);
    }

    /**
     * @see EventRegistry#subscribeOnce(String, Handler)
     */
    public static SubscriptionId subscribeOnce(String event, @Nonnull Handler handler) {
        return shared().subscribeOnce(event, handler);
    }

    /**
     * @see EventRegistry#unsubscribe(String, Handler)
     */
    public static boolean unsubscribe(String event, Handler handler) {
        return shared().unsubscribe(event, handler);
    }

    /**
     * @see EventRegistry#unsubscribeById(SubscriptionId)
     */
    public static boolean unsubscribeById(SubscriptionId id) {
        return shared().unsubscribeById(id);
    }

    /**
     * @see EventRegistry#removeAllListeners(String)
     */
    public static int removeAllListeners(String event) {
        return shared().removeAllListeners(event);
    }

    /**
     * @see EventRegistry#removeAll()
     */
    public static int removeAll() {
        return shared().removeAll();
    }

    /**
     * @see EventRegistry#emit(String, Object...)
     */
    public static void emit(String event, Object... args) {
        shared().emit(event, args);
    }

    /**
     * @see EventRegistry#sweep()
     */
    public static int sweep() {
        return shared().sweep();
    }

    /**
     * @see EventRegistry#debugDump()
     */
    public static String debugDump() {
        return shared().debugDump();
    }
}
