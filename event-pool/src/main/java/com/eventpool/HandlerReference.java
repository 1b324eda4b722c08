package com.eventpool;

import java.lang.ref.WeakReference;

/**
 * Weak reference to a subscribed handler, shared by the subscription table and the reverse table
 * of an event.
 *
 * <p>As a reverse-table key it hashes by the identity hash of the handler and compares by
 * referent identity and the one-shot flag, so a one-shot subscription of a handler never
 * shares a reverse entry with a regular subscription of the same handler. A cleared reference
 * is only equal to itself.
 */
final class HandlerReference extends WeakReference<Handler> {

    private final int hash;
    private final SubscriptionId id;
    private final boolean once;

    HandlerReference(Handler handler, SubscriptionId id, boolean once) {
        super(handler);
        this.hash = 31 * System.identityHashCode(handler) + (once ? 1 : 0);
        this.id = id;
        this.once = once;
    }

    /**
     * Creates a key used only to look up the regular subscription of {@code handler} in a
     * reverse table.
     */
    static HandlerReference lookupKey(Handler handler) {
        return lookupKey(handler, false);
    }

    static HandlerReference lookupKey(Handler handler, boolean once) {
        return new HandlerReference(handler, null, once);
    }

    SubscriptionId getId() {
        return id;
    }

    boolean isOnce() {
        return once;
    }

    boolean isReclaimed() {
        return get() == null;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HandlerReference)) return false;
        HandlerReference that = (HandlerReference) o;
        Handler referent = get();
        return referent != null && referent == that.get() && once == that.once;
    }
}
