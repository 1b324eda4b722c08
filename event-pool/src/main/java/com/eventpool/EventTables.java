package com.eventpool;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The two coupled tables of a single event: subscriptions by identifier, in registration order,
 * and identifiers by handler identity.
 *
 * <p>Not thread-safe. Callers provide whatever mutual exclusion they need.
 */
final class EventTables {

    private final Map<SubscriptionId, HandlerReference> subscriptions = new LinkedHashMap<>();
    private final Map<HandlerReference, SubscriptionId> reverse = new HashMap<>();

    SubscriptionId add(String event, Handler handler, boolean once) {
        SubscriptionId id = SubscriptionId.next(event);
        HandlerReference reference = new HandlerReference(handler, id, once);
        subscriptions.put(id, reference);
        // An earlier identifier of the same handler loses its reverse entry here.
        reverse.put(reference, id);
        return id;
    }

    boolean remove(Handler handler) {
        SubscriptionId id = reverse.remove(HandlerReference.lookupKey(handler));
        if (id == null) {
            return false;
        }
        subscriptions.remove(id);
        return true;
    }

    boolean removeById(SubscriptionId id) {
        HandlerReference reference = subscriptions.remove(id);
        if (reference == null) {
            return false;
        }
        Handler handler = reference.get();
        if (handler != null) {
            reverse.remove(HandlerReference.lookupKey(handler, reference.isOnce()), id);
        } else {
            removeReverseEntry(id);
        }
        return true;
    }

    /**
     * Purges every subscription whose handler has been reclaimed, together with its reverse
     * entry.
     *
     * @return the number of purged subscriptions
     */
    int purgeReclaimed() {
        List<SubscriptionId> dead = new ArrayList<>();
        for (Map.Entry<SubscriptionId, HandlerReference> entry : subscriptions.entrySet()) {
            if (entry.getValue().isReclaimed()) {
                dead.add(entry.getKey());
            }
        }
        for (SubscriptionId id : dead) {
            subscriptions.remove(id);
            removeReverseEntry(id);
        }
        return dead.size();
    }

    private void removeReverseEntry(SubscriptionId id) {
        Iterator<SubscriptionId> it = reverse.values().iterator();
        while (it.hasNext()) {
            if (it.next() == id) {
                it.remove();
                return;
            }
        }
    }

    /**
     * Copies the references in registration order, so callers can iterate while the tables
     * change underneath them.
     */
    List<HandlerReference> snapshot() {
        return new ArrayList<>(subscriptions.values());
    }

    HandlerReference get(SubscriptionId id) {
        return subscriptions.get(id);
    }

    int subscriptionCount() {
        return subscriptions.size();
    }

    int reverseCount() {
        return reverse.size();
    }

    boolean isEmpty() {
        return subscriptions.isEmpty() && reverse.isEmpty();
    }
}
