package com.eventpool;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque handle identifying one subscription.
 *
 * <p>Identifiers can only be minted by the registry. Equality is identity: two identifiers are
 * equal only if they are the same instance, so an identifier cannot be forged from its printed
 * form. Identifiers are never reused, even after the subscription they name has been removed.
 */
public final class SubscriptionId {

    private static final AtomicLong SEQUENCE = new AtomicLong(0);

    private final String event;
    private final long sequence;

    private SubscriptionId(String event, long sequence) {
        this.event = event;
        this.sequence = sequence;
    }

    static SubscriptionId next(String event) {
        return new SubscriptionId(event, SEQUENCE.incrementAndGet());
    }

    /**
     * Gets the name of the event this identifier was minted for.
     *
     * @return the event name
     */
    public String getEvent() {
        return event;
    }

    /**
     * Gets the process-wide sequence number of this identifier. Diagnostic only.
     *
     * @return the sequence number
     */
    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "SubscriptionId(" + event + "#" + sequence + ")";
    }
}
