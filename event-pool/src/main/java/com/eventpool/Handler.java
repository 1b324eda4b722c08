package com.eventpool;

/**
 * A callback subscribed to a named event.
 *
 * <p>Handlers are called with whatever arguments were passed to
 * {@link EventRegistry#emit(String, Object...)}, unchanged and without a fixed arity.
 *
 * <p>The registry only holds handlers weakly. A handler that nothing else references may be
 * reclaimed by the garbage collector, after which it silently stops receiving events. Callers
 * that want a handler to stay subscribed must keep a reference to it.
 */
@FunctionalInterface
public interface Handler {

    /**
     * Handles one emission of the event this handler is subscribed to.
     *
     * @param args the arguments passed to {@code emit}, possibly empty
     */
    void handle(Object... args);
}
