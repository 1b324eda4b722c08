package com.eventpool.examples;

import com.eventpool.EventPool;
import com.eventpool.Handler;
import com.eventpool.SubscriptionId;
import com.eventpool.ThreadSafeEventRegistry;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Compact demonstrations of the event pool.
 */
public final class Example {

    private Example() {
        // utility class
    }

    public static void main(String[] args) {
        System.out.println("=== Subscribe and emit ===");
        demoSubscribeAndEmit();

        System.out.println();
        System.out.println("=== Unsubscribe ===");
        demoUnsubscribe();

        System.out.println();
        System.out.println("=== Once ===");
        demoOnce();

        System.out.println();
        System.out.println("=== Sweep reclaimed handlers ===");
        demoSweep();

        System.out.println();
        System.out.println("=== Dedicated ThreadSafeEventRegistry ===");
        demoThreadSafeRegistry();
    }

    private static void demoSubscribeAndEmit() {
        Handler handler = data -> System.out.println("Event 1 received with data: " + data[0]);
        EventPool.subscribe("eventName", handler);
        EventPool.emit("eventName", "case1");
        EventPool.removeAll();
    }

    private static void demoUnsubscribe() {
        // Neither handler should print
        Handler byHandler = data -> System.out.println("Event 2 received with data: " + data[0]);
        EventPool.subscribe("eventName", byHandler);
        EventPool.unsubscribe("eventName", byHandler);
        EventPool.emit("eventName", "case2");

        Handler byId = data -> System.out.println("Event 3 received with data: " + data[0]);
        SubscriptionId id = EventPool.subscribe("eventName", byId);
        EventPool.unsubscribeById(id);
        EventPool.emit("eventName", "case3");
        EventPool.removeAll();
    }

    private static void demoOnce() {
        Handler handler = data -> System.out.println("Once event received: " + data[0]);
        EventPool.subscribeOnce("onceEvent", handler);
        EventPool.emit("onceEvent", "first emit");
        EventPool.emit("onceEvent", "second emit");
        EventPool.removeAll();
    }

    private static void demoSweep() {
        String prefix = "Handler for sweep received: ";
        Handler handler = data -> System.out.println(prefix + data[0]);
        EventPool.subscribe("sweepEvent", handler);
        EventPool.emit("sweepEvent", "case4-emit1");

        // Drop the only strong reference so the collector may reclaim the handler
        handler = null;
        System.gc();

        System.out.println("Purged " + EventPool.sweep() + " reclaimed handler(s)");
        System.out.println(EventPool.debugDump());
        EventPool.removeAll();
    }

    private static void demoThreadSafeRegistry() {
        ThreadSafeEventRegistry registry = new ThreadSafeEventRegistry();
        ExecutorService pool = Executors.newFixedThreadPool(2);

        Handler handler = data ->
            System.out.println(Thread.currentThread().getName() + " processed update from " + data[0]);
        registry.subscribe("taskUpdate", handler);

        for (int i = 0; i < 4; i++) {
            final int idx = i;
            pool.submit(() -> registry.emit("taskUpdate", "worker-" + idx));
        }

        pool.shutdown();
        while (!pool.isTerminated()) {
            Thread.yield();
        }

        System.out.println(registry.getDetailedMetrics());
        registry.unsubscribe("taskUpdate", handler);
    }
}
