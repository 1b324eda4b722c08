package com.eventpool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the process-wide EventPool facade.
 */
@DisplayName("EventPool Tests")
class EventPoolTest {

    @BeforeEach
    void setUp() {
        EventPool.removeAll();
    }

    @AfterEach
    void tearDown() {
        EventPool.removeAll();
    }

    @Test
    @DisplayName("Should refuse instantiation")
    void shouldRefuseInstantiation() throws Exception {
        Constructor<EventPool> constructor = EventPool.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        assertThatThrownBy(constructor::newInstance)
            .isInstanceOf(InvocationTargetException.class)
            .hasCauseInstanceOf(EventPoolException.class)
            .hasRootCauseMessage("EventPool is a static class and cannot be instantiated.");
    }

    @Test
    @DisplayName("Should share one thread-safe registry across the process")
    void shouldShareOneRegistry() {
        assertSame(EventPool.shared(), EventPool.shared());
        assertThat(EventPool.shared()).isInstanceOf(ThreadSafeEventRegistry.class);
    }

    @Test
    @DisplayName("Should subscribe, emit and unsubscribe through the facade")
    void shouldRouteOperationsToSharedRegistry() {
        RecordingHandler handler = new RecordingHandler("handler");

        EventPool.subscribe("eventName", handler);
        EventPool.emit("eventName", "case1");
        assertTrue(EventPool.unsubscribe("eventName", handler));
        EventPool.emit("eventName", "case2");

        assertThat(handler.calls()).hasSize(1);
        assertThat(handler.lastCall()).containsExactly("case1");
        assertEquals(0, EventPool.shared().getTotalSubscriberCount());
    }

    @Test
    @DisplayName("Should unsubscribe by id through the facade")
    void shouldUnsubscribeByIdThroughFacade() {
        RecordingHandler handler = new RecordingHandler("handler");

        SubscriptionId id = EventPool.subscribe("eventName", handler);
        assertTrue(EventPool.unsubscribeById(id));
        EventPool.emit("eventName", "case3");

        assertEquals(0, handler.callCount());
    }

    @Test
    @DisplayName("Should fire once handlers a single time through the facade")
    void shouldSupportOnceThroughFacade() {
        RecordingHandler handler = new RecordingHandler("once");

        EventPool.subscribeOnce("onceEvent", handler);
        EventPool.emit("onceEvent", "first emit");
        EventPool.emit("onceEvent", "second emit");

        assertThat(handler.calls()).hasSize(1);
        assertThat(handler.lastCall()).containsExactly("first emit");
    }

    @Test
    @DisplayName("Should remove listeners, sweep and dump through the facade")
    void shouldManageListenersThroughFacade() {
        RecordingHandler a = new RecordingHandler("a");
        RecordingHandler b = new RecordingHandler("b");

        EventPool.subscribe("eventA", a);
        SubscriptionId reclaimed = EventPool.subscribe("eventB", b);
        EventPool.shared().referenceOf(reclaimed).clear();

        assertThat(EventPool.debugDump()).contains(reclaimed + " | handler: reclaimed");
        assertEquals(1, EventPool.sweep());
        assertThat(EventPool.debugDump()).doesNotContain("eventB");

        assertEquals(1, EventPool.removeAllListeners("eventA"));
        EventPool.emit("eventA", "x");
        assertEquals(0, a.callCount());
        assertEquals(0, b.callCount());
    }
}
