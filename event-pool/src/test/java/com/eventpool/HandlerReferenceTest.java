package com.eventpool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HandlerReference Tests")
class HandlerReferenceTest {

    /**
     * Handler whose equals claims every instance is equal, to prove lookups ignore it.
     */
    static final class EqualsEverything implements Handler {
        @Override
        public void handle(Object... args) {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EqualsEverything;
        }

        @Override
        public int hashCode() {
            return 1;
        }
    }

    @Test
    @DisplayName("Should find a handler by identity, not by equals")
    void shouldLookUpByIdentity() {
        Handler a = new EqualsEverything();
        Handler b = new EqualsEverything();
        Map<HandlerReference, String> table = new HashMap<>();
        table.put(new HandlerReference(a, SubscriptionId.next("E"), false), "a");

        assertThat(table.get(HandlerReference.lookupKey(a))).isEqualTo("a");
        assertThat(table.get(HandlerReference.lookupKey(b))).isNull();
    }

    @Test
    @DisplayName("Should only equal itself once cleared")
    void shouldOnlyEqualItselfOnceCleared() {
        Handler handler = new EqualsEverything();
        HandlerReference reference = new HandlerReference(handler, SubscriptionId.next("E"), false);
        HandlerReference key = HandlerReference.lookupKey(handler);

        assertThat(reference).isEqualTo(key);
        assertThat(reference.hashCode()).isEqualTo(key.hashCode());
        reference.clear();

        assertThat(reference.isReclaimed()).isTrue();
        assertThat(reference).isEqualTo(reference).isNotEqualTo(key);
        assertThat(reference.hashCode()).isEqualTo(key.hashCode());
    }

    @Test
    @DisplayName("Should keep one-shot and regular keys of the same handler apart")
    void shouldSeparateOnceKeysFromRegularKeys() {
        Handler handler = new EqualsEverything();
        Map<HandlerReference, String> table = new HashMap<>();
        table.put(new HandlerReference(handler, SubscriptionId.next("E"), false), "regular");
        table.put(new HandlerReference(handler, SubscriptionId.next("E"), true), "once");

        assertThat(table).hasSize(2);
        assertThat(table.get(HandlerReference.lookupKey(handler))).isEqualTo("regular");
        assertThat(table.get(HandlerReference.lookupKey(handler, true))).isEqualTo("once");
        assertThat(HandlerReference.lookupKey(handler, true).isOnce()).isTrue();
    }
}
