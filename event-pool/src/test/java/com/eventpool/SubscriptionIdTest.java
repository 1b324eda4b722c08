package com.eventpool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SubscriptionId Tests")
class SubscriptionIdTest {

    @Test
    @DisplayName("Should never mint two equal identifiers")
    void shouldMintUniqueIdentifiers() {
        SubscriptionId first = SubscriptionId.next("E");
        SubscriptionId second = SubscriptionId.next("E");

        assertThat(first).isNotEqualTo(second);
        assertThat(second.getSequence()).isGreaterThan(first.getSequence());
    }

    @Test
    @DisplayName("Should compare by identity only")
    void shouldCompareByIdentity() {
        SubscriptionId id = SubscriptionId.next("E");

        assertThat(id).isEqualTo(id);
        assertThat(id.hashCode()).isEqualTo(System.identityHashCode(id));
    }

    @Test
    @DisplayName("Should describe its event and sequence")
    void shouldDescribeItself() {
        SubscriptionId id = SubscriptionId.next("order:created");

        assertThat(id.getEvent()).isEqualTo("order:created");
        assertThat(id).hasToString("SubscriptionId(order:created#" + id.getSequence() + ")");
    }
}
