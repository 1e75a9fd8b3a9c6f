package com.baykanat.iot.ingestion.domain.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for BoundedQueue: capacity limit, FIFO drain order and non-blocking offer.
 */
class BoundedQueueTest {

    @Test
    @DisplayName("offer - returns false at capacity and true again once room frees up")
    void offerRespectsCapacity() {
        BoundedQueue<String> queue = new BoundedQueue<>(2);

        assertThat(queue.offer("a")).isTrue();
        assertThat(queue.offer("b")).isTrue();
        assertThat(queue.offer("c")).isFalse();
        assertThat(queue.size()).isEqualTo(2);

        queue.drainUpTo(1);

        assertThat(queue.offer("c")).isTrue();
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("drainUpTo - removes oldest items first and never more than requested")
    void drainUpToIsFifoAndBounded() {
        BoundedQueue<Integer> queue = new BoundedQueue<>(10);
        for (int i = 0; i < 5; i++) {
            queue.offer(i);
        }

        assertThat(queue.drainUpTo(3)).containsExactly(0, 1, 2);
        assertThat(queue.drainUpTo(10)).containsExactly(3, 4);
        assertThat(queue.drainUpTo(10)).isEmpty();
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("tryReserve - reserved slots count against capacity until drained")
    void reservationHoldsCapacity() {
        BoundedQueue<String> queue = new BoundedQueue<>(2);

        assertThat(queue.tryReserve()).isTrue();
        assertThat(queue.tryReserve()).isTrue();
        assertThat(queue.tryReserve()).isFalse();
        assertThat(queue.offer("x")).isFalse();

        queue.putReserved("a");
        queue.putReserved("b");
        assertThat(queue.tryReserve()).isFalse();

        assertThat(queue.drainUpTo(1)).containsExactly("a");
        assertThat(queue.tryReserve()).isTrue();
    }

    @Test
    @DisplayName("drainUpTo - non-positive max drains nothing")
    void drainUpToZero() {
        BoundedQueue<String> queue = new BoundedQueue<>(1);
        queue.offer("a");

        assertThat(queue.drainUpTo(0)).isEqualTo(List.of());
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("constructor - capacity must be positive")
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedQueue<>(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
