package com.airlinereservation.booking.service.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JitteredBackoff Unit Tests")
class JitteredBackoffTest {

    @Test
    @DisplayName("Should draw every delay inside the configured bounds")
    void nextDelayMillis_StaysWithinBounds() {
        JitteredBackoff backoff = new JitteredBackoff(1, 50);

        for (int i = 0; i < 1_000; i++) {
            assertThat(backoff.nextDelayMillis()).isBetween(1L, 50L);
        }
    }

    @Test
    @DisplayName("Should reject an upper bound below the lower bound")
    void constructor_InvertedBounds_Throws() {
        assertThatThrownBy(() -> new JitteredBackoff(10, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should stop waiting and keep the interrupt flag when interrupted")
    void pause_Interrupted_ReturnsFalse() {
        JitteredBackoff backoff = new JitteredBackoff(5, 10);

        Thread.currentThread().interrupt();
        try {
            assertThat(backoff.pause(1)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
