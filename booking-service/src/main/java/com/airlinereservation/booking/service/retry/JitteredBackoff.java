package com.airlinereservation.booking.service.retry;

import com.airlinereservation.booking.constants.BookingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Random pause between optimistic retries.
 * <p>
 * Every delay is drawn uniformly from {@code [minMillis, maxMillis]} so that callers that
 * lost the same version race do not retry in lock step.
 */
@Component
@Slf4j
public class JitteredBackoff {

    private final long minMillis;
    private final long maxMillis;

    public JitteredBackoff(
            @Value("${booking.backoff.min-millis:" + BookingConstants.DEFAULT_BACKOFF_MIN_MILLIS + "}") long minMillis,
            @Value("${booking.backoff.max-millis:" + BookingConstants.DEFAULT_BACKOFF_MAX_MILLIS + "}") long maxMillis) {
        if (minMillis < 0 || maxMillis < minMillis) {
            throw new IllegalArgumentException("Invalid backoff bounds: min=" + minMillis + ", max=" + maxMillis);
        }
        this.minMillis = minMillis;
        this.maxMillis = maxMillis;
    }

    public long nextDelayMillis() {
        return ThreadLocalRandom.current().nextLong(minMillis, maxMillis + 1);
    }

    /**
     * Sleeps for a random delay.
     *
     * @return false if the thread was interrupted while waiting; the interrupt flag is restored
     */
    public boolean pause(int attempt) {
        long delay = nextDelayMillis();
        log.debug("Backing off: attempt={}, delayMs={}", attempt, delay);
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backoff interrupted: attempt={}", attempt);
            return false;
        }
    }

    public long getMinMillis() {
        return minMillis;
    }

    public long getMaxMillis() {
        return maxMillis;
    }
}
