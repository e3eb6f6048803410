package org.audioshelf.service.source;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps a minimum interval between consecutive calls to one external source.
 */
public class RequestThrottle {

    private final long minIntervalMs;
    private final AtomicLong lastRequestTime = new AtomicLong(0);

    public RequestThrottle(Duration minInterval) {
        this.minIntervalMs = minInterval == null ? 0 : minInterval.toMillis();
    }

    public synchronized void acquire() {
        long elapsed = System.currentTimeMillis() - lastRequestTime.get();
        if (elapsed < minIntervalMs) {
            try {
                Thread.sleep(minIntervalMs - elapsed);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        lastRequestTime.set(System.currentTimeMillis());
    }
}
