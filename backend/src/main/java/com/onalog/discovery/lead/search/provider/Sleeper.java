package com.onalog.discovery.lead.search.provider;

import java.time.Duration;

/**
 * Waits between provider retries. Returns false when the wait was interrupted.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    };

    boolean sleep(Duration duration);
}
