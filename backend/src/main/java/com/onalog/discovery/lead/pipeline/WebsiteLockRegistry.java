package com.onalog.discovery.lead.pipeline;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serializes extraction of the same website within one search job. Waiting is bounded: after the deadline the
 * caller proceeds without the lock and is expected to re-check for a lead saved in the meantime.
 */
@Component
public class WebsiteLockRegistry {
    private final ConcurrentHashMap<String, CompletableFuture<Void>> locks = new ConcurrentHashMap<>();

    public HostLock acquire(long searchJobId, String host, Duration maxWait) {
        String key = searchJobId + ":" + host;
        long deadline = System.nanoTime() + maxWait.toNanos();
        boolean waited = false;
        while (true) {
            CompletableFuture<Void> mine = new CompletableFuture<>();
            CompletableFuture<Void> holder = locks.putIfAbsent(key, mine);
            if (holder == null) {
                return new HostLock(key, mine, waited);
            }
            waited = true;
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return new HostLock(key, null, true);
            }
            try {
                holder.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return new HostLock(key, null, true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new HostLock(key, null, true);
            } catch (ExecutionException e) {
                // holders only complete normally; retry the acquisition
                continue;
            }
        }
    }

    /**
     * A lock that is never contended, for candidates without a comparable hostname.
     */
    public HostLock unlocked() {
        return new HostLock(null, null, false);
    }

    boolean isLocked(long searchJobId, String host) {
        return locks.containsKey(searchJobId + ":" + host);
    }

    public final class HostLock implements AutoCloseable {
        private final String key;
        private final CompletableFuture<Void> signal;
        private final boolean waited;

        private HostLock(String key, CompletableFuture<Void> signal, boolean waited) {
            this.key = key;
            this.signal = signal;
            this.waited = waited;
        }

        public boolean waited() {
            return waited;
        }

        public boolean owned() {
            return signal != null;
        }

        @Override
        public void close() {
            if (signal != null) {
                locks.remove(key, signal);
                signal.complete(null);
            }
        }
    }
}
