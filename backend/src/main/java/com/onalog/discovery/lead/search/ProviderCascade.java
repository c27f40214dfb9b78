package com.onalog.discovery.lead.search;

import com.onalog.discovery.lead.model.ProviderFailure;
import com.onalog.discovery.lead.model.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs provider strategies on the provider pool with a wall-clock bound each. Late or crashing providers turn
 * into failure results; the cascade itself never throws.
 */
@Component
public class ProviderCascade {
    private static final Logger log = LoggerFactory.getLogger(ProviderCascade.class);

    private final ExecutorService providerExecutor;

    public ProviderCascade(@Qualifier("providerExecutor") ExecutorService providerExecutor) {
        this.providerExecutor = providerExecutor;
    }

    public ProviderResult run(ProviderStrategy strategy, SearchQuery query, Duration timeout) {
        return runParallel(List.of(strategy), query, ignored -> timeout).get(0);
    }

    public List<ProviderResult> runParallel(
        List<ProviderStrategy> strategies,
        SearchQuery query,
        Function<ProviderStrategy, Duration> timeoutOf
    ) {
        long startedAt = System.nanoTime();
        List<Future<ProviderResult>> futures = new ArrayList<>();
        for (ProviderStrategy strategy : strategies) {
            futures.add(providerExecutor.submit(() -> attemptSafely(strategy, query)));
        }
        List<ProviderResult> results = new ArrayList<>();
        for (int i = 0; i < strategies.size(); i++) {
            ProviderStrategy strategy = strategies.get(i);
            Future<ProviderResult> future = futures.get(i);
            long deadline = startedAt + timeoutOf.apply(strategy).toNanos();
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                results.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Provider {} timed out after {}", strategy.name(), timeoutOf.apply(strategy));
                results.add(ProviderResult.failure(strategy.name(), ProviderFailure.TIMEOUT, "provider timed out"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results.add(ProviderResult.failure(strategy.name(), ProviderFailure.TIMEOUT, "interrupted"));
            } catch (ExecutionException e) {
                log.warn("Provider {} failed", strategy.name(), e.getCause());
                results.add(ProviderResult.failure(strategy.name(), ProviderFailure.ERROR, String.valueOf(e.getCause())));
            }
        }
        return results;
    }

    private ProviderResult attemptSafely(ProviderStrategy strategy, SearchQuery query) {
        try {
            ProviderResult result = strategy.attempt(query);
            if (result == null) {
                return ProviderResult.failure(strategy.name(), ProviderFailure.ERROR, "no result");
            }
            if (result.isFailure()) {
                log.info("Provider {} returned {}: {}", strategy.name(), result.failure(), result.message());
            } else {
                log.info("Provider {} returned {} candidates", strategy.name(), result.count());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Provider {} threw", strategy.name(), e);
            return ProviderResult.failure(strategy.name(), ProviderFailure.ERROR, e.getMessage());
        }
    }
}
