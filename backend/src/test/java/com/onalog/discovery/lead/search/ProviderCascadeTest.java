package com.onalog.discovery.lead.search;

import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.ProviderFailure;
import com.onalog.discovery.lead.model.ProviderResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCascadeTest {
    private final ExecutorService providerExecutor = Executors.newFixedThreadPool(2);
    private final ProviderCascade cascade = new ProviderCascade(providerExecutor);

    @AfterEach
    void tearDown() {
        providerExecutor.shutdownNow();
    }

    @Test
    void timedOutProviderThreadIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        ProviderStrategy slow = strategy("slow", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return ProviderResult.success("slow", List.of());
        });

        ProviderResult result = cascade.run(slow, query(), Duration.ofMillis(100));

        assertThat(result.failure()).isEqualTo(ProviderFailure.TIMEOUT);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void crashingProviderBecomesErrorResult() {
        ProviderStrategy broken = strategy("broken", () -> {
            throw new IllegalStateException("boom");
        });
        ProviderStrategy healthy = strategy("healthy", () -> ProviderResult.success(
            "healthy",
            List.of(LeadCandidate.of("Cafe One", "https://cafe-one.co.ke/", "", "healthy"))
        ));

        List<ProviderResult> results = cascade.runParallel(List.of(broken, healthy), query(), ignored -> Duration.ofSeconds(2));

        assertThat(results.get(0).failure()).isEqualTo(ProviderFailure.ERROR);
        assertThat(results.get(1).count()).isEqualTo(1);
    }

    private static SearchQuery query() {
        return new SearchQuery("cafes", List.of("cafes"), "ke", "Nairobi", 50);
    }

    private static ProviderStrategy strategy(String name, Supplier<ProviderResult> body) {
        return new ProviderStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ProviderTier tier() {
                return ProviderTier.WEB;
            }

            @Override
            public ProviderResult attempt(SearchQuery query) {
                return body.get();
            }
        };
    }
}
