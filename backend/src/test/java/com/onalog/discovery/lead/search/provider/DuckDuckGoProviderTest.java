package com.onalog.discovery.lead.search.provider;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.http.PoliteHttpClient;
import com.onalog.discovery.lead.model.HttpFetchResult;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.ProviderFailure;
import com.onalog.discovery.lead.model.ProviderResult;
import com.onalog.discovery.lead.search.SearchQuery;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DuckDuckGoProviderTest {
    private static final String RESULTS_HTML = """
        <html><body>
        <div class="result">
          <a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fjavahouse.co.ke%2F&rut=x">Java House</a>
          <a class="result__snippet">Coffee shops across Nairobi</a>
        </div>
        <div class="result">
          <a class="result__a" href="https://www.yelp.com/search?find_desc=cafes">Best cafes - Yelp</a>
        </div>
        <div class="web-result">
          <h2><a href="https://artcaffe.co.ke/">Artcaffe</a></h2>
        </div>
        </body></html>
        """;

    private final PoliteHttpClient httpClient = Mockito.mock(PoliteHttpClient.class);
    private final List<Duration> sleeps = new ArrayList<>();
    private final DuckDuckGoProvider provider = new DuckDuckGoProvider(httpClient, new DiscoveryProperties(), duration -> {
        sleeps.add(duration);
        return true;
    });

    @Test
    void throttledResponsesBackOffBetweenAttemptsThenGiveUp() {
        when(httpClient.getOnce(anyString(), anyString(), any(Duration.class))).thenReturn(fetch(202, ""));

        ProviderResult result = provider.attempt(SearchQuery.of("cafes", "ke", "Nairobi", 50));

        assertThat(result.failure()).isEqualTo(ProviderFailure.RATE_LIMITED);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(30), Duration.ofSeconds(60));
        verify(httpClient, times(3)).getOnce(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void recoversAfterOneThrottledAttempt() {
        when(httpClient.getOnce(anyString(), anyString(), any(Duration.class)))
            .thenReturn(fetch(429, "slow down"))
            .thenReturn(fetch(200, RESULTS_HTML));

        ProviderResult result = provider.attempt(SearchQuery.of("cafes", "ke", "Nairobi", 50));

        assertThat(result.isFailure()).isFalse();
        assertThat(result.candidates()).extracting(LeadCandidate::link)
            .containsExactly("https://javahouse.co.ke/", "https://artcaffe.co.ke/");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(30));
    }

    @Test
    void serverErrorFailsWithoutBackoff() {
        when(httpClient.getOnce(anyString(), anyString(), any(Duration.class))).thenReturn(fetch(500, "boom"));

        ProviderResult result = provider.attempt(SearchQuery.of("cafes", null, null, 50));

        assertThat(result.failure()).isEqualTo(ProviderFailure.ERROR);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void parseHonorsMaximumAndResolvesRedirects() {
        List<LeadCandidate> candidates = DuckDuckGoProvider.parse(RESULTS_HTML, 1);

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).title()).isEqualTo("Java House");
        assertThat(candidates.get(0).snippet()).isEqualTo("Coffee shops across Nairobi");
        assertThat(DuckDuckGoProvider.resolveRedirect("//example.com/x")).isEqualTo("https://example.com/x");
    }

    private static HttpFetchResult fetch(int status, String body) {
        return new HttpFetchResult(
            "https://html.duckduckgo.com/html/",
            null,
            status,
            body,
            "text/html",
            Instant.now(),
            Duration.ofMillis(10),
            null,
            null
        );
    }
}
