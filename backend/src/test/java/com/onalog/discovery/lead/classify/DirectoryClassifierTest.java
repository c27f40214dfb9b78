package com.onalog.discovery.lead.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.extract.JsonLdReader;
import com.onalog.discovery.lead.http.PoliteHttpClient;
import com.onalog.discovery.lead.model.ClassificationResult;
import com.onalog.discovery.lead.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DirectoryClassifierTest {
    private final PoliteHttpClient httpClient = Mockito.mock(PoliteHttpClient.class);
    private final DirectoryClassifier classifier = new DirectoryClassifier(
        httpClient,
        new JsonLdReader(new ObjectMapper()),
        new DiscoveryProperties()
    );

    @Test
    void businessSchemaScoresFirstParty() {
        Document document = Jsoup.parse(
            """
                <html><head><title>Java House | Coffee in Nairobi</title>
                <script type="application/ld+json">{"@type":"CafeOrCoffeeShop","name":"Java House"}</script>
                </head><body><a href="/menu">Menu</a><a href="/contact">Contact</a></body></html>
                """,
            "https://javahouse.co.ke/"
        );

        ClassificationResult result = classifier.classify("https://javahouse.co.ke/", document);

        assertThat(result.score()).isPositive();
        assertThat(result.isFirstParty()).isTrue();
        assertThat(result.reasons()).contains("business_schema");
        assertThat(classifier.isRejected(result)).isFalse();
    }

    @Test
    void listiclePageIsRejected() {
        StringBuilder links = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            links.append("<a href=\"https://cafe").append(i).append(".co.ke/\">Cafe ").append(i).append("</a>");
        }
        Document document = Jsoup.parse(
            "<html><head><title>Top 10 cafes in Nairobi</title>"
                + "<script type=\"application/ld+json\">{\"@type\":\"ItemList\",\"itemListElement\":[1,2,3,4,5]}</script>"
                + "</head><body>" + links + "</body></html>",
            "https://guide.example.org/top-10-cafes-nairobi"
        );

        ClassificationResult result = classifier.classify("https://guide.example.org/top-10-cafes-nairobi", document);

        assertThat(result.score()).isLessThanOrEqualTo(-3);
        assertThat(result.reasons()).contains("listicle_path", "listicle_title", "item_list_schema", "external_link_ratio");
        assertThat(classifier.isRejected(result)).isTrue();
    }

    @Test
    void fetchFailureFallsBackToNeutral() {
        when(httpClient.get(anyString(), anyString(), any(Duration.class))).thenReturn(new HttpFetchResult(
            "https://down.example.com",
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.ZERO,
            HttpFetchResult.ERROR_TIMEOUT,
            "timed out"
        ));

        ClassificationResult result = classifier.classify("https://down.example.com");

        assertThat(result.score()).isZero();
        assertThat(classifier.isRejected(result)).isFalse();
    }

    @Test
    void successfulClassificationIsCached() {
        when(httpClient.get(eq("https://acme.com/"), anyString(), any(Duration.class))).thenReturn(new HttpFetchResult(
            "https://acme.com/",
            null,
            200,
            "<html><head><title>Acme</title></head><body><a href=\"/about\">About</a></body></html>",
            "text/html",
            Instant.now(),
            Duration.ofMillis(5),
            null,
            null
        ));

        classifier.classify("https://acme.com/");
        classifier.classify("https://ACME.com/");

        verify(httpClient, times(1)).get(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void knownAggregatorsAndListingPathsAreDirectorySites() {
        assertThat(DirectorySites.isDirectorySite("https://www.yelp.com/biz/java-house")).isTrue();
        assertThat(DirectorySites.isDirectorySite("https://example.com/real-estate-agents/nairobi")).isTrue();
        assertThat(DirectorySites.isDirectorySite("https://javahouse.co.ke/")).isFalse();
        assertThat(DirectorySites.isArticlePage("https://acme.com/blog/our-story")).isTrue();
        assertThat(DirectorySites.isArticlePage("https://acme.com/2023/05/launch")).isTrue();
        assertThat(DirectorySites.isArticlePage("https://acme.com/about")).isFalse();
    }
}
