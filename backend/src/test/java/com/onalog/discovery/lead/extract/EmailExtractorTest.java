package com.onalog.discovery.lead.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmailExtractorTest {

    @Test
    void collectsMailtoTextAndObfuscatedAddresses() {
        Document document = Jsoup.parse(
            """
                <html><body>
                <a href="mailto:Sales@Acme.com?subject=Hi">Email sales</a>
                <p>Reach support at support@acme.com.</p>
                <p>Press: press [at] acme [dot] com</p>
                </body></html>
                """
        );

        List<String> emails = EmailExtractor.extract(document);

        assertThat(emails).containsExactly("sales@acme.com", "support@acme.com", "press@acme.com");
    }

    @Test
    void dropsPlaceholderAndAssetAddresses() {
        List<String> emails = EmailExtractor.extractFromText(
            "noreply@acme.com user@domain.com logo@2x.png info@example.com hello@acme.io"
        );

        assertThat(emails).containsExactly("hello@acme.io");
    }

    @Test
    void businessEmailCheck() {
        assertThat(EmailExtractor.isBusinessEmail("ceo@acme.com")).isTrue();
        assertThat(EmailExtractor.isBusinessEmail("test@acme.com")).isFalse();
        assertThat(EmailExtractor.isBusinessEmail("not-an-email")).isFalse();
    }
}
