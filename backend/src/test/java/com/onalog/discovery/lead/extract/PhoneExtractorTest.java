package com.onalog.discovery.lead.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PhoneExtractorTest {

    @Test
    void telLinksRankFirstAndDuplicatesCollapse() {
        Document document = Jsoup.parse(
            """
                <html><body>
                <p>Office (415) 555-0134</p>
                <p>Call us: +254 20 765 4321</p>
                <a href="tel:+14155550199">Main line</a>
                <p>Alt: +1 415 555 0199</p>
                </body></html>
                """
        );

        List<String> phones = PhoneExtractor.extract(document);

        assertThat(phones).hasSize(3);
        assertThat(phones.get(0)).isEqualTo("+14155550199");
        assertThat(phones.get(1)).isEqualTo("+254207654321");
        assertThat(phones).contains("4155550134");
    }

    @Test
    void rejectsImplausibleNumbers() {
        assertThat(PhoneExtractor.isPlausible("1111111111")).isFalse();
        assertThat(PhoneExtractor.isPlausible("0000000000")).isFalse();
        assertThat(PhoneExtractor.isPlausible("1000000000")).isFalse();
        assertThat(PhoneExtractor.isPlausible("12345")).isFalse();
        assertThat(PhoneExtractor.isPlausible("+44 20 7946 0958")).isTrue();
    }
}
