package com.onalog.discovery.lead.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HostnameNormalizerTest {

    @Test
    void decoratedUrlsCollapseToTheSameHost() {
        String expected = "acme.com";
        assertThat(HostnameNormalizer.normalize("https://www.Acme.com/about?x=1#team")).isEqualTo(expected);
        assertThat(HostnameNormalizer.normalize("http://acme.com:8080/")).isEqualTo(expected);
        assertThat(HostnameNormalizer.normalize("WWW.ACME.COM.")).isEqualTo(expected);
        assertThat(HostnameNormalizer.normalize("acme.com/contact")).isEqualTo(expected);
        assertThat(HostnameNormalizer.isSameHost("https://www.acme.com", "acme.com/careers")).isTrue();
    }

    @Test
    void subdomainsOtherThanWwwAreKept() {
        assertThat(HostnameNormalizer.normalize("https://shop.acme.com/")).isEqualTo("shop.acme.com");
        assertThat(HostnameNormalizer.isSameHost("https://shop.acme.com", "https://acme.com")).isFalse();
    }

    @Test
    void blankInputNormalizesToEmpty() {
        assertThat(HostnameNormalizer.normalize(null)).isEmpty();
        assertThat(HostnameNormalizer.normalize("   ")).isEmpty();
        assertThat(HostnameNormalizer.isSameHost("", "")).isFalse();
    }

    @Test
    void recognizesPlaceholderLinks() {
        assertThat(HostnameNormalizer.isPlaceholderLink("places:ChIJ123")).isTrue();
        assertThat(HostnameNormalizer.isPlaceholderLink("https://www.google.com/maps/place/x")).isTrue();
        assertThat(HostnameNormalizer.isPlaceholderLink("https://www.openstreetmap.org/node/42")).isTrue();
        assertThat(HostnameNormalizer.isPlaceholderLink(null)).isTrue();
        assertThat(HostnameNormalizer.isPlaceholderLink("https://acme.com")).isFalse();
    }

    @Test
    void domainTokenIsCapitalizedFirstLabel() {
        assertThat(HostnameNormalizer.domainToken("https://www.acme-labs.io/x")).isEqualTo("Acme-labs");
        assertThat(HostnameNormalizer.domainToken("")).isEmpty();
    }
}
