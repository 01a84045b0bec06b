package com.delta.newsdiscovery.crawl.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    void lowercasesSchemeAndHostAndDropsFragment() {
        assertThat(UrlNormalizer.normalize("HTTPS://Kenh14.VN/Star/Bai-Viet-1.chn#comments"))
            .isEqualTo("https://kenh14.vn/Star/Bai-Viet-1.chn");
    }

    @Test
    void dropsDefaultPortAndKeepsQuery() {
        assertThat(UrlNormalizer.normalize("https://nld.com.vn:443/thoi-su.htm?page=2"))
            .isEqualTo("https://nld.com.vn/thoi-su.htm?page=2");
        assertThat(UrlNormalizer.normalize("http://localhost:8080")).isEqualTo("http://localhost:8080/");
    }

    @Test
    void rejectsRelativeAndNonHttpUrls() {
        assertThat(UrlNormalizer.normalize("/thoi-su.htm")).isNull();
        assertThat(UrlNormalizer.normalize("ftp://files.test/a")).isNull();
        assertThat(UrlNormalizer.normalize("not a url")).isNull();
        assertThat(UrlNormalizer.normalize("  ")).isNull();
    }

    @Test
    void resolvesRelativeAndProtocolRelativeLinks() {
        assertThat(UrlNormalizer.resolve("https://thanhnien.vn/thoi-su.htm", "/bai-viet-185241.htm"))
            .isEqualTo("https://thanhnien.vn/bai-viet-185241.htm");
        assertThat(UrlNormalizer.resolve("https://znews.vn/xa-hoi.html", "//lifestyle.znews.vn/a-post1.html"))
            .isEqualTo("https://lifestyle.znews.vn/a-post1.html");
        assertThat(UrlNormalizer.resolve("https://znews.vn/", "javascript:void(0)")).isNull();
        assertThat(UrlNormalizer.resolve("https://znews.vn/", "#top")).isNull();
    }
}
