package com.delta.jobharvest.crawl.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    void canonicalFormIgnoresCaseDefaultPortFragmentAndParamOrder() {
        assertThat(UrlNormalizer.normalize("HTTPS://Jobs.Example.TEST:443?b=2&a=1#frag"))
            .isEqualTo("https://jobs.example.test/?a=1&b=2");
        assertThat(UrlNormalizer.normalize("http://jobs.example.test:8080/desc/1"))
            .isEqualTo("http://jobs.example.test:8080/desc/1");
    }

    @Test
    void nonHttpAndRelativeUrlsAreRejected() {
        assertThat(UrlNormalizer.normalize("ftp://jobs.example.test/file")).isNull();
        assertThat(UrlNormalizer.normalize("/desc/1")).isNull();
        assertThat(UrlNormalizer.normalize(null)).isNull();
    }
}
