package com.delta.jobharvest.crawl.extract;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DetailLinkExtractorTest {

    @Test
    void keepsMatchingLinksInDocumentOrderWithoutDuplicates() {
        DetailLinkExtractor extractor = new DetailLinkExtractor(List.of("/desc/"));
        String html = """
            <a href="/desc/2?utm=x">Second</a>
            <a href="https://jobs.example.test/DESC/1">First</a>
            <a href="/about">About</a>
            <a href="/desc/2?utm=x#apply">Second again</a>
            <a>no href</a>
            """;

        List<String> links = extractor.extract(Jsoup.parse(html, "https://jobs.example.test/search?ukw=java"));

        assertThat(links).containsExactly(
            "https://jobs.example.test/desc/2?utm=x",
            "https://jobs.example.test/DESC/1"
        );
    }

    @Test
    void invalidPatternsAreSkipped() {
        DetailLinkExtractor extractor = new DetailLinkExtractor(List.of("(", "/jobs/\\d+"));
        assertThat(extractor.matches("https://example.test/jobs/42")).isTrue();
        assertThat(extractor.matches("https://example.test/jobs/new")).isFalse();
    }
}
