package com.delta.jobharvest.crawl.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void truncateNeverSplitsASurrogatePair() {
        String value = "ab😀cd";

        assertThat(TextNormalizer.truncate(value, 3)).isEqualTo("ab");
        assertThat(TextNormalizer.truncate(value, 4)).isEqualTo("ab😀");
        assertThat(TextNormalizer.truncate(value, 10)).isEqualTo(value);
    }

    @Test
    void unsafeSubtreesForceACleanedCopy() {
        String source = "<p>Apply</p><script>track()</script>";
        Element parsed = Jsoup.parseBodyFragment(source).body();

        assertThat(TextNormalizer.passThroughOrClean(source, parsed)).isEqualTo("<p>Apply</p>");
        assertThat(parsed.select("script")).hasSize(1);
    }

    @Test
    void collapsesNonBreakingSpaces() {
        assertThat(TextNormalizer.collapseWhitespace(" Senior\u00A0 Engineer \n")).isEqualTo("Senior Engineer");
        assertThat(TextNormalizer.collapseWhitespace("\u00A0 ")).isNull();
    }
}
