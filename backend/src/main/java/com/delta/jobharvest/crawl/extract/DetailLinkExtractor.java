package com.delta.jobharvest.crawl.extract;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.util.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Links mode of the extraction pipeline: collects anchors whose absolute URL matches one of the
 * configured detail-page patterns, in document order, without duplicates.
 */
@Component
public class DetailLinkExtractor {
    private static final Logger log = LoggerFactory.getLogger(DetailLinkExtractor.class);

    private final List<Pattern> patterns;

    @Autowired
    public DetailLinkExtractor(HarvestProperties properties) {
        this(properties.getExtraction().getDetailUrlPatterns());
    }

    public DetailLinkExtractor(List<String> detailUrlPatterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String raw : detailUrlPatterns == null ? List.<String>of() : detailUrlPatterns) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                compiled.add(Pattern.compile(raw.trim(), Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid detail url pattern '{}': {}", raw, e.getDescription());
            }
        }
        this.patterns = List.copyOf(compiled);
    }

    public List<String> extract(Document document) {
        Set<String> seen = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String absolute = anchor.absUrl("href");
            if (absolute.isBlank() || !matches(absolute)) {
                continue;
            }
            String normalized = UrlNormalizer.normalize(absolute);
            if (normalized != null) {
                seen.add(normalized);
            }
        }
        return List.copyOf(seen);
    }

    public boolean matches(String url) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(url).find()) {
                return true;
            }
        }
        return false;
    }
}
