package com.delta.jobharvest.crawl.extract;

import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * One fallback strategy for a single record field. Implementations must not modify the document.
 */
@FunctionalInterface
public interface FieldExtractor {
    Optional<FieldValue> extract(Document document);
}
