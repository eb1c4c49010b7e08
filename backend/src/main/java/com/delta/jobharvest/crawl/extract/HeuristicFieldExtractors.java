package com.delta.jobharvest.crawl.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the ordered per-field selector cascades used by the markup tier. Each configured CSS
 * selector becomes one {@link FieldExtractor}; the first one that yields a non-blank value wins.
 */
public final class HeuristicFieldExtractors {
    private static final Logger log = LoggerFactory.getLogger(HeuristicFieldExtractors.class);

    private final Map<RecordField, List<FieldExtractor>> extractors;

    private HeuristicFieldExtractors(Map<RecordField, List<FieldExtractor>> extractors) {
        this.extractors = extractors;
    }

    public static HeuristicFieldExtractors fromSelectors(Map<String, List<String>> selectorsByField) {
        Map<RecordField, List<FieldExtractor>> out = new EnumMap<>(RecordField.class);
        if (selectorsByField != null) {
            for (Map.Entry<String, List<String>> entry : selectorsByField.entrySet()) {
                RecordField field = RecordField.fromKey(entry.getKey());
                if (field == null) {
                    log.warn("Ignoring selectors for unknown record field '{}'", entry.getKey());
                    continue;
                }
                List<FieldExtractor> cascade = out.computeIfAbsent(field, ignored -> new ArrayList<>());
                for (String selector : entry.getValue() == null ? List.<String>of() : entry.getValue()) {
                    if (selector == null || selector.isBlank()) {
                        continue;
                    }
                    cascade.add(field == RecordField.DESCRIPTION ? htmlBlock(selector.trim()) : css(selector.trim()));
                }
            }
        }
        return new HeuristicFieldExtractors(out);
    }

    public List<FieldExtractor> forField(RecordField field) {
        return Collections.unmodifiableList(extractors.getOrDefault(field, List.of()));
    }

    public Optional<FieldValue> firstMatch(RecordField field, Document document) {
        for (FieldExtractor extractor : forField(field)) {
            Optional<FieldValue> value = extractor.extract(document);
            if (value.isPresent() && value.get().isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Text of the first element matching {@code selector}. {@code meta} elements yield their
     * {@code content} attribute and {@code time} elements prefer {@code datetime}.
     */
    public static FieldExtractor css(String selector) {
        return document -> {
            for (Element element : select(document, selector)) {
                String value = valueOf(element);
                if (value != null) {
                    return Optional.of(FieldValue.ofText(value));
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Like {@link #css} but also keeps the cleaned inner HTML of the matched element.
     */
    public static FieldExtractor htmlBlock(String selector) {
        return document -> {
            for (Element element : select(document, selector)) {
                String text = valueOf(element);
                if (text != null) {
                    String html = "meta".equals(tag(element)) ? null : TextNormalizer.cleanHtml(element);
                    return Optional.of(new FieldValue(text, html));
                }
            }
            return Optional.empty();
        };
    }

    private static List<Element> select(Document document, String selector) {
        try {
            return document.select(selector);
        } catch (Selector.SelectorParseException e) {
            log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            return List.of();
        }
    }

    private static String valueOf(Element element) {
        String tag = tag(element);
        if ("meta".equals(tag)) {
            return TextNormalizer.collapseWhitespace(element.attr("content"));
        }
        if ("time".equals(tag) && element.hasAttr("datetime")) {
            String datetime = TextNormalizer.collapseWhitespace(element.attr("datetime"));
            if (datetime != null) {
                return datetime;
            }
        }
        Element copy = element.clone();
        copy.select("script, style, noscript, iframe").remove();
        return TextNormalizer.collapseWhitespace(copy.text());
    }

    private static String tag(Element element) {
        return element.tagName().toLowerCase(Locale.ROOT);
    }
}
