package com.delta.jobharvest.crawl.extract;

import org.jsoup.nodes.Element;

public final class TextNormalizer {
    private static final String UNSAFE_SUBTREES = "script, style, noscript, iframe";

    private TextNormalizer() {
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return null;
        }
        // non-breaking spaces are not matched by \s
        String collapsed = value.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    /**
     * Inner HTML of {@code element} with script, style, noscript and iframe subtrees removed.
     * The element itself is left untouched.
     */
    public static String cleanHtml(Element element) {
        if (element == null) {
            return null;
        }
        Element copy = element.clone();
        copy.select(UNSAFE_SUBTREES).remove();
        String html = copy.html().trim();
        return html.isEmpty() ? null : html;
    }

    /**
     * Returns {@code source} as given when its parsed form has nothing to strip, otherwise the
     * cleaned re-serialization of {@code parsed}.
     */
    public static String passThroughOrClean(String source, Element parsed) {
        if (source == null || parsed == null) {
            return null;
        }
        if (parsed.select(UNSAFE_SUBTREES).isEmpty()) {
            String trimmed = source.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        return cleanHtml(parsed);
    }

    public static String truncate(String value, int maxChars) {
        if (value == null || maxChars <= 0 || value.length() <= maxChars) {
            return value;
        }
        int end = maxChars;
        // never split a surrogate pair
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
