package com.delta.jobharvest.crawl.extract;

/**
 * Extracted field content. {@code html} is only populated for the description field.
 */
public record FieldValue(String text, String html) {
    public static FieldValue ofText(String text) {
        return new FieldValue(text, null);
    }

    public boolean isPresent() {
        return text != null && !text.isBlank();
    }
}
