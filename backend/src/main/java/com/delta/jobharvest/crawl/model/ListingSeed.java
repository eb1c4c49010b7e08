package com.delta.jobharvest.crawl.model;

/**
 * Origin of one pagination sequence. Either {@code startUrl} is set, in which case its query is
 * preserved and only the page parameter changes, or the listing URL is built from
 * {@code searchTerm} and the optional {@code location}.
 */
public record ListingSeed(
    String startUrl,
    String searchTerm,
    String location
) {
    public static ListingSeed ofStartUrl(String startUrl) {
        return new ListingSeed(startUrl, null, null);
    }

    public static ListingSeed ofSearch(String searchTerm, String location) {
        return new ListingSeed(null, searchTerm, location);
    }

    public boolean hasStartUrl() {
        return startUrl != null && !startUrl.isBlank();
    }

    public String label() {
        if (hasStartUrl()) {
            return startUrl;
        }
        if (location == null || location.isBlank()) {
            return searchTerm;
        }
        return searchTerm + " @ " + location;
    }
}
