package com.delta.jobharvest.crawl.model;

/**
 * Unit of crawl work. {@code url} is already normalized; {@code pageNumber} and {@code seed} are
 * only meaningful for listing tasks. {@code plannedButNotYetCounted} is true while a detail task
 * holds a planned slot in the run's budget.
 */
public record CrawlTask(
    String url,
    TaskKind kind,
    int pageNumber,
    ListingSeed seed,
    String referer,
    int attempt,
    boolean plannedButNotYetCounted,
    String affinityKey
) {
    public static CrawlTask listing(String url, ListingSeed seed, int pageNumber, String referer, String affinityKey) {
        return new CrawlTask(url, TaskKind.LISTING, pageNumber, seed, referer, 0, false, affinityKey);
    }

    public static CrawlTask detail(String url, String referer, int listingPageNumber) {
        return new CrawlTask(url, TaskKind.DETAIL, listingPageNumber, null, referer, 0, false, null);
    }

    public boolean isListing() {
        return kind == TaskKind.LISTING;
    }

    public boolean isDetail() {
        return kind == TaskKind.DETAIL;
    }

    public CrawlTask nextAttempt() {
        return new CrawlTask(url, kind, pageNumber, seed, referer, attempt + 1, plannedButNotYetCounted, affinityKey);
    }

    public CrawlTask withUrl(String normalizedUrl) {
        return new CrawlTask(normalizedUrl, kind, pageNumber, seed, referer, attempt, plannedButNotYetCounted, affinityKey);
    }

    public CrawlTask markPlanned() {
        return new CrawlTask(url, kind, pageNumber, seed, referer, attempt, true, affinityKey);
    }
}
