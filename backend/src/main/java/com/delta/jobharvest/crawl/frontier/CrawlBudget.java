package com.delta.jobharvest.crawl.frontier;

import com.delta.jobharvest.crawl.model.CrawlRunProgress;

/**
 * Per-run item and page counters. Every read-modify-write happens under this object's monitor,
 * so {@code itemsSaved + itemsPlanned} never exceeds {@code maxItems}.
 */
public class CrawlBudget {
    private final int maxItems;

    private int itemsSaved;
    private int itemsPlanned;
    private int pagesVisited;
    private int abandonedTasks;
    private int extractionFailures;

    /**
     * @param maxItems item limit for the run; zero or less means unlimited
     */
    public CrawlBudget(int maxItems) {
        this.maxItems = maxItems <= 0 ? Integer.MAX_VALUE : maxItems;
    }

    public int maxItems() {
        return maxItems;
    }

    public synchronized boolean hasCapacity() {
        return (long) itemsSaved + itemsPlanned < maxItems;
    }

    public synchronized boolean tryReservePlanned() {
        if (!hasCapacity()) {
            return false;
        }
        itemsPlanned++;
        return true;
    }

    /**
     * Releases one planned slot, converting it into a saved item when {@code saved} is true.
     */
    public synchronized void resolvePlanned(boolean saved) {
        if (itemsPlanned > 0) {
            itemsPlanned--;
        }
        if (saved) {
            itemsSaved++;
        }
    }

    public synchronized void recordPageVisited() {
        pagesVisited++;
    }

    public synchronized void recordAbandoned() {
        abandonedTasks++;
    }

    public synchronized void recordExtractionFailure() {
        extractionFailures++;
    }

    public synchronized int itemsSaved() {
        return itemsSaved;
    }

    public synchronized int itemsPlanned() {
        return itemsPlanned;
    }

    public synchronized int pagesVisited() {
        return pagesVisited;
    }

    public synchronized CrawlRunProgress snapshot() {
        return new CrawlRunProgress(itemsSaved, itemsPlanned, pagesVisited, abandonedTasks, extractionFailures);
    }
}
