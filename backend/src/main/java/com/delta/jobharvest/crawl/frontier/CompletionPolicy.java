package com.delta.jobharvest.crawl.frontier;

public class CompletionPolicy {
    private final CrawlBudget budget;

    public CompletionPolicy(CrawlBudget budget) {
        this.budget = budget;
    }

    public boolean shouldAdmitMore() {
        return budget.hasCapacity();
    }

    /**
     * True once the saved-item count has reached the limit; the run stops pulling new work.
     */
    public boolean isComplete() {
        return budget.itemsSaved() >= budget.maxItems();
    }
}
