package com.delta.jobharvest.crawl.frontier;

import com.delta.jobharvest.crawl.model.CrawlTask;
import com.delta.jobharvest.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deduplicated work queue for one run. A URL accepted once is never accepted again, even after
 * its task is abandoned. Listing tasks are handed out before detail tasks so that pagination is
 * never starved. All state is guarded by a single lock.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);

    private final CrawlBudget budget;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Set<String> seen = new HashSet<>();
    private final Deque<CrawlTask> listingQueue = new ArrayDeque<>();
    private final Deque<CrawlTask> detailQueue = new ArrayDeque<>();

    private int inFlight;
    private int awaitingRetry;
    private int acceptedDetails;
    private int rejectedDuplicates;
    private int rejectedOverBudget;
    private boolean closed;

    public Frontier(CrawlBudget budget) {
        this.budget = budget;
    }

    /**
     * Admits a new task. Returns false, without side effects, when the URL cannot be normalized,
     * has been seen before, the budget has no room left, or the frontier is closed. Accepting a
     * detail task reserves one planned item in the budget.
     */
    public boolean enqueue(CrawlTask task) {
        String normalized = UrlNormalizer.normalize(task.url());
        if (normalized == null) {
            log.debug("Rejected unparseable url {}", task.url());
            return false;
        }
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (seen.contains(normalized)) {
                rejectedDuplicates++;
                return false;
            }
            CrawlTask admitted = task.withUrl(normalized);
            if (task.isDetail()) {
                if (!budget.tryReservePlanned()) {
                    rejectedOverBudget++;
                    return false;
                }
                admitted = admitted.markPlanned();
                acceptedDetails++;
                detailQueue.addLast(admitted);
            } else {
                if (!budget.hasCapacity()) {
                    rejectedOverBudget++;
                    return false;
                }
                listingQueue.addLast(admitted);
            }
            seen.add(normalized);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next task. Returns null on timeout, once the frontier
     * is closed, or once it is exhausted.
     */
    public CrawlTask dequeue(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    return null;
                }
                CrawlTask next = listingQueue.pollFirst();
                if (next == null) {
                    next = detailQueue.pollFirst();
                }
                if (next != null) {
                    inFlight++;
                    return next;
                }
                if (isExhaustedLocked() || remaining <= 0) {
                    return null;
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a dequeued task as waiting for a delayed retry. It stays owned by the frontier until
     * {@link #requeue} or {@link #cancelRetry} is called.
     */
    public void awaitRetry(CrawlTask task) {
        lock.lock();
        try {
            inFlight = Math.max(0, inFlight - 1);
            awaitingRetry++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a retried task back in line. The URL is already owned by this task, so no dedup check
     * applies. Returns false if the frontier was closed in the meantime.
     */
    public boolean requeue(CrawlTask retry) {
        lock.lock();
        try {
            awaitingRetry = Math.max(0, awaitingRetry - 1);
            if (closed) {
                changed.signalAll();
                return false;
            }
            if (retry.isListing()) {
                listingQueue.addLast(retry);
            } else {
                detailQueue.addLast(retry);
            }
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void cancelRetry(CrawlTask task) {
        lock.lock();
        try {
            awaitingRetry = Math.max(0, awaitingRetry - 1);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a dequeued task as terminal.
     */
    public void resolve(CrawlTask task) {
        lock.lock();
        try {
            inFlight = Math.max(0, inFlight - 1);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns every task still waiting in the queues.
     */
    public List<CrawlTask> drainQueued() {
        lock.lock();
        try {
            List<CrawlTask> drained = new ArrayList<>(listingQueue);
            drained.addAll(detailQueue);
            listingQueue.clear();
            detailQueue.clear();
            changed.signalAll();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public boolean isExhausted() {
        lock.lock();
        try {
            return isExhaustedLocked();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    boolean hasSeen(String url) {
        String normalized = UrlNormalizer.normalize(url);
        lock.lock();
        try {
            return normalized != null && seen.contains(normalized);
        } finally {
            lock.unlock();
        }
    }

    public int acceptedDetails() {
        lock.lock();
        try {
            return acceptedDetails;
        } finally {
            lock.unlock();
        }
    }

    public int rejectedCount() {
        lock.lock();
        try {
            return rejectedDuplicates + rejectedOverBudget;
        } finally {
            lock.unlock();
        }
    }

    public int rejectedOverBudget() {
        lock.lock();
        try {
            return rejectedOverBudget;
        } finally {
            lock.unlock();
        }
    }

    int queuedCount() {
        lock.lock();
        try {
            return listingQueue.size() + detailQueue.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isExhaustedLocked() {
        return listingQueue.isEmpty() && detailQueue.isEmpty() && inFlight == 0 && awaitingRetry == 0;
    }
}
