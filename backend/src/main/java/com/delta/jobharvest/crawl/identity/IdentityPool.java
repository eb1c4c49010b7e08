package com.delta.jobharvest.crawl.identity;

import com.delta.jobharvest.config.HarvestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Bounded set of crawl identities for one run. Identities are created lazily until the pool is
 * full; after that the least-used idle identity with a clean error score is handed out. When no
 * clean identity is idle, the worst idle one is evicted to make room for a fresh one, and when
 * every identity is leased the caller waits for a release. A leased identity is never evicted.
 * Retirement is permanent.
 */
public class IdentityPool {
    private static final Logger log = LoggerFactory.getLogger(IdentityPool.class);
    private static final long RELEASE_WAIT_MS = 200;
    private static final Comparator<Identity> LEAST_USED = Comparator
        .comparingInt(Identity::usageCount)
        .thenComparing(Identity::lastUsedAt);
    private static final Comparator<Identity> WORST_FIRST = Comparator
        .comparingInt(Identity::errorScore).reversed()
        .thenComparing(Identity::lastUsedAt);

    private final HarvestProperties.Identity settings;
    private final DeviceProfileCatalog catalog;
    private final Clock clock;
    private final Map<String, Identity> active = new LinkedHashMap<>();
    private final Map<String, String> stickyBindings = new HashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger retiredCount = new AtomicInteger();

    public IdentityPool(HarvestProperties.Identity settings, DeviceProfileCatalog catalog, Clock clock) {
        this.settings = settings;
        this.catalog = catalog;
        this.clock = clock;
    }

    /**
     * Returns a locked, non-retired identity. A sticky key that is bound to a healthy identity
     * always yields that identity, waiting for it if another task is using it.
     */
    public IdentityLease acquire(String stickyKey) {
        while (true) {
            Identity candidate;
            synchronized (this) {
                candidate = select(stickyKey);
                while (candidate == null) {
                    awaitRelease();
                    candidate = select(stickyKey);
                }
            }
            candidate.lock().lock();
            if (candidate.isRetired()) {
                candidate.lock().unlock();
                continue;
            }
            candidate.touch(clock.instant());
            return new IdentityLease(candidate, this::released);
        }
    }

    public void recordOutcome(IdentityLease lease, boolean success, OutcomeSeverity severity) {
        Identity identity = lease.identity();
        OutcomeSeverity effective = severity == null ? OutcomeSeverity.NONE : severity;
        identity.applyOutcome(success, effective.errorWeight());
        if (identity.errorScore() >= settings.getMaxErrorScore()) {
            retire(identity, "error_score=" + identity.errorScore());
        } else if (identity.usageCount() >= settings.getMaxUsageCount()) {
            retire(identity, "usage_ceiling");
        }
    }

    public void ingestCookies(IdentityLease lease, List<String> setCookieHeaders) {
        Identity identity = lease.identity();
        Map<String, String> updates = CookieJar.parseSetCookieHeaders(setCookieHeaders);
        if (updates.isEmpty() || identity.isRetired()) {
            return;
        }
        identity.replaceCookies(CookieJar.merge(identity.cookieJar(), updates));
    }

    public void refreshCookies(IdentityLease lease) {
        Identity identity = lease.identity();
        identity.replaceCookies(Map.of());
        log.debug("Cleared cookie jar of {}", identity.id());
    }

    public void retire(IdentityLease lease, String reason) {
        retire(lease.identity(), reason);
    }

    public synchronized int size() {
        return active.size();
    }

    public int retiredCount() {
        return retiredCount.get();
    }

    public int createdCount() {
        return sequence.get();
    }

    /**
     * Picks the identity for the next lease, or null when every identity is leased and the pool
     * is full. Must be called while holding the pool monitor.
     */
    private Identity select(String stickyKey) {
        if (stickyKey != null) {
            Identity bound = active.get(stickyBindings.get(stickyKey));
            if (bound != null && !bound.isRetired()) {
                return bound;
            }
        }
        Identity chosen;
        if (active.size() < settings.getMaxPoolSize()) {
            chosen = create();
        } else {
            List<Identity> idle = active.values().stream()
                .filter(identity -> !identity.isRetired() && !identity.isBusy())
                .collect(Collectors.toList());
            chosen = idle.stream()
                .filter(identity -> identity.errorScore() == 0)
                .min(LEAST_USED)
                .orElse(null);
            if (chosen == null) {
                chosen = evictWorstIdle(idle);
            }
            if (chosen == null) {
                return null;
            }
        }
        if (stickyKey != null) {
            stickyBindings.put(stickyKey, chosen.id());
        }
        return chosen;
    }

    private Identity evictWorstIdle(List<Identity> idle) {
        idle.sort(WORST_FIRST);
        for (Identity identity : idle) {
            // skip identities leased since the idle snapshot was taken
            if (!identity.lock().tryLock()) {
                continue;
            }
            try {
                retire(identity, "evicted");
            } finally {
                identity.lock().unlock();
            }
            return create();
        }
        return null;
    }

    private void awaitRelease() {
        try {
            wait(RELEASE_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a free identity", e);
        }
    }

    private synchronized void released() {
        notifyAll();
    }

    private Identity create() {
        String id = "identity-" + sequence.incrementAndGet();
        Identity identity = new Identity(id, catalog.next(), clock.instant());
        active.put(id, identity);
        log.debug("Created {} with profile {}", id, identity.deviceProfile().name());
        return identity;
    }

    private void retire(Identity identity, String reason) {
        synchronized (this) {
            if (identity.isRetired()) {
                return;
            }
            identity.markRetired();
            active.remove(identity.id());
        }
        retiredCount.incrementAndGet();
        log.info(
            "Retired {} ({}) after usage={} errorScore={}",
            identity.id(),
            reason,
            identity.usageCount(),
            identity.errorScore()
        );
    }
}
