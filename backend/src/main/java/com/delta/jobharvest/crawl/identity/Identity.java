package com.delta.jobharvest.crawl.identity;

import com.delta.jobharvest.crawl.model.DeviceProfile;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A reusable crawling persona. Mutable state (cookies and health counters) only changes while
 * the caller holds the identity's lock, which {@link IdentityPool#acquire(String)} hands out as
 * an {@link IdentityLease}.
 */
public class Identity {
    private final String id;
    private final DeviceProfile deviceProfile;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Map<String, String> cookieJar = Map.of();
    private volatile int usageCount;
    private volatile int errorScore;
    private volatile boolean retired;
    private volatile Instant lastUsedAt;

    Identity(String id, DeviceProfile deviceProfile, Instant createdAt) {
        this.id = id;
        this.deviceProfile = deviceProfile;
        this.lastUsedAt = createdAt;
    }

    public String id() {
        return id;
    }

    public DeviceProfile deviceProfile() {
        return deviceProfile;
    }

    public Map<String, String> cookieJar() {
        return cookieJar;
    }

    public int usageCount() {
        return usageCount;
    }

    public int errorScore() {
        return errorScore;
    }

    public boolean isRetired() {
        return retired;
    }

    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    public Map<String, String> requestHeaders() {
        Map<String, String> headers = new LinkedHashMap<>(deviceProfile.clientHints());
        headers.put("User-Agent", deviceProfile.userAgent());
        return headers;
    }

    ReentrantLock lock() {
        return lock;
    }

    boolean isBusy() {
        return lock.isLocked();
    }

    void touch(Instant now) {
        requireHeld();
        lastUsedAt = now;
    }

    void replaceCookies(Map<String, String> jar) {
        requireHeld();
        cookieJar = jar == null ? Map.of() : jar;
    }

    void applyOutcome(boolean success, int errorWeight) {
        requireHeld();
        usageCount++;
        if (success) {
            errorScore = Math.max(0, errorScore - 1);
        } else {
            errorScore += Math.max(1, errorWeight);
        }
    }

    void markRetired() {
        requireHeld();
        retired = true;
        cookieJar = Map.of();
    }

    private void requireHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("identity " + id + " mutated without holding its lease");
        }
    }

    @Override
    public String toString() {
        return "Identity{" + id + ", profile=" + deviceProfile.name() + ", usage=" + usageCount
            + ", errorScore=" + errorScore + ", retired=" + retired + "}";
    }
}
