package com.delta.jobharvest.crawl.identity;

/**
 * Exclusive use of one {@link Identity}. Two leases on the same identity never overlap.
 */
public final class IdentityLease implements AutoCloseable {
    private final Identity identity;
    private final Runnable onRelease;
    private boolean released;

    IdentityLease(Identity identity, Runnable onRelease) {
        this.identity = identity;
        this.onRelease = onRelease;
    }

    public Identity identity() {
        return identity;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        identity.lock().unlock();
        onRelease.run();
    }
}
