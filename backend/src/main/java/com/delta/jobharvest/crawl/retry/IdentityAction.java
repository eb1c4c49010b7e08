package com.delta.jobharvest.crawl.retry;

public enum IdentityAction {
    KEEP,
    REFRESH_COOKIES,
    RETIRE
}
