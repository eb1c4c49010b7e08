package com.delta.jobharvest.crawl.http;

import com.delta.jobharvest.crawl.model.FetchRequest;
import com.delta.jobharvest.crawl.model.FetchResult;

/**
 * Fetches one page. Implementations never throw for network failures; they report them through
 * {@link FetchResult#transportError()}.
 */
public interface PageTransport {
    FetchResult fetch(FetchRequest request);
}
