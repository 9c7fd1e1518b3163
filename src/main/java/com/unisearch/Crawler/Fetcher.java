package com.unisearch.Crawler;

/**
 * Retrieves a single URL. Implementations enforce their own per-request timeout and
 * redirect limit and report every failure as a classified {@link FetchException}.
 */
public interface Fetcher {
    FetchResult fetch(String url) throws FetchException;
}
