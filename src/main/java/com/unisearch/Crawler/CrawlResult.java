package com.unisearch.Crawler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import com.unisearch.Popularity.LinkGraph;

public class CrawlResult {
    private final Map<String, Page> pages;
    private final Map<String, Page> failedPages;
    private final LinkGraph linkGraph;
    private final Map<String, FetchErrorType> failures;
    private final Map<String, String> skipped;
    private final Map<String, Integer> fetchCounts;
    private final int indexedCount;
    private final long durationMs;
    private final boolean budgetExhausted;

    CrawlResult(Map<String, Page> pages, Map<String, Page> failedPages, LinkGraph linkGraph, Map<String, FetchException> failures,
            Map<String, String> skipped, Map<String, Integer> fetchCounts, int indexedCount, long durationMs,
            boolean budgetExhausted) {
        this.pages = Collections.unmodifiableMap(new TreeMap<>(pages));
        this.failedPages = Collections.unmodifiableMap(new TreeMap<>(failedPages));
        this.linkGraph = linkGraph;
        Map<String, FetchErrorType> failureTypes = new TreeMap<>();
        failures.forEach((url, e) -> failureTypes.put(url, e.getType()));
        this.failures = Collections.unmodifiableMap(failureTypes);
        this.skipped = Collections.unmodifiableMap(new TreeMap<>(skipped));
        this.fetchCounts = Collections.unmodifiableMap(new LinkedHashMap<>(fetchCounts));
        this.indexedCount = indexedCount;
        this.durationMs = durationMs;
        this.budgetExhausted = budgetExhausted;
    }

    /** HTML pages fetched and parsed, keyed by URL. */
    public Map<String, Page> getPages() {
        return pages;
    }

    /** URLs whose fetch failed, as pages with status {@link FetchStatus#FAILURE}. */
    public Map<String, Page> getFailedPages() {
        return failedPages;
    }

    /** Sealed graph of the run, ready for PageRank. */
    public LinkGraph getLinkGraph() {
        return linkGraph;
    }

    public Map<String, FetchErrorType> getFailures() {
        return failures;
    }

    /** URLs that were dequeued but not indexed for a reason other than a fetch error. */
    public Map<String, String> getSkipped() {
        return skipped;
    }

    /** How often each URL was handed to the fetcher; every value is 1 for a correct run. */
    public Map<String, Integer> getFetchCounts() {
        return fetchCounts;
    }

    public int getIndexedCount() {
        return indexedCount;
    }

    public long getDurationMs() {
        return durationMs;
    }

    /** True when maxPages or maxCrawlTimeMs stopped the crawl before the frontier ran dry. */
    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    public Map<String, String> titles() {
        Map<String, String> titles = new TreeMap<>();
        pages.forEach((url, page) -> titles.put(url, page.getTitle()));
        return titles;
    }
}
