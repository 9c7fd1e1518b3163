package com.unisearch.Crawler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.unisearch.CrawlConfig;
import com.unisearch.Popularity.LinkGraph;

//Purpose: Everything one crawl run mutates, owned by that run alone.
//Frontier and link graph do their own locking; the maps here are concurrent,
//counters are atomic, so workers share a CrawlState without further synchronization.

public class CrawlState {
    private final Frontier frontier;
    private final LinkGraph linkGraph = new LinkGraph();
    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    private final Map<String, FetchException> failures = new ConcurrentHashMap<>();
    private final Map<String, Page> failedPages = new ConcurrentHashMap<>();
    private final Map<String, String> skipped = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final Set<String> contentHashes = ConcurrentHashMap.newKeySet();

    private final AtomicInteger reservedFetches = new AtomicInteger(0);
    private final AtomicInteger attemptedCount = new AtomicInteger(0);
    private final AtomicInteger savedCount = new AtomicInteger(0);
    private final AtomicReference<RuntimeException> fatalError = new AtomicReference<>();

    private final int maxPages;
    private final long startTime;
    private final long deadline;
    private volatile boolean running = true;
    private volatile boolean pageBudgetHit = false;
    private volatile boolean timeBudgetHit = false;

    public CrawlState(CrawlConfig config, DomainScope scope) {
        this.frontier = new Frontier(scope);
        this.maxPages = config.getMaxPages();
        this.startTime = System.currentTimeMillis();
        this.deadline = config.getMaxCrawlTimeMs() > 0 ? startTime + config.getMaxCrawlTimeMs() : Long.MAX_VALUE;
    }

    /** Claims one unit of the page budget; false once maxPages fetches have been handed out. */
    public boolean tryReserveFetch() {
        while (true) {
            int current = reservedFetches.get();
            if (current >= maxPages) {
                pageBudgetHit = true;
                return false;
            }
            if (reservedFetches.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releaseFetch() {
        reservedFetches.decrementAndGet();
    }

    public boolean isTimeBudgetExhausted() {
        if (System.currentTimeMillis() >= deadline) {
            timeBudgetHit = true;
            return true;
        }
        return false;
    }

    public int recordFetch(String url) {
        attemptedCount.incrementAndGet();
        return fetchCounts.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
    }

    public void recordFailure(String url, FetchException e) {
        failures.put(url, e);
        failedPages.put(url, Page.failed(url, System.currentTimeMillis()));
    }

    public void recordSkipped(String url, String reason) {
        skipped.put(url, reason);
    }

    public void recordPage(Page page) {
        pages.put(page.getUrl(), page);
    }

    public void recordSaved() {
        savedCount.incrementAndGet();
    }

    /** @return false when the same content was already seen under another URL */
    public boolean registerContentHash(String hash) {
        return contentHashes.add(hash);
    }

    public void abort(RuntimeException e) {
        fatalError.compareAndSet(null, e);
        running = false;
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public RuntimeException getFatalError() {
        return fatalError.get();
    }

    public Frontier getFrontier() {
        return frontier;
    }

    public LinkGraph getLinkGraph() {
        return linkGraph;
    }

    public int getAttemptedCount() {
        return attemptedCount.get();
    }

    public int getSavedCount() {
        return savedCount.get();
    }

    public int getSkippedCount() {
        return failures.size() + skipped.size();
    }

    /**
     * A budget only counts as exhausted if it left work behind: a site that fits maxPages
     * exactly is crawled completely.
     */
    public boolean isBudgetExhausted() {
        return (pageBudgetHit || timeBudgetHit) && frontier.queuedCount() > 0;
    }

    public CrawlResult toResult() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        fetchCounts.forEach((url, count) -> counts.put(url, count.get()));
        return new CrawlResult(pages, failedPages, linkGraph, failures, skipped, counts, savedCount.get(),
                System.currentTimeMillis() - startTime, isBudgetExhausted());
    }
}
