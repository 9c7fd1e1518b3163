package com.unisearch.Crawler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.unisearch.CrawlConfig;
import com.unisearch.Indexer.DuplicateDocumentException;
import com.unisearch.Indexer.Index;

/**
 * Drives one crawl: a pool of workers pulls URLs from the frontier, fetches and parses them,
 * records links in the graph and text in the index, until the frontier runs dry or the page
 * or time budget is spent. Each {@link #crawl()} call works on a fresh {@link CrawlState}.
 */
public class WebCrawler {
    private static final Logger LOG = LoggerFactory.getLogger(WebCrawler.class);
    private static final long POLL_MS = 250;
    private static final int PROGRESS_EVERY = 25;

    private final CrawlConfig config;
    private final Fetcher fetcher;
    private final PageParser parser;
    private final Index index;
    private final RobotsChecker robotsChecker;
    private final DomainRateLimiter rateLimiter;

    public WebCrawler(CrawlConfig config, Fetcher fetcher, PageParser parser, Index index) {
        this.config = config.validate();
        this.fetcher = fetcher;
        this.parser = parser;
        this.index = index;
        this.robotsChecker = config.isRespectRobotsTxt() ? new RobotsChecker(fetcher, config.getUserAgent()) : null;
        this.rateLimiter = new DomainRateLimiter(config.getPolitenessDelayMs());
    }

    public CrawlResult crawl() {
        DomainScope scope = DomainScope.of(config.getDomainScope(), config.getSeedUrl());
        CrawlState state = new CrawlState(config, scope);
        String seed = UrlNormalizer.normalize(config.getSeedUrl());
        if (seed == null) {
            throw new IllegalArgumentException("Seed is not an absolute http(s) URL: " + config.getSeedUrl());
        }
        if (!state.getFrontier().enqueue(seed)) {
            throw new IllegalArgumentException("Seed " + seed + " is outside the domain scope " + scope);
        }
        LOG.info("Crawling from {} within {} (max {} pages, {} threads)", seed, scope, config.getMaxPages(),
                config.getThreadCount());

        int threadCount = config.getThreadCount();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    crawlWorker(state);
                } catch (RuntimeException e) {
                    LOG.error("Worker thread failed", e);
                    state.abort(e);
                } finally {
                    latch.countDown();
                }
            });
        }

        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for crawl workers, stopping");
        } finally {
            state.stop();
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    LOG.warn("Crawl executor did not terminate cleanly");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        state.getLinkGraph().seal();
        printCrawlSummary(state);

        RuntimeException fatal = state.getFatalError();
        if (fatal != null) {
            throw fatal;
        }
        return state.toResult();
    }

    private void crawlWorker(CrawlState state) {
        Frontier frontier = state.getFrontier();
        while (state.isRunning()) {
            if (state.isTimeBudgetExhausted()) {
                LOG.info("{}: crawl time budget spent, stopping", Thread.currentThread().getName());
                state.stop();
                break;
            }
            if (!state.tryReserveFetch()) {
                LOG.debug("{}: max pages reached, stopping", Thread.currentThread().getName());
                break;
            }

            String url;
            try {
                url = frontier.take(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                state.releaseFetch();
                Thread.currentThread().interrupt();
                break;
            }
            if (url == null) {
                state.releaseFetch();
                if (frontier.isExhausted()) {
                    break;
                }
                continue;
            }

            try {
                processPage(state, url);
            } catch (DuplicateDocumentException e) {
                LOG.error("Aborting crawl, {} would be indexed twice", e.getUrl());
                state.abort(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.stop();
            } catch (RuntimeException e) {
                LOG.error("Error processing URL: {}", url, e);
                state.recordSkipped(url, "error: " + e.getMessage());
            } finally {
                frontier.markVisited(url);
            }
            logProgress(state);
        }
    }

    private void processPage(CrawlState state, String url) throws InterruptedException {
        if (robotsChecker != null && !robotsChecker.isAllowed(url)) {
            LOG.info("Disallowed by robots.txt: {}", url);
            state.recordSkipped(url, "robots.txt");
            state.releaseFetch();
            return;
        }
        long crawlDelay = robotsChecker != null ? robotsChecker.getCrawlDelayMs(url) : 0;
        rateLimiter.waitForDomain(url, crawlDelay);

        state.recordFetch(url);
        FetchResult result;
        try {
            result = fetcher.fetch(url);
        } catch (FetchException e) {
            LOG.warn("Failed to fetch page: {} [{}] {}", url, e.getType(), e.getMessage());
            state.recordFailure(url, e);
            return;
        }

        if (result.isRedirected()) {
            String target = result.getFinalUrl();
            if (!state.getFrontier().getScope().contains(target)) {
                LOG.info("Redirected out of scope: {} -> {}", url, target);
                state.recordSkipped(url, "redirected out of scope to " + target);
                return;
            }
            state.getLinkGraph().addAlias(url, target);
            if (!state.getFrontier().claim(target)) {
                LOG.info("Redirect target already crawled: {} -> {}", url, target);
                state.recordSkipped(url, "redirect target already crawled: " + target);
                return;
            }
        }

        // keyed by the final URL from here on
        Page page = parser.parse(result);
        String pageUrl = page.getUrl();
        if (!page.isHtml()) {
            LOG.info("Not HTML content: {} ({})", pageUrl, result.getContentType());
            state.recordSkipped(pageUrl, "content type " + result.getContentType());
            return;
        }

        state.recordPage(page);
        state.getLinkGraph().addNode(pageUrl);
        state.getLinkGraph().addEdges(pageUrl, page.getOutboundUrls());
        for (String link : page.getOutboundUrls()) {
            state.getFrontier().enqueue(link);
        }

        if (config.isDedupContent() && !state.registerContentHash(PageHasher.contentHash(page.getText()))) {
            LOG.info("Duplicate content: {}", pageUrl);
            state.recordSkipped(pageUrl, "duplicate content");
            return;
        }

        index.addDocument(pageUrl, page.getText());
        state.recordSaved();
        LOG.debug("Indexed {} ({})", pageUrl, page.getTitle());
    }

    private void logProgress(CrawlState state) {
        int attempted = state.getAttemptedCount();
        if (attempted > 0 && attempted % PROGRESS_EVERY == 0) {
            LOG.info("Progress: saved pages = {}, attempted pages = {}, skipped pages = {}",
                    state.getSavedCount(), attempted, state.getSkippedCount());
        }
    }

    private void printCrawlSummary(CrawlState state) {
        LOG.info("--- CRAWL SUMMARY ---");
        LOG.info("Pages indexed: {}/{}", state.getSavedCount(), config.getMaxPages());
        LOG.info("Pages attempted: {}", state.getAttemptedCount());
        LOG.info("Pages skipped: {}", state.getSkippedCount());
        LOG.info("URLs in queue: {}", state.getFrontier().queuedCount());
        LOG.info("URLs visited: {}", state.getFrontier().visitedCount());
        LOG.info("Link graph: {} nodes, {} edges", state.getLinkGraph().nodeCount(), state.getLinkGraph().edgeCount());
    }
}
