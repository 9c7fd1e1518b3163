package com.unisearch;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.unisearch.Crawler.JsoupFetcher;
import com.unisearch.Popularity.PageRank;

/**
 * Crawl, PageRank and ranking options, bound from {@code crawler.*} properties.
 * Plain setters keep it usable without a Spring context.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlConfig
{
    private String seedUrl;
    private String domainScope;
    private int maxPages = 500;
    private long maxCrawlTimeMs = 0;
    private int fetchTimeoutMs = 5000;
    private int maxRedirects = 5;
    private int maxBodySizeBytes = JsoupFetcher.DEFAULT_MAX_BODY_SIZE_BYTES;
    private int threadCount = 4;
    private String userAgent = JsoupFetcher.DEFAULT_USER_AGENT;
    private boolean respectRobotsTxt = true;
    private long politenessDelayMs = 0;
    private boolean dedupContent = true;
    private boolean stemming = false;
    private double dampingFactor = PageRank.DEFAULT_DAMPING_FACTOR;
    private int maxIterations = PageRank.DEFAULT_MAX_ITERATIONS;
    private double tolerance = PageRank.DEFAULT_TOLERANCE;
    private double weightTfidf = 0.7;
    private double weightPageRank = 0.3;
    private String snapshotPath;
    private boolean runOnStartup = true;

    /** @throws IllegalArgumentException naming the first invalid option */
    public CrawlConfig validate()
    {
        if (seedUrl == null || seedUrl.isBlank())
            throw new IllegalArgumentException("crawler.seed-url is required");
        if (maxPages <= 0)
            throw new IllegalArgumentException("crawler.max-pages must be positive: " + maxPages);
        if (maxCrawlTimeMs < 0)
            throw new IllegalArgumentException("crawler.max-crawl-time-ms must not be negative: " + maxCrawlTimeMs);
        if (fetchTimeoutMs <= 0)
            throw new IllegalArgumentException("crawler.fetch-timeout-ms must be positive: " + fetchTimeoutMs);
        if (maxRedirects < 0)
            throw new IllegalArgumentException("crawler.max-redirects must not be negative: " + maxRedirects);
        if (maxBodySizeBytes < 0)
            throw new IllegalArgumentException("crawler.max-body-size-bytes must not be negative: " + maxBodySizeBytes);
        if (threadCount <= 0)
            throw new IllegalArgumentException("crawler.thread-count must be positive: " + threadCount);
        if (politenessDelayMs < 0)
            throw new IllegalArgumentException("crawler.politeness-delay-ms must not be negative: " + politenessDelayMs);
        if (dampingFactor < 0 || dampingFactor > 1)
            throw new IllegalArgumentException("crawler.damping-factor must be in [0,1]: " + dampingFactor);
        if (maxIterations <= 0)
            throw new IllegalArgumentException("crawler.max-iterations must be positive: " + maxIterations);
        if (tolerance < 0)
            throw new IllegalArgumentException("crawler.tolerance must not be negative: " + tolerance);
        if (weightTfidf < 0 || weightPageRank < 0)
            throw new IllegalArgumentException("crawler.weight-tfidf and crawler.weight-page-rank must not be negative");
        return this;
    }

    public String getSeedUrl()
    {
        return seedUrl;
    }

    public void setSeedUrl(String seedUrl)
    {
        this.seedUrl = seedUrl;
    }

    public String getDomainScope()
    {
        return domainScope;
    }

    public void setDomainScope(String domainScope)
    {
        this.domainScope = domainScope;
    }

    public int getMaxPages()
    {
        return maxPages;
    }

    public void setMaxPages(int maxPages)
    {
        this.maxPages = maxPages;
    }

    /** Wall-clock budget for the crawl; 0 means unlimited. */
    public long getMaxCrawlTimeMs()
    {
        return maxCrawlTimeMs;
    }

    public void setMaxCrawlTimeMs(long maxCrawlTimeMs)
    {
        this.maxCrawlTimeMs = maxCrawlTimeMs;
    }

    public int getFetchTimeoutMs()
    {
        return fetchTimeoutMs;
    }

    public void setFetchTimeoutMs(int fetchTimeoutMs)
    {
        this.fetchTimeoutMs = fetchTimeoutMs;
    }

    public int getMaxRedirects()
    {
        return maxRedirects;
    }

    public void setMaxRedirects(int maxRedirects)
    {
        this.maxRedirects = maxRedirects;
    }

    public int getThreadCount()
    {
        return threadCount;
    }

    public void setThreadCount(int threadCount)
    {
        this.threadCount = threadCount;
    }

    /** Bodies longer than this are truncated; 0 reads them whole. */
    public int getMaxBodySizeBytes()
    {
        return maxBodySizeBytes;
    }

    public void setMaxBodySizeBytes(int maxBodySizeBytes)
    {
        this.maxBodySizeBytes = maxBodySizeBytes;
    }

    public String getUserAgent()
    {
        return userAgent;
    }

    public void setUserAgent(String userAgent)
    {
        this.userAgent = userAgent;
    }

    public boolean isRespectRobotsTxt()
    {
        return respectRobotsTxt;
    }

    public void setRespectRobotsTxt(boolean respectRobotsTxt)
    {
        this.respectRobotsTxt = respectRobotsTxt;
    }

    public long getPolitenessDelayMs()
    {
        return politenessDelayMs;
    }

    public void setPolitenessDelayMs(long politenessDelayMs)
    {
        this.politenessDelayMs = politenessDelayMs;
    }

    public boolean isDedupContent()
    {
        return dedupContent;
    }

    public void setDedupContent(boolean dedupContent)
    {
        this.dedupContent = dedupContent;
    }

    public boolean isStemming()
    {
        return stemming;
    }

    public void setStemming(boolean stemming)
    {
        this.stemming = stemming;
    }

    public double getDampingFactor()
    {
        return dampingFactor;
    }

    public void setDampingFactor(double dampingFactor)
    {
        this.dampingFactor = dampingFactor;
    }

    public int getMaxIterations()
    {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations)
    {
        this.maxIterations = maxIterations;
    }

    public double getTolerance()
    {
        return tolerance;
    }

    public void setTolerance(double tolerance)
    {
        this.tolerance = tolerance;
    }

    public double getWeightTfidf()
    {
        return weightTfidf;
    }

    public void setWeightTfidf(double weightTfidf)
    {
        this.weightTfidf = weightTfidf;
    }

    public double getWeightPageRank()
    {
        return weightPageRank;
    }

    public void setWeightPageRank(double weightPageRank)
    {
        this.weightPageRank = weightPageRank;
    }

    public String getSnapshotPath()
    {
        return snapshotPath;
    }

    public void setSnapshotPath(String snapshotPath)
    {
        this.snapshotPath = snapshotPath;
    }

    public boolean isRunOnStartup()
    {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup)
    {
        this.runOnStartup = runOnStartup;
    }
}
