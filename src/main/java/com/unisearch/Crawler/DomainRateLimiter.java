package com.unisearch.Crawler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// Spaces out requests to the same host so that we don't overwhelm the server.
// Each caller reserves the next free slot for its host atomically, then sleeps outside any lock.
public class DomainRateLimiter
{
    private final long defaultDelayMs;
    private final Map<String, Long> nextSlot = new ConcurrentHashMap<>();

    public DomainRateLimiter(long defaultDelayMs)
    {
        this.defaultDelayMs = Math.max(0, defaultDelayMs);
    }

    public void waitForDomain(String url) throws InterruptedException
    {
        waitForDomain(url, defaultDelayMs);
    }

    // delayMs below the configured default is raised to the default
    public void waitForDomain(String url, long delayMs) throws InterruptedException
    {
        long delay = Math.max(defaultDelayMs, delayMs);
        if (delay <= 0)
            return;
        String domain = UrlNormalizer.extractDomain(url);
        if (domain == null)
            return;

        long[] slot = new long[1];
        nextSlot.compute(domain, (k, next) -> {
            long now = System.currentTimeMillis();
            slot[0] = next == null || next < now ? now : next;
            return slot[0] + delay;
        });

        long wait = slot[0] - System.currentTimeMillis();
        if (wait > 0)
        {
            Thread.sleep(wait);
        }
    }
}
