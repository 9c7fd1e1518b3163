package com.unisearch.Crawler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FrontierTest {
    private Frontier frontier;

    @BeforeEach
    void setUp() {
        frontier = new Frontier(DomainScope.of("example.org", "http://example.org/"));
    }

    @Test
    void dequeuesInDiscoveryOrder() {
        assertTrue(frontier.enqueue("http://example.org/a"));
        assertTrue(frontier.enqueue("http://example.org/b"));
        assertTrue(frontier.enqueue("http://example.org/c"));

        assertEquals("http://example.org/a", frontier.dequeue());
        assertEquals("http://example.org/b", frontier.dequeue());
        assertEquals("http://example.org/c", frontier.dequeue());
        assertNull(frontier.dequeue());
    }

    @Test
    void ignoresDuplicatesAfterNormalization() {
        assertTrue(frontier.enqueue("http://example.org/a/"));
        assertFalse(frontier.enqueue("HTTP://EXAMPLE.org:80/a#frag"));
        assertEquals(1, frontier.queuedCount());
    }

    @Test
    void neverRequeuesVisitedUrls() {
        frontier.enqueue("http://example.org/a");
        String url = frontier.dequeue();
        frontier.markVisited(url);

        assertTrue(frontier.isVisited("http://example.org/a/"));
        assertFalse(frontier.enqueue("http://example.org/a"));
        assertTrue(frontier.isExhausted());
    }

    @Test
    void filtersOutOfScopeUrlsSilently() {
        assertFalse(frontier.enqueue("http://other.org/a"));
        assertFalse(frontier.enqueue("mailto:someone@example.org"));
        assertEquals(0, frontier.queuedCount());
    }

    @Test
    void claimedUrlsAreNeverQueued() {
        assertTrue(frontier.claim("http://example.org/target"));
        assertFalse(frontier.claim("http://example.org/target"));
        assertFalse(frontier.enqueue("http://example.org/target"));
        assertTrue(frontier.isVisited("http://example.org/target"));
    }

    @Test
    void takeReturnsNullOnceExhausted() throws InterruptedException {
        frontier.enqueue("http://example.org/a");
        String url = frontier.take(100, TimeUnit.MILLISECONDS);
        assertEquals("http://example.org/a", url);
        assertFalse(frontier.isExhausted());

        frontier.markVisited(url);
        assertNull(frontier.take(100, TimeUnit.MILLISECONDS));
        assertTrue(frontier.isExhausted());
    }

    @Test
    void takeWaitsForUrlsDiscoveredByInFlightPage() throws Exception {
        frontier.enqueue("http://example.org/a");
        String first = frontier.dequeue();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> waiting = executor.submit(() -> frontier.take(5, TimeUnit.SECONDS));
            Thread.sleep(50);
            frontier.enqueue("http://example.org/b");
            frontier.markVisited(first);
            assertEquals("http://example.org/b", waiting.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentEnqueueRacesHandEachUrlOutOnce() throws Exception {
        int threads = 8;
        int urls = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Map<String, AtomicInteger> handedOut = new ConcurrentHashMap<>();
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < urls; i++) {
                    frontier.enqueue("http://example.org/page" + i);
                    String next = frontier.dequeue();
                    if (next != null) {
                        handedOut.computeIfAbsent(next, k -> new AtomicInteger()).incrementAndGet();
                        frontier.markVisited(next);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        String rest;
        while ((rest = frontier.dequeue()) != null) {
            handedOut.computeIfAbsent(rest, k -> new AtomicInteger()).incrementAndGet();
            frontier.markVisited(rest);
        }

        assertEquals(urls, handedOut.size());
        handedOut.forEach((url, count) -> assertEquals(1, count.get(), url));
        assertTrue(frontier.isExhausted());
    }
}
