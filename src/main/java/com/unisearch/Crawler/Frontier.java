package com.unisearch.Crawler;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.TimeUnit;

//Purpose: Holds discovered-but-not-yet-fetched URLs in FIFO (breadth-first) order.
//A URL enters the seen set the first time it is enqueued or claimed and never leaves it,
//so each URL is handed out by dequeue()/take() at most once per crawl run.
//All state is guarded by the frontier's monitor; workers block in take() until
//a URL arrives or the frontier is exhausted (empty queue, nothing in flight).

public class Frontier {
    private final DomainScope scope;
    private final Queue<String> queue = new ArrayDeque<>();
    private final Set<String> seen = new HashSet<>();
    private final Set<String> visited = new HashSet<>();
    private int inFlight = 0;

    public Frontier(DomainScope scope) {
        this.scope = scope;
    }

    /**
     * Adds a URL if it is in scope and has never been queued, claimed or visited.
     *
     * @return true when the URL was queued
     */
    public synchronized boolean enqueue(String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null || !scope.contains(normalized)) {
            return false;
        }
        if (!seen.add(normalized)) {
            return false;
        }
        queue.add(normalized);
        notifyAll();
        return true;
    }

    /**
     * Marks a URL as seen and visited without queuing it, e.g. the target of a redirect
     * that is being fetched under another URL.
     *
     * @return false when the URL had already been seen
     */
    public synchronized boolean claim(String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null) {
            return false;
        }
        if (!seen.add(normalized)) {
            return false;
        }
        visited.add(normalized);
        return true;
    }

    /** Returns the next URL, or null if the queue is currently empty. */
    public synchronized String dequeue() {
        String url = queue.poll();
        if (url != null) {
            inFlight++;
        }
        return url;
    }

    /**
     * Blocks until a URL is available or the frontier is exhausted.
     *
     * @return the next URL, or null when nothing is queued, nothing is in flight,
     *         or the timeout elapsed
     */
    public synchronized String take(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (queue.isEmpty()) {
            if (inFlight == 0) {
                return null;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return dequeue();
    }

    /** Transitions a dequeued URL out of the in-flight set permanently. */
    public synchronized void markVisited(String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized != null && visited.add(normalized) && inFlight > 0) {
            inFlight--;
        }
        notifyAll();
    }

    public synchronized boolean isExhausted() {
        return queue.isEmpty() && inFlight == 0;
    }

    public synchronized boolean isVisited(String url) {
        return visited.contains(UrlNormalizer.normalize(url));
    }

    public synchronized int queuedCount() {
        return queue.size();
    }

    public synchronized int visitedCount() {
        return visited.size();
    }

    public DomainScope getScope() {
        return scope;
    }
}
