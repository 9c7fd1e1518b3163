package com.unisearch.Crawler;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.LinkedHashSet;
import java.util.Set;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Purpose: HTTP fetcher built on jsoup's Connection.
//Redirects are followed by hand so that the chain can be bounded and loops detected
//Single attempt per URL; failures are classified, never retried
//The body is buffered before a response is returned, so a stalled body is a fetch failure too

public class JsoupFetcher implements Fetcher {
    private static final Logger LOG = LoggerFactory.getLogger(JsoupFetcher.class);

    public static final String DEFAULT_USER_AGENT = "CampusSearchBot/1.0";
    public static final int DEFAULT_MAX_BODY_SIZE_BYTES = 10 * 1024 * 1024;

    private final int timeoutMs;
    private final int maxRedirects;
    private final String userAgent;
    private final int maxBodySizeBytes;

    public JsoupFetcher(int timeoutMs, int maxRedirects, String userAgent) {
        this(timeoutMs, maxRedirects, userAgent, DEFAULT_MAX_BODY_SIZE_BYTES);
    }

    /** @param maxBodySizeBytes bodies are cut off after this many bytes; 0 means unlimited */
    public JsoupFetcher(int timeoutMs, int maxRedirects, String userAgent, int maxBodySizeBytes) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        if (maxRedirects < 0) {
            throw new IllegalArgumentException("maxRedirects must not be negative: " + maxRedirects);
        }
        if (maxBodySizeBytes < 0) {
            throw new IllegalArgumentException("maxBodySizeBytes must not be negative: " + maxBodySizeBytes);
        }
        this.timeoutMs = timeoutMs;
        this.maxRedirects = maxRedirects;
        this.userAgent = userAgent != null && !userAgent.isBlank() ? userAgent : DEFAULT_USER_AGENT;
        this.maxBodySizeBytes = maxBodySizeBytes;
    }

    @Override
    public FetchResult fetch(String url) throws FetchException {
        Set<String> chain = new LinkedHashSet<>();
        String current = url;
        chain.add(current);

        while (true) {
            Connection.Response response = execute(current);
            int status = response.statusCode();

            if (status >= 300 && status < 400 && status != 304) {
                String location = response.header("Location");
                if (location == null || location.isBlank()) {
                    throw FetchException.httpError(current, status);
                }
                String next = UrlNormalizer.resolve(current, location);
                if (next == null) {
                    throw new FetchException(url, FetchErrorType.CONNECTION_FAILED,
                            "Unusable redirect target '" + location + "' from " + current);
                }
                if (!chain.add(next) || chain.size() > maxRedirects + 1) {
                    throw new FetchException(url, FetchErrorType.REDIRECT_LOOP,
                            "Redirect limit exceeded or loop detected: " + chain);
                }
                LOG.debug("Redirect {} -> {}", current, next);
                current = next;
                continue;
            }

            if (status < 200 || status >= 300) {
                throw FetchException.httpError(current, status);
            }
            return new FetchResult(url, current, status, response.contentType(), response.body());
        }
    }

    private Connection.Response execute(String url) throws FetchException {
        try {
            Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .maxBodySize(maxBodySizeBytes)
                .followRedirects(false)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .method(Connection.Method.GET)
                .execute();
            response.bufferUp();
            if (maxBodySizeBytes > 0 && response.bodyAsBytes().length >= maxBodySizeBytes) {
                LOG.warn("Body of {} truncated at {} bytes", url, maxBodySizeBytes);
            }
            return response;
        } catch (UncheckedIOException e) {
            // jsoup reports body read errors unchecked
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new FetchException(url, FetchErrorType.TIMEOUT,
                        "Timed out reading body after " + timeoutMs + "ms: " + url, e);
            }
            throw new FetchException(url, FetchErrorType.CONNECTION_FAILED,
                    "Body read failed for " + url + ": " + e.getMessage(), e);
        } catch (SocketTimeoutException e) {
            throw new FetchException(url, FetchErrorType.TIMEOUT,
                    "Timed out after " + timeoutMs + "ms: " + url, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException(url, FetchErrorType.CONNECTION_FAILED,
                    "Connection failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
