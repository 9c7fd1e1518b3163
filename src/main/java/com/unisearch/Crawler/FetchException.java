package com.unisearch.Crawler;

import java.io.IOException;

//Purpose: A classified, non-fatal fetch failure.
//The crawler logs it and skips the URL; failed URLs are never retried within a run.

public class FetchException extends IOException {
    private final String url;
    private final FetchErrorType type;
    private final int statusCode;

    public FetchException(String url, FetchErrorType type, String message) {
        this(url, type, -1, message, null);
    }

    public FetchException(String url, FetchErrorType type, String message, Throwable cause) {
        this(url, type, -1, message, cause);
    }

    private FetchException(String url, FetchErrorType type, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.type = type;
        this.statusCode = statusCode;
    }

    public static FetchException httpError(String url, int statusCode) {
        return new FetchException(url, FetchErrorType.HTTP_ERROR, statusCode,
                "HTTP " + statusCode + " for " + url, null);
    }

    public String getUrl() {
        return url;
    }

    public FetchErrorType getType() {
        return type;
    }

    /** The HTTP status for {@link FetchErrorType#HTTP_ERROR}, -1 otherwise. */
    public int getStatusCode() {
        return statusCode;
    }
}
