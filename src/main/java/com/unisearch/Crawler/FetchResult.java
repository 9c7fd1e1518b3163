package com.unisearch.Crawler;

public class FetchResult {
    private final String requestedUrl;
    private final String finalUrl;
    private final int statusCode;
    private final String contentType;
    private final String body;

    public FetchResult(String requestedUrl, String finalUrl, int statusCode, String contentType, String body) {
        this.requestedUrl = requestedUrl;
        this.finalUrl = finalUrl != null ? finalUrl : requestedUrl;
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.body = body != null ? body : "";
    }

    public String getRequestedUrl() {
        return requestedUrl;
    }

    public String getFinalUrl() {
        return finalUrl;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getContentType() {
        return contentType;
    }

    public String getBody() {
        return body;
    }

    public boolean isRedirected() {
        return !finalUrl.equals(requestedUrl);
    }
}
