package com.unisearch.Crawler;

import java.util.Collections;
import java.util.List;

//Purpose: One fetched page as extracted by the parser.
//Immutable; outbound links keep discovery order and duplicates.

public class Page {
    private final String url;
    private final String title;
    private final String text;
    private final List<String> outboundUrls;
    private final long fetchedAt;
    private final FetchStatus status;
    private final String contentType;
    private final boolean html;

    public Page(String url, String title, String text, List<String> outboundUrls, long fetchedAt,
            FetchStatus status, String contentType, boolean html) {
        this.url = url;
        this.title = title != null ? title : "";
        this.text = text != null ? text : "";
        this.outboundUrls = outboundUrls != null ? List.copyOf(outboundUrls) : Collections.emptyList();
        this.fetchedAt = fetchedAt;
        this.status = status;
        this.contentType = contentType;
        this.html = html;
    }

    /** A URL whose fetch failed: no content, status FAILURE. */
    public static Page failed(String url, long fetchedAt) {
        return new Page(url, "", "", Collections.emptyList(), fetchedAt, FetchStatus.FAILURE, null, false);
    }

    public String getUrl() {
        return url;
    }

    public String getTitle() {
        return title;
    }

    public String getText() {
        return text;
    }

    public List<String> getOutboundUrls() {
        return outboundUrls;
    }

    public long getFetchedAt() {
        return fetchedAt;
    }

    public FetchStatus getStatus() {
        return status;
    }

    public String getContentType() {
        return contentType;
    }

    /** False for content types the parser does not understand; such pages are never indexed. */
    public boolean isHtml() {
        return html;
    }
}
