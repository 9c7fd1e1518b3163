package com.unisearch.Crawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Purpose: Turns a fetched body into a Page (title, visible text, outbound links).
//Only HTML is parsed; other content types produce an empty, non-indexable page.
//jsoup's parser is lenient, and anything it still throws is logged and degrades to an empty page.

public class PageParser {
    private static final Logger LOG = LoggerFactory.getLogger(PageParser.class);

    public Page parse(String url, String contentType, String body) {
        return parse(url, url, contentType, body, FetchStatus.SUCCESS, System.currentTimeMillis());
    }

    /**
     * Parses a fetched page under the URL the content was finally served from, which is also
     * the base its links resolve against.
     */
    public Page parse(FetchResult result) {
        FetchStatus status = result.isRedirected() ? FetchStatus.REDIRECT : FetchStatus.SUCCESS;
        return parse(result.getFinalUrl(), result.getFinalUrl(), result.getContentType(), result.getBody(),
                status, System.currentTimeMillis());
    }

    public Page parse(String url, String baseUrl, String contentType, String body, FetchStatus status,
            long fetchedAt) {
        if (!isHtml(contentType)) {
            return new Page(url, "", "", Collections.emptyList(), fetchedAt, status, contentType, false);
        }
        try {
            Document doc = Jsoup.parse(body != null ? body : "", baseUrl != null ? baseUrl : url);
            String title = doc.title().trim();
            List<String> links = extractLinks(doc);

            doc.select("script, style, noscript, template").remove();
            String text = doc.body() != null ? doc.body().text() : doc.text();

            return new Page(url, title, text, links, fetchedAt, status, contentType, true);
        } catch (RuntimeException e) {
            LOG.warn("Could not parse {}, indexing it as empty: {}", url, e.getMessage());
            return new Page(url, "", "", Collections.emptyList(), fetchedAt, status, contentType, true);
        }
    }

    public static boolean isHtml(String contentType) {
        if (contentType == null) {
            return false;
        }
        String type = contentType.toLowerCase(Locale.ROOT).trim();
        return type.startsWith("text/html") || type.startsWith("application/xhtml+xml");
    }

    private List<String> extractLinks(Document doc) {
        List<String> links = new ArrayList<>();
        for (Element link : doc.select("a[href]")) {
            String absUrl = link.absUrl("href");
            if (absUrl.isEmpty()) {
                continue;
            }
            String normalized = UrlNormalizer.normalize(absUrl);
            if (normalized != null) {
                links.add(normalized);
            }
        }
        return links;
    }
}
