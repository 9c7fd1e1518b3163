package com.unisearch.Crawler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class PageParserTest {
    private static final String URL = "https://vm009.rz.uos.de/crawl/index.html";

    private final PageParser parser = new PageParser();

    @Test
    void extractsTitleVisibleTextAndLinks() {
        String html = "<html><head><title> Platypus Facts </title>"
                + "<style>body { color: red; }</style></head>"
                + "<body><h1>Platypus</h1><p>The platypus lays eggs.</p>"
                + "<script>var hidden = 'secret';</script>"
                + "<a href=\"page2.html\">next</a> "
                + "<a href=\"/crawl/page3.html#top\">third</a> "
                + "<a href=\"https://www.uos.de/\">external</a> "
                + "<a href=\"page2.html\">again</a> "
                + "<a href=\"mailto:info@uos.de\">mail</a>"
                + "</body></html>";

        Page page = parser.parse(URL, "text/html; charset=utf-8", html);

        assertTrue(page.isHtml());
        assertEquals("Platypus Facts", page.getTitle());
        assertEquals("Platypus The platypus lays eggs. next third external again mail", page.getText());
        assertFalse(page.getText().contains("secret"));
        assertFalse(page.getText().contains("color"));
        assertEquals(List.of(
                "https://vm009.rz.uos.de/crawl/page2.html",
                "https://vm009.rz.uos.de/crawl/page3.html",
                "https://www.uos.de/",
                "https://vm009.rz.uos.de/crawl/page2.html"), page.getOutboundUrls());
        assertEquals(FetchStatus.SUCCESS, page.getStatus());
    }

    @Test
    void missingTitleIsEmpty() {
        Page page = parser.parse(URL, "text/html", "<p>just text</p>");
        assertEquals("", page.getTitle());
        assertEquals("just text", page.getText());
    }

    @Test
    void honoursBaseHref() {
        String html = "<html><head><base href=\"https://vm009.rz.uos.de/other/\"></head>"
                + "<body><a href=\"x.html\">x</a></body></html>";
        Page page = parser.parse(URL, "text/html", html);
        assertEquals(List.of("https://vm009.rz.uos.de/other/x.html"), page.getOutboundUrls());
    }

    @Test
    void malformedHtmlDegradesGracefully() {
        String html = "<html><body><p>unclosed <b>bold <a href='ok.html'>ok</p></td><<<>>>";

        Page page = parser.parse(URL, "text/html", html);

        assertTrue(page.getText().startsWith("unclosed bold ok"));
        assertTrue(page.getOutboundUrls().contains("https://vm009.rz.uos.de/crawl/ok.html"));
    }

    @Test
    void emptyAndNullBodiesGiveEmptyPages() {
        Page empty = parser.parse(URL, "text/html", "");
        Page nothing = parser.parse(URL, "text/html", null);

        assertEquals("", empty.getText());
        assertTrue(empty.getOutboundUrls().isEmpty());
        assertEquals("", nothing.getText());
    }

    @Test
    void nonHtmlContentIsNotParsed() {
        Page pdf = parser.parse("https://vm009.rz.uos.de/crawl/doc.pdf", "application/pdf", "%PDF-1.4 <a href='x'>");

        assertFalse(pdf.isHtml());
        assertEquals("", pdf.getText());
        assertTrue(pdf.getOutboundUrls().isEmpty());
        assertFalse(parser.parse(URL, null, "<p>x</p>").isHtml());
        assertTrue(PageParser.isHtml("application/xhtml+xml"));
    }

    @Test
    void redirectedPagesTakeTheFinalUrlAndResolveAgainstIt() {
        FetchResult result = new FetchResult("https://vm009.rz.uos.de/crawl/old",
                "https://vm009.rz.uos.de/crawl/new/index.html", 200, "text/html",
                "<a href=\"sibling.html\">s</a>");

        Page page = parser.parse(result);

        assertEquals("https://vm009.rz.uos.de/crawl/new/index.html", page.getUrl());
        assertEquals(FetchStatus.REDIRECT, page.getStatus());
        assertEquals(List.of("https://vm009.rz.uos.de/crawl/new/sibling.html"), page.getOutboundUrls());
    }
}
