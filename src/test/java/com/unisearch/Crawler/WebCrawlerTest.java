package com.unisearch.Crawler;

import static com.unisearch.Crawler.FakeFetcher.page;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.unisearch.CrawlConfig;
import com.unisearch.Indexer.DuplicateDocumentException;
import com.unisearch.Indexer.Index;
import com.unisearch.Indexer.InvertedIndex;
import com.unisearch.Indexer.Tokenizer;
import com.unisearch.Popularity.Edge;
import com.unisearch.Popularity.LinkGraph;

class WebCrawlerTest {
    private static final String SITE = "https://vm009.rz.uos.de/crawl/";
    private static final String SEED = SITE + "index.html";
    private static final String PAGE2 = SITE + "page2.html";
    private static final String PAGE3 = SITE + "page3.html";

    private static CrawlConfig config(int threads) {
        CrawlConfig config = new CrawlConfig();
        config.setSeedUrl(SEED);
        config.setDomainScope("vm009.rz.uos.de/crawl");
        config.setThreadCount(threads);
        config.setRespectRobotsTxt(false);
        config.setPolitenessDelayMs(0);
        return config;
    }

    private static FakeFetcher threePageCycle() {
        return new FakeFetcher()
                .html(SEED, page("Home", "Welcome to the campus platypus archive", "page2.html", "https://www.uos.de/"))
                .html(PAGE2, page("Second", "Platypus habitats in eastern Australia", "page3.html"))
                .html(PAGE3, page("Third", "Venomous spurs of the male platypus", "index.html"));
    }

    @Test
    void crawlsTheWholeScopeOnce() {
        FakeFetcher fetcher = threePageCycle();
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        CrawlResult result = new WebCrawler(config(2), fetcher, new PageParser(), index).crawl();

        assertEquals(Set.of(SEED, PAGE2, PAGE3), result.getPages().keySet());
        assertEquals(3, result.getIndexedCount());
        assertEquals(3, index.documentCount());
        assertEquals(Map.of(SEED, 1, PAGE2, 1, PAGE3, 1), result.getFetchCounts());
        assertFalse(result.isBudgetExhausted());
        assertTrue(result.getFailures().isEmpty());
        assertEquals("Second", result.titles().get(PAGE2));
        assertEquals(3, index.lookup("platypus").size());
    }

    @Test
    void outOfScopeLinksAreEdgesButNeverFetched() {
        FakeFetcher fetcher = threePageCycle();

        CrawlResult result = new WebCrawler(config(1), fetcher, new PageParser(), mock(Index.class)).crawl();
        LinkGraph graph = result.getLinkGraph();

        assertEquals(0, fetcher.calls("https://www.uos.de/"));
        assertTrue(graph.isSealed());
        assertTrue(graph.edges().contains(new Edge(SEED, "https://www.uos.de/")));
        assertFalse(graph.containsNode("https://www.uos.de/"));
        assertEquals(Set.of(SEED, PAGE2, PAGE3), graph.nodes());
        assertEquals(Map.of(SEED, List.of(PAGE2), PAGE2, List.of(PAGE3), PAGE3, List.of(SEED)),
                graph.rankableGraph());
    }

    @Test
    void failedUrlsAreRecordedAndNotRetried() {
        FakeFetcher fetcher = new FakeFetcher()
                .html(SEED, page("Home", "Start here", "page2.html", "missing.html", "slow.html", "down.html"))
                .html(PAGE2, page("Second", "More text", "missing.html", "slow.html"))
                .fail(SITE + "slow.html", FetchErrorType.TIMEOUT)
                .fail(SITE + "down.html", FetchErrorType.CONNECTION_FAILED);
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        CrawlResult result = new WebCrawler(config(2), fetcher, new PageParser(), index).crawl();

        assertEquals(FetchErrorType.HTTP_ERROR, result.getFailures().get(SITE + "missing.html"));
        assertEquals(FetchErrorType.TIMEOUT, result.getFailures().get(SITE + "slow.html"));
        assertEquals(FetchErrorType.CONNECTION_FAILED, result.getFailures().get(SITE + "down.html"));
        assertEquals(1, fetcher.calls(SITE + "missing.html"));
        assertEquals(1, fetcher.calls(SITE + "slow.html"));
        assertEquals(2, index.documentCount());
        assertFalse(index.containsDocument(SITE + "slow.html"));
        assertFalse(result.getLinkGraph().containsNode(SITE + "missing.html"));
        assertTrue(result.getLinkGraph().outLinks(SEED).contains(SITE + "missing.html"));
        assertEquals(result.getFailures().keySet(), result.getFailedPages().keySet());
        assertEquals(FetchStatus.FAILURE, result.getFailedPages().get(SITE + "slow.html").getStatus());
        assertFalse(result.getPages().containsKey(SITE + "slow.html"));
    }

    @Test
    void failingSeedGivesAnEmptyResult() {
        FakeFetcher fetcher = new FakeFetcher().fail(SEED, FetchErrorType.TIMEOUT);

        CrawlResult result = new WebCrawler(config(1), fetcher, new PageParser(), mock(Index.class)).crawl();

        assertTrue(result.getPages().isEmpty());
        assertEquals(0, result.getLinkGraph().nodeCount());
        assertEquals(Map.of(SEED, FetchErrorType.TIMEOUT), result.getFailures());
    }

    @Test
    void stopsAtThePageBudget() {
        FakeFetcher fetcher = new FakeFetcher();
        for (int i = 0; i < 10; i++) {
            String url = i == 0 ? SEED : SITE + "p" + i + ".html";
            fetcher.html(url, page("P" + i, "chain page number " + i, "p" + (i + 1) + ".html"));
        }
        CrawlConfig config = config(1);
        config.setMaxPages(3);

        CrawlResult result = new WebCrawler(config, fetcher, new PageParser(), mock(Index.class)).crawl();

        assertEquals(3, result.getFetchCounts().size());
        assertEquals(Set.of(SEED, SITE + "p1.html", SITE + "p2.html"), result.getPages().keySet());
        assertTrue(result.isBudgetExhausted());
    }

    @Test
    void siteThatExactlyFitsThePageBudgetIsNotExhausted() {
        CrawlConfig config = config(3);
        config.setMaxPages(3);

        CrawlResult result = new WebCrawler(config, threePageCycle(), new PageParser(), mock(Index.class)).crawl();

        assertEquals(Set.of(SEED, PAGE2, PAGE3), result.getPages().keySet());
        assertFalse(result.isBudgetExhausted());
    }

    @Test
    void stopsAtTheTimeBudget() {
        FakeFetcher fetcher = new FakeFetcher() {
            @Override
            public FetchResult fetch(String url) throws FetchException {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.fetch(url);
            }
        };
        for (int i = 0; i < 100; i++) {
            String url = i == 0 ? SEED : SITE + "p" + i + ".html";
            fetcher.html(url, page("P" + i, "slow page " + i, "p" + (i + 1) + ".html"));
        }
        CrawlConfig config = config(1);
        config.setMaxCrawlTimeMs(300);

        CrawlResult result = new WebCrawler(config, fetcher, new PageParser(), mock(Index.class)).crawl();

        assertTrue(result.isBudgetExhausted());
        assertTrue(result.getPages().size() < 100);
    }

    @Test
    void nonHtmlIsSkipped() {
        FakeFetcher fetcher = new FakeFetcher()
                .html(SEED, page("Home", "See the attached report", "report.pdf"))
                .content(SITE + "report.pdf", "application/pdf", "%PDF-1.4");
        Index index = mock(Index.class);

        CrawlResult result = new WebCrawler(config(1), fetcher, new PageParser(), index).crawl();

        assertEquals(Set.of(SEED), result.getPages().keySet());
        assertTrue(result.getSkipped().containsKey(SITE + "report.pdf"));
        assertFalse(result.getLinkGraph().containsNode(SITE + "report.pdf"));
        verify(index, never()).addDocument(eq(SITE + "report.pdf"), anyString());
    }

    @Test
    void redirectedPagesAreIndexedUnderTheFinalUrl() {
        FakeFetcher fetcher = new FakeFetcher()
                .html(SEED, page("Home", "Start", "old.html", "away.html"))
                .redirect(SITE + "old.html", SITE + "new.html", page("Moved", "Relocated content", "page2.html"))
                .redirect(SITE + "away.html", "https://elsewhere.example.org/", page("Away", "Elsewhere"))
                .html(PAGE2, page("Second", "Linked from the moved page"));
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        CrawlResult result = new WebCrawler(config(1), fetcher, new PageParser(), index).crawl();

        assertTrue(index.containsDocument(SITE + "new.html"));
        assertFalse(index.containsDocument(SITE + "old.html"));
        assertEquals(FetchStatus.REDIRECT, result.getPages().get(SITE + "new.html").getStatus());
        assertFalse(result.getPages().containsKey(SITE + "old.html"));
        assertTrue(result.getLinkGraph().containsNode(SITE + "new.html"));
        assertEquals(0, fetcher.calls(SITE + "new.html"));
        assertTrue(index.containsDocument(PAGE2));
        assertTrue(result.getSkipped().containsKey(SITE + "away.html"));
        assertFalse(index.containsDocument(SITE + "away.html"));
    }

    @Test
    void linksToEitherEndOfARedirectReachTheSameNode() {
        String dept = SITE + "dept";
        String deptIndex = SITE + "dept/index.html";
        FakeFetcher fetcher = new FakeFetcher()
                .html(SEED, page("Home", "Start", "dept", "page2.html"))
                .redirect(dept, deptIndex, page("Department", "Faculty list", "../index.html"))
                .html(PAGE2, page("Second", "See the department", "dept/index.html"));

        CrawlResult result = new WebCrawler(config(1), fetcher, new PageParser(), mock(Index.class)).crawl();
        Map<String, List<String>> graph = result.getLinkGraph().rankableGraph();

        assertEquals(Set.of(SEED, deptIndex, PAGE2), graph.keySet());
        assertEquals(List.of(deptIndex, PAGE2), graph.get(SEED));
        assertEquals(List.of(SEED), graph.get(deptIndex));
        assertEquals(List.of(deptIndex), graph.get(PAGE2));
        assertEquals(0, fetcher.calls(deptIndex));
        assertEquals(deptIndex, result.getLinkGraph().aliases().get(dept));
    }

    @Test
    void redirectToAnAlreadyCrawledPageIsSkipped() {
        FakeFetcher fetcher = new FakeFetcher()
                .html(SEED, page("Home", "Start", "alias.html"))
                .redirect(SITE + "alias.html", SEED, page("Home", "Start"));
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        CrawlResult result = new WebCrawler(config(1), fetcher, new PageParser(), index).crawl();

        assertEquals(1, index.documentCount());
        assertTrue(result.getSkipped().containsKey(SITE + "alias.html"));
        assertEquals(1, fetcher.calls(SEED));
    }

    @Test
    void duplicateContentIsIndexedOnce() {
        FakeFetcher fetcher = new FakeFetcher()
                .html(SEED, page("Home", "Start", "page2.html", "copy.html"))
                .html(PAGE2, page("Second", "Identical body text"))
                .html(SITE + "copy.html", page("Copy", "Identical   BODY text"));
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        CrawlResult result = new WebCrawler(config(1), fetcher, new PageParser(), index).crawl();

        assertEquals(2, index.documentCount());
        assertTrue(index.containsDocument(PAGE2));
        assertEquals("duplicate content", result.getSkipped().get(SITE + "copy.html"));
        assertTrue(result.getLinkGraph().containsNode(SITE + "copy.html"));
    }

    @Test
    void duplicateContentIsKeptWhenDedupIsOff() {
        FakeFetcher fetcher = new FakeFetcher()
                .html(SEED, page("Home", "Start", "page2.html", "copy.html"))
                .html(PAGE2, page("Second", "Identical body text"))
                .html(SITE + "copy.html", page("Copy", "Identical body text"));
        CrawlConfig config = config(1);
        config.setDedupContent(false);
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        new WebCrawler(config, fetcher, new PageParser(), index).crawl();

        assertEquals(3, index.documentCount());
    }

    @Test
    void honoursRobotsTxt() {
        FakeFetcher fetcher = new FakeFetcher()
                .content("https://vm009.rz.uos.de/robots.txt", "text/plain", "User-agent: *\nDisallow: /crawl/secret\n")
                .html(SEED, page("Home", "Start", "secret/plans.html", "page2.html"))
                .html(PAGE2, page("Second", "Public"))
                .html(SITE + "secret/plans.html", page("Secret", "Hidden"));
        CrawlConfig config = config(1);
        config.setRespectRobotsTxt(true);
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        CrawlResult result = new WebCrawler(config, fetcher, new PageParser(), index).crawl();

        assertEquals(0, fetcher.calls(SITE + "secret/plans.html"));
        assertEquals("robots.txt", result.getSkipped().get(SITE + "secret/plans.html"));
        assertEquals(2, index.documentCount());
        assertEquals(1, fetcher.calls("https://vm009.rz.uos.de/robots.txt"));
    }

    @Test
    void robotsDisallowedUrlsDoNotUseThePageBudget() {
        FakeFetcher fetcher = new FakeFetcher()
                .content("https://vm009.rz.uos.de/robots.txt", "text/plain", "User-agent: *\nDisallow: /crawl/secret\n")
                .html(SEED, page("Home", "Start", "secret/a.html", "secret/b.html", "secret/c.html", "page2.html"))
                .html(PAGE2, page("Second", "Public"));
        CrawlConfig config = config(1);
        config.setRespectRobotsTxt(true);
        config.setMaxPages(2);

        CrawlResult result = new WebCrawler(config, fetcher, new PageParser(), mock(Index.class)).crawl();

        assertEquals(Set.of(SEED, PAGE2), result.getPages().keySet());
        assertEquals(3, result.getSkipped().size());
        assertFalse(result.isBudgetExhausted());
    }

    @Test
    void everyUrlIsFetchedAtMostOnceUnderConcurrency() {
        FakeFetcher fetcher = new FakeFetcher();
        int size = 40;
        for (int i = 0; i < size; i++) {
            String url = i == 0 ? SEED : SITE + "p" + i + ".html";
            String[] links = new String[size];
            for (int j = 0; j < size; j++) {
                links[j] = j == 0 ? "index.html" : "p" + j + ".html";
            }
            fetcher.html(url, page("P" + i, "unique words for page " + i + " number", links));
        }
        InvertedIndex index = new InvertedIndex(new Tokenizer());

        CrawlResult result = new WebCrawler(config(6), fetcher, new PageParser(), index).crawl();

        assertEquals(size, result.getPages().size());
        assertEquals(size, index.documentCount());
        assertTrue(result.getFetchCounts().values().stream().allMatch(count -> count == 1));
        fetcher.allCalls().values().forEach(count -> assertEquals(1, count.get()));
        assertEquals(size * size, result.getLinkGraph().edgeCount());
    }

    @Test
    void duplicateDocumentAbortsTheCrawl() {
        Index index = mock(Index.class);
        doThrow(new DuplicateDocumentException(PAGE2)).when(index).addDocument(eq(PAGE2), anyString());

        WebCrawler crawler = new WebCrawler(config(1), threePageCycle(), new PageParser(), index);

        DuplicateDocumentException e = assertThrows(DuplicateDocumentException.class, crawler::crawl);
        assertEquals(PAGE2, e.getUrl());
        verify(index, never()).addDocument(eq(PAGE3), anyString());
    }

    @Test
    void repeatedRunsAreIndependent() {
        FakeFetcher fetcher = threePageCycle();
        Index index = mock(Index.class);
        WebCrawler crawler = new WebCrawler(config(2), fetcher, new PageParser(), index);

        CrawlResult first = crawler.crawl();
        CrawlResult second = crawler.crawl();

        assertEquals(first.getPages().keySet(), second.getPages().keySet());
        assertEquals(first.getLinkGraph().edges().size(), second.getLinkGraph().edges().size());
        assertEquals(Map.of(SEED, 1, PAGE2, 1, PAGE3, 1), second.getFetchCounts());
        assertEquals(2, fetcher.calls(SEED));
        verify(index, times(2)).addDocument(eq(SEED), anyString());
    }

    @Test
    void rejectsSeedsItCannotCrawl() {
        CrawlConfig outside = config(1);
        outside.setSeedUrl("https://www.uos.de/index.html");
        CrawlConfig garbage = config(1);
        garbage.setSeedUrl("ftp://vm009.rz.uos.de/crawl/");
        CrawlConfig missing = config(1);
        missing.setSeedUrl(" ");

        assertThrows(IllegalArgumentException.class,
                () -> new WebCrawler(outside, new FakeFetcher(), new PageParser(), mock(Index.class)).crawl());
        assertThrows(IllegalArgumentException.class,
                () -> new WebCrawler(garbage, new FakeFetcher(), new PageParser(), mock(Index.class)).crawl());
        assertThrows(IllegalArgumentException.class,
                () -> new WebCrawler(missing, new FakeFetcher(), new PageParser(), mock(Index.class)));
    }
}
