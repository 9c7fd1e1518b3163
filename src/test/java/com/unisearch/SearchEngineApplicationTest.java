package com.unisearch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.unisearch.Crawler.Fetcher;
import com.unisearch.Crawler.JsoupFetcher;
import com.unisearch.Indexer.Tokenizer;

@SpringBootTest(properties = {"crawler.run-on-startup=false", "crawler.stemming=true"})
class SearchEngineApplicationTest {

    @Autowired
    private CrawlConfig config;

    @Autowired
    private Fetcher fetcher;

    @Autowired
    private Tokenizer tokenizer;

    @Autowired
    private SearchEngineRunner runner;

    @Test
    void bindsCrawlerProperties() {
        assertEquals("https://vm009.rz.uos.de/crawl/index.html", config.getSeedUrl());
        assertEquals("vm009.rz.uos.de/crawl", config.getDomainScope());
        assertEquals(0.85, config.getDampingFactor(), 0.0);
        assertEquals(0.7, config.getWeightTfidf(), 0.0);
        assertEquals(0.3, config.getWeightPageRank(), 0.0);
        assertEquals(10485760, config.getMaxBodySizeBytes());
        assertFalse(config.isRunOnStartup());
        config.validate();
    }

    @Test
    void wiresTheCrawlerComponents() throws Exception {
        assertTrue(fetcher instanceof JsoupFetcher);
        assertTrue(tokenizer.isStemming());
        runner.run("platypus");
    }
}
