package com.unisearch;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import com.unisearch.Crawler.CrawlResult;
import com.unisearch.Crawler.Fetcher;
import com.unisearch.Crawler.PageParser;
import com.unisearch.Crawler.WebCrawler;
import com.unisearch.Indexer.InvertedIndex;
import com.unisearch.Indexer.Tokenizer;
import com.unisearch.QueryProcessor.QueryProcessor;
import com.unisearch.QueryProcessor.SearchResult;
import com.unisearch.QueryProcessor.SnapshotStore;

/**
 * Startup flow: reuse the saved snapshot when there is one (unless {@code --recrawl}), otherwise
 * crawl, rank and save; then answer every non-option argument as a query.
 */
@Component
public class SearchEngineRunner implements CommandLineRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SearchEngineRunner.class);

    private final CrawlConfig config;
    private final Fetcher fetcher;
    private final PageParser parser;
    private final Tokenizer tokenizer;
    private final SnapshotStore snapshotStore;

    public SearchEngineRunner(CrawlConfig config, Fetcher fetcher, PageParser parser, Tokenizer tokenizer,
            SnapshotStore snapshotStore) {
        this.config = config;
        this.fetcher = fetcher;
        this.parser = parser;
        this.tokenizer = tokenizer;
        this.snapshotStore = snapshotStore;
    }

    @Override
    public void run(String... args) throws IOException {
        if (!config.isRunOnStartup()) {
            LOG.info("crawler.run-on-startup is false, nothing to do");
            return;
        }
        boolean recrawl = Arrays.asList(args).contains("--recrawl");
        QueryProcessor queryProcessor = buildQueryProcessor(recrawl);

        for (String query : queries(args)) {
            List<SearchResult> results = queryProcessor.search(query);
            System.out.printf("%nQuery \"%s\": %d hits%n", query, results.size());
            results.forEach(r -> System.out.println("  " + r));
        }
    }

    public QueryProcessor buildQueryProcessor(boolean recrawl) throws IOException {
        Path snapshotPath = config.getSnapshotPath() != null && !config.getSnapshotPath().isBlank()
                ? Paths.get(config.getSnapshotPath())
                : null;

        if (snapshotPath != null && !recrawl && snapshotStore.exists(snapshotPath)) {
            return QueryProcessor.fromSnapshot(snapshotStore.load(snapshotPath), config);
        }

        InvertedIndex index = new InvertedIndex(tokenizer);
        CrawlResult crawl = new WebCrawler(config, fetcher, parser, index).crawl();
        QueryProcessor queryProcessor = QueryProcessor.fromCrawl(crawl, index, tokenizer, config);
        if (snapshotPath != null) {
            snapshotStore.save(snapshotPath, queryProcessor.toSnapshot());
        }
        return queryProcessor;
    }

    private static List<String> queries(String[] args) {
        return Arrays.stream(args).filter(a -> !a.startsWith("--") && !a.isBlank()).toList();
    }
}
