package com.unisearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.unisearch.Crawler.Fetcher;
import com.unisearch.Crawler.JsoupFetcher;
import com.unisearch.Crawler.PageParser;
import com.unisearch.Indexer.Tokenizer;
import com.unisearch.QueryProcessor.SnapshotStore;

@SpringBootApplication
@EnableConfigurationProperties(CrawlConfig.class)
public class SearchEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(SearchEngineApplication.class, args);
    }

    @Bean
    public Tokenizer tokenizer(CrawlConfig config) {
        return new Tokenizer(config.isStemming());
    }

    @Bean
    public Fetcher fetcher(CrawlConfig config) {
        return new JsoupFetcher(config.getFetchTimeoutMs(), config.getMaxRedirects(), config.getUserAgent(),
                config.getMaxBodySizeBytes());
    }

    @Bean
    public PageParser pageParser() {
        return new PageParser();
    }

    @Bean
    public SnapshotStore snapshotStore() {
        return new SnapshotStore();
    }
}
