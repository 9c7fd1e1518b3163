package com.unisearch.QueryProcessor;

import com.unisearch.CrawlConfig;
import com.unisearch.Crawler.CrawlResult;
import com.unisearch.Indexer.Index;
import com.unisearch.Indexer.InvertedIndex;
import com.unisearch.Indexer.Posting;
import com.unisearch.Indexer.Tokenizer;
import com.unisearch.Popularity.PageRank;
import com.unisearch.Ranker.RankedDocument;
import com.unisearch.Ranker.Ranker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The query interface handed to the web front-end: {@code search(query)} returns URL, title and
 * combined score, best first.
 * <p>
 * Bare words match any document containing at least one of them. Text in double quotes is an
 * exact phrase: only documents containing every quoted phrase, word for word and in the same
 * case, are returned.
 * <p>
 * Instances are built once a crawl has finished (or from a snapshot) and never change, so they
 * can answer concurrent queries without locking.
 */
public class QueryProcessor
{
    private static final Logger LOG = LoggerFactory.getLogger(QueryProcessor.class);
    private static final Pattern PHRASE = Pattern.compile("\"([^\"]+)\"");

    private final Index index;
    private final Tokenizer tokenizer;
    private final Map<String, Double> pageRanks;
    private final Map<String, String> titles;
    private final Ranker ranker;

    public QueryProcessor(Index index, Tokenizer tokenizer, Map<String, Double> pageRanks,
            Map<String, String> titles, Ranker ranker)
    {
        this.index = index;
        this.tokenizer = tokenizer;
        this.pageRanks = Collections.unmodifiableMap(new HashMap<>(pageRanks));
        this.titles = Collections.unmodifiableMap(new HashMap<>(titles));
        this.ranker = ranker;
    }

    /**
     * Computes PageRank over the finished crawl's link graph and wraps the index for querying.
     */
    public static QueryProcessor fromCrawl(CrawlResult crawl, Index index, Tokenizer tokenizer, CrawlConfig config)
    {
        Map<String, Double> ranks = PageRank.computeRanks(crawl.getLinkGraph(), config.getDampingFactor(),
                config.getMaxIterations(), config.getTolerance());
        return new QueryProcessor(index, tokenizer, ranks, crawl.titles(),
                new Ranker(config.getWeightTfidf(), config.getWeightPageRank()));
    }

    public static QueryProcessor fromSnapshot(SearchSnapshot snapshot, CrawlConfig config)
    {
        Tokenizer tokenizer = new Tokenizer(snapshot.isStemming());
        Map<String, Integer> lengths = new LinkedHashMap<>();
        Map<String, String> titles = new HashMap<>();
        for (SearchSnapshot.DocumentEntry doc : snapshot.getDocuments())
        {
            lengths.put(doc.getUrl(), doc.getLength());
            titles.put(doc.getUrl(), doc.getTitle());
        }
        InvertedIndex index = InvertedIndex.restore(tokenizer, lengths, snapshot.getPostings(),
                snapshot.getPositions());
        return new QueryProcessor(index, tokenizer, snapshot.getPageRank(), titles,
                new Ranker(config.getWeightTfidf(), config.getWeightPageRank()));
    }

    public List<SearchResult> search(String queryString)
    {
        return rank(queryString).stream()
                .map(doc -> new SearchResult(doc.getUrl(), titles.getOrDefault(doc.getUrl(), ""), doc.getScore()))
                .collect(Collectors.toList());
    }

    /** Same ordering as {@link #search}, with the individual score components. */
    public List<RankedDocument> rank(String queryString)
    {
        if (queryString == null || queryString.isBlank())
            return new ArrayList<>();

        List<List<String>> phrases = new ArrayList<>();
        Matcher matcher = PHRASE.matcher(queryString);
        while (matcher.find())
        {
            List<String> words = tokenizer.words(matcher.group(1));
            if (!words.isEmpty())
                phrases.add(words);
        }

        List<String> terms = tokenizer.analyze(queryString.replace('"', ' '));
        if (phrases.isEmpty())
        {
            if (terms.isEmpty())
            {
                LOG.debug("Query '{}' has no indexable terms", queryString);
                return new ArrayList<>();
            }
            List<RankedDocument> ranked = ranker.rank(terms, index, pageRanks);
            LOG.debug("Query '{}' -> terms {} -> {} hits", queryString, terms, ranked.size());
            return ranked;
        }

        Set<String> candidates = null;
        for (List<String> phrase : phrases)
        {
            Set<String> matches = index.matchPhrase(phrase);
            if (candidates == null)
                candidates = new TreeSet<>(matches);
            else
                candidates.retainAll(matches);
        }
        if (candidates.isEmpty())
        {
            LOG.debug("Query '{}' -> phrases {} match no document", queryString, phrases);
            return new ArrayList<>();
        }
        List<RankedDocument> ranked = ranker.rank(terms, index, pageRanks, candidates);
        LOG.debug("Query '{}' -> terms {}, phrases {} -> {} hits", queryString, terms, phrases, ranked.size());
        return ranked;
    }

    /** Serializable copy of the index and ranks; requires the in-process index. */
    public SearchSnapshot toSnapshot()
    {
        if (!(index instanceof InvertedIndex))
            throw new IllegalStateException("Snapshots need an InvertedIndex, got " + index.getClass().getName());
        InvertedIndex inverted = (InvertedIndex) index;

        SearchSnapshot snapshot = new SearchSnapshot();
        snapshot.setCreatedAt(System.currentTimeMillis());
        snapshot.setStemming(tokenizer.isStemming());

        List<SearchSnapshot.DocumentEntry> documents = new ArrayList<>();
        inverted.getDocumentLengths().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> documents.add(new SearchSnapshot.DocumentEntry(e.getKey(),
                        titles.getOrDefault(e.getKey(), ""), e.getValue())));
        snapshot.setDocuments(documents);

        Map<String, Map<String, Integer>> postings = new LinkedHashMap<>();
        inverted.terms().stream().sorted().forEach(term -> {
            Map<String, Integer> docs = new LinkedHashMap<>();
            for (Posting posting : inverted.lookup(term))
            {
                docs.put(posting.getUrl(), posting.getTermFrequency());
            }
            postings.put(term, docs);
        });
        snapshot.setPostings(postings);
        snapshot.setPositions(inverted.wordPositions());
        snapshot.setPageRank(new LinkedHashMap<>(pageRanks));
        return snapshot;
    }

    public Map<String, Double> getPageRanks()
    {
        return pageRanks;
    }

    public int documentCount()
    {
        return index.documentCount();
    }
}
