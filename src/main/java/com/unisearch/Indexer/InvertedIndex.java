package com.unisearch.Indexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory inverted index: term -> (url -> posting), plus word -> (url -> positions) over the
 * case-preserving word sequence for phrase queries.
 * <p>
 * Writers are serialized on the index monitor; readers never lock, so once the crawl has
 * finished any number of queries can read it concurrently. Term counts for a document are
 * computed once in {@link #addDocument} and never updated afterwards.
 */
public class InvertedIndex implements Index {
    private static final Logger LOG = LoggerFactory.getLogger(InvertedIndex.class);

    private final Tokenizer tokenizer;
    private final Map<String, Map<String, Posting>> postings = new ConcurrentHashMap<>();
    private final Map<String, Map<String, int[]>> positions = new ConcurrentHashMap<>();
    private final Map<String, Integer> documentLengths = new ConcurrentHashMap<>();
    private final Set<String> seenDocuments = ConcurrentHashMap.newKeySet();

    public InvertedIndex(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public void addDocument(String url, String text) {
        if (url == null) {
            throw new IllegalArgumentException("url must not be null");
        }
        List<String> terms = tokenizer.analyze(text);
        Map<String, List<Integer>> wordPositions = new LinkedHashMap<>();
        List<String> words = tokenizer.words(text);
        for (int i = 0; i < words.size(); i++) {
            wordPositions.computeIfAbsent(words.get(i), k -> new ArrayList<>()).add(i);
        }

        synchronized (this) {
            if (!seenDocuments.add(url)) {
                throw new DuplicateDocumentException(url);
            }
            if (terms.isEmpty()) {
                LOG.debug("No indexable terms in {}, left out of the document count", url);
                return;
            }
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (String term : terms) {
                counts.merge(term, 1, Integer::sum);
            }
            int length = terms.size();
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                postings.computeIfAbsent(entry.getKey(), k -> new ConcurrentHashMap<>())
                    .put(url, new Posting(entry.getKey(), url, entry.getValue(), length));
            }
            wordPositions.forEach((word, at) -> putPositions(word, url, at));
            documentLengths.put(url, length);
        }
    }

    @Override
    public Set<String> matchPhrase(List<String> words) {
        Set<String> matches = new TreeSet<>();
        if (words == null || words.isEmpty()) {
            return matches;
        }
        Map<String, int[]> first = positions.get(words.get(0));
        if (first == null) {
            return matches;
        }
        for (Map.Entry<String, int[]> entry : first.entrySet()) {
            for (int start : entry.getValue()) {
                if (phraseAt(entry.getKey(), words, start)) {
                    matches.add(entry.getKey());
                    break;
                }
            }
        }
        return matches;
    }

    private boolean phraseAt(String url, List<String> words, int start) {
        for (int i = 1; i < words.size(); i++) {
            Map<String, int[]> docs = positions.get(words.get(i));
            int[] at = docs == null ? null : docs.get(url);
            if (at == null || Arrays.binarySearch(at, start + i) < 0) {
                return false;
            }
        }
        return true;
    }

    private void putPositions(String word, String url, List<Integer> at) {
        int[] sorted = at.stream().mapToInt(Integer::intValue).sorted().toArray();
        positions.computeIfAbsent(word, k -> new ConcurrentHashMap<>()).put(url, sorted);
    }

    @Override
    public List<Posting> lookup(String term) {
        Map<String, Posting> docs = term == null ? null : postings.get(term);
        if (docs == null || docs.isEmpty()) {
            return Collections.emptyList();
        }
        List<Posting> result = new ArrayList<>(docs.values());
        result.sort(Comparator.comparing(Posting::getUrl));
        return result;
    }

    @Override
    public int documentCount() {
        return documentLengths.size();
    }

    public boolean containsDocument(String url) {
        return seenDocuments.contains(url);
    }

    public int documentLength(String url) {
        return documentLengths.getOrDefault(url, 0);
    }

    public Map<String, Integer> getDocumentLengths() {
        return Collections.unmodifiableMap(documentLengths);
    }

    public Set<String> terms() {
        return Collections.unmodifiableSet(postings.keySet());
    }

    /** word -> (url -> ascending positions), as stored for phrase matching. */
    public Map<String, Map<String, List<Integer>>> wordPositions() {
        Map<String, Map<String, List<Integer>>> copy = new LinkedHashMap<>();
        positions.forEach((word, docs) -> {
            Map<String, List<Integer>> byUrl = new LinkedHashMap<>();
            docs.forEach((url, at) -> byUrl.put(url, Arrays.stream(at).boxed().collect(Collectors.toList())));
            copy.put(word, byUrl);
        });
        return copy;
    }

    public int termCount() {
        return postings.size();
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public static InvertedIndex restore(Tokenizer tokenizer, Map<String, Integer> documentLengths,
            Map<String, Map<String, Integer>> termFrequencies) {
        return restore(tokenizer, documentLengths, termFrequencies, Collections.emptyMap());
    }

    /**
     * Rebuilds an index from persisted counts without re-analyzing any text.
     *
     * @param documentLengths url -> total indexed terms
     * @param termFrequencies term -> (url -> count)
     * @param wordPositions word -> (url -> positions); phrase queries match nothing without them
     */
    public static InvertedIndex restore(Tokenizer tokenizer, Map<String, Integer> documentLengths,
            Map<String, Map<String, Integer>> termFrequencies, Map<String, Map<String, List<Integer>>> wordPositions) {
        InvertedIndex index = new InvertedIndex(tokenizer);
        documentLengths.forEach((url, length) -> {
            if (length > 0) {
                index.documentLengths.put(url, length);
            }
            index.seenDocuments.add(url);
        });
        termFrequencies.forEach((term, docs) -> docs.forEach((url, count) -> {
            Integer length = index.documentLengths.get(url);
            if (length == null) {
                throw new IllegalArgumentException("Posting for '" + term + "' references unknown document " + url);
            }
            index.postings.computeIfAbsent(term, k -> new ConcurrentHashMap<>())
                .put(url, new Posting(term, url, count, length));
        }));
        wordPositions.forEach((word, docs) -> docs.forEach((url, at) -> {
            if (!index.documentLengths.containsKey(url)) {
                throw new IllegalArgumentException("Positions for '" + word + "' reference unknown document " + url);
            }
            index.putPositions(word, url, at);
        }));
        return index;
    }
}
