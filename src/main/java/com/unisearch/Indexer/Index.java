package com.unisearch.Indexer;

import java.util.List;
import java.util.Set;

/**
 * The index backend the crawler writes to and the ranker reads from. The in-process
 * {@link InvertedIndex} is the default; another full-text store can stand in as long as it
 * honours the same contract.
 */
public interface Index
{
    /**
     * Analyzes and records a document exactly once.
     *
     * @throws DuplicateDocumentException if the URL was already added in this index
     */
    void addDocument(String url, String text);

    /** Postings for an already-analyzed term; empty when the term is unknown. */
    List<Posting> lookup(String term);

    /** Number of documents holding at least one indexed term. */
    int documentCount();

    /**
     * Documents in which the given words, as produced by {@link Tokenizer#words}, occur
     * consecutively and in the same case.
     */
    Set<String> matchPhrase(List<String> words);
}
