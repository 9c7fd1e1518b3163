package com.unisearch.Ranker;

import com.unisearch.Indexer.Index;
import com.unisearch.Indexer.Posting;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Merges tf-idf relevance with PageRank popularity. Holds no mutable state, so one instance
// can serve any number of concurrent queries against a finished index.
public class Ranker
{
    public static final Comparator<RankedDocument> ORDER =
            Comparator.comparingDouble(RankedDocument::getScore).reversed()
                    .thenComparing(RankedDocument::getUrl);

    private final double weightTfidf;
    private final double weightPageRank;

    public Ranker(double weightTfidf, double weightPageRank)
    {
        if (weightTfidf < 0 || weightPageRank < 0)
            throw new IllegalArgumentException("Ranking weights must not be negative: tfidf=" + weightTfidf
                    + ", pageRank=" + weightPageRank);
        this.weightTfidf = weightTfidf;
        this.weightPageRank = weightPageRank;
    }

    public static List<RankedDocument> rank(List<String> queryTerms, Index index, Map<String, Double> pageRankScores,
            double weightTfidf, double weightPageRank)
    {
        return new Ranker(weightTfidf, weightPageRank).rank(queryTerms, index, pageRankScores);
    }

    /**
     * Scores every document that contains at least one query term, best first, ties by URL.
     * Repeated query terms count once.
     */
    public List<RankedDocument> rank(List<String> queryTerms, Index index, Map<String, Double> pageRankScores)
    {
        return rank(queryTerms, index, pageRankScores, null);
    }

    /**
     * Like {@link #rank(List, Index, Map)}, but only over {@code candidates} when it is not null.
     * A candidate without any query term still ranks, on PageRank alone.
     */
    public List<RankedDocument> rank(List<String> queryTerms, Index index, Map<String, Double> pageRankScores,
            Set<String> candidates)
    {
        Set<String> terms = new LinkedHashSet<>(queryTerms);
        int totalDocuments = index.documentCount();

        Map<String, Double> tfidfByUrl = new LinkedHashMap<>();
        for (String term : terms)
        {
            List<Posting> postings = index.lookup(term);
            if (postings.isEmpty())
                continue;
            double idf = idf(totalDocuments, postings.size());
            for (Posting posting : postings)
            {
                if (candidates == null || candidates.contains(posting.getUrl()))
                    tfidfByUrl.merge(posting.getUrl(), posting.getTf() * idf, Double::sum);
            }
        }
        if (candidates != null)
        {
            for (String url : candidates)
            {
                tfidfByUrl.putIfAbsent(url, 0.0);
            }
        }
        if (tfidfByUrl.isEmpty())
            return new ArrayList<>();

        double maxTfidf = tfidfByUrl.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        List<RankedDocument> ranked = new ArrayList<>(tfidfByUrl.size());
        tfidfByUrl.forEach((url, tfidf) -> {
            double relevance = maxTfidf > 0 ? tfidf / maxTfidf : 0.0;
            double popularity = pageRankScores.getOrDefault(url, 0.0);
            double score = weightTfidf * relevance + weightPageRank * popularity;
            ranked.add(new RankedDocument(url, score, tfidf, relevance, popularity));
        });
        ranked.sort(ORDER);
        return ranked;
    }

    /** ln(N / df); 0 for a term found in every document. */
    public static double idf(int totalDocuments, int documentFrequency)
    {
        if (documentFrequency <= 0 || totalDocuments <= 0)
            return 0.0;
        return Math.log((double) totalDocuments / documentFrequency);
    }

    public double getWeightTfidf()
    {
        return weightTfidf;
    }

    public double getWeightPageRank()
    {
        return weightPageRank;
    }
}
