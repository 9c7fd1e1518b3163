package com.unisearch.Ranker;

public class RankedDocument
{
    private final String url;
    private final double score;
    private final double tfidf;
    private final double relevance;
    private final double popularity;

    public RankedDocument(String url, double score, double tfidf, double relevance, double popularity)
    {
        this.url = url;
        this.score = score;
        this.tfidf = tfidf;
        this.relevance = relevance;
        this.popularity = popularity;
    }

    public String getUrl()
    {
        return url;
    }

    /** weightTfidf * relevance + weightPageRank * popularity */
    public double getScore()
    {
        return score;
    }

    /** Raw sum of tf * idf over the query terms. */
    public double getTfidf()
    {
        return tfidf;
    }

    /** tf-idf divided by the best tf-idf among this query's candidates, in [0,1]. */
    public double getRelevance()
    {
        return relevance;
    }

    /** PageRank of the document, 0 when it has none. */
    public double getPopularity()
    {
        return popularity;
    }

    @Override
    public String toString()
    {
        return String.format("%s: score=%.4f (relevance=%.4f, popularity=%.4f)", url, score, relevance, popularity);
    }
}
