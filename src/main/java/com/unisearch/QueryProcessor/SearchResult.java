package com.unisearch.QueryProcessor;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SearchResult
{
    @JsonProperty("url")
    private final String url;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("score")
    private final double score;

    public SearchResult(String url, String title, double score)
    {
        this.url = url;
        this.title = title;
        this.score = score;
    }

    public String getUrl()
    {
        return url;
    }

    public String getTitle()
    {
        return title;
    }

    public double getScore()
    {
        return score;
    }

    @Override
    public String toString()
    {
        return String.format("%.4f  %s  %s", score, url, title);
    }
}
