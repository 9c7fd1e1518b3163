package com.unisearch.QueryProcessor;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Everything query serving needs, written after a crawl and read back instead of crawling again.
public class SearchSnapshot
{
    public static final int FORMAT_VERSION = 2;

    @JsonProperty("version")
    private int version = FORMAT_VERSION;

    @JsonProperty("created_at")
    private long createdAt;

    @JsonProperty("stemming")
    private boolean stemming;

    @JsonProperty("documents")
    private List<DocumentEntry> documents = new ArrayList<>();

    // term -> (url -> term frequency)
    @JsonProperty("postings")
    private Map<String, Map<String, Integer>> postings = new LinkedHashMap<>();

    // word -> (url -> positions), case preserved
    @JsonProperty("positions")
    private Map<String, Map<String, List<Integer>>> positions = new LinkedHashMap<>();

    @JsonProperty("page_rank")
    private Map<String, Double> pageRank = new LinkedHashMap<>();

    public int getVersion()
    {
        return version;
    }

    public void setVersion(int version)
    {
        this.version = version;
    }

    public long getCreatedAt()
    {
        return createdAt;
    }

    public void setCreatedAt(long createdAt)
    {
        this.createdAt = createdAt;
    }

    public boolean isStemming()
    {
        return stemming;
    }

    public void setStemming(boolean stemming)
    {
        this.stemming = stemming;
    }

    public List<DocumentEntry> getDocuments()
    {
        return documents;
    }

    public void setDocuments(List<DocumentEntry> documents)
    {
        this.documents = documents;
    }

    public Map<String, Map<String, Integer>> getPostings()
    {
        return postings;
    }

    public void setPostings(Map<String, Map<String, Integer>> postings)
    {
        this.postings = postings;
    }

    public Map<String, Map<String, List<Integer>>> getPositions()
    {
        return positions;
    }

    public void setPositions(Map<String, Map<String, List<Integer>>> positions)
    {
        this.positions = positions;
    }

    public Map<String, Double> getPageRank()
    {
        return pageRank;
    }

    public void setPageRank(Map<String, Double> pageRank)
    {
        this.pageRank = pageRank;
    }

    public static class DocumentEntry
    {
        @JsonProperty("url")
        private String url;

        @JsonProperty("title")
        private String title;

        @JsonProperty("length")
        private int length;

        public DocumentEntry() {}

        public DocumentEntry(String url, String title, int length)
        {
            this.url = url;
            this.title = title;
            this.length = length;
        }

        public String getUrl()
        {
            return url;
        }

        public void setUrl(String url)
        {
            this.url = url;
        }

        public String getTitle()
        {
            return title;
        }

        public void setTitle(String title)
        {
            this.title = title;
        }

        public int getLength()
        {
            return length;
        }

        public void setLength(int length)
        {
            this.length = length;
        }
    }
}
