package com.unisearch.Indexer;

// A URL reached the index twice in one pass. The frontier guarantees this cannot happen,
// so seeing it means crawl state is corrupt and the run must stop.
public class DuplicateDocumentException extends IllegalStateException
{
    private final String url;

    public DuplicateDocumentException(String url)
    {
        super("Document already indexed: " + url);
        this.url = url;
    }

    public String getUrl()
    {
        return url;
    }
}
