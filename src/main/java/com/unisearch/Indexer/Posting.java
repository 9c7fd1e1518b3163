package com.unisearch.Indexer;

import java.util.Objects;

// One (term, document, frequency) entry of the inverted index. The document's total
// indexed-term count travels with it so tf can be computed from a lookup alone.
public final class Posting
{
    private final String term;
    private final String url;
    private final int termFrequency;
    private final int documentLength;

    public Posting(String term, String url, int termFrequency, int documentLength)
    {
        if (termFrequency <= 0 || documentLength < termFrequency)
            throw new IllegalArgumentException("Invalid posting counts for '" + term + "' in " + url
                    + ": tf=" + termFrequency + ", length=" + documentLength);
        this.term = term;
        this.url = url;
        this.termFrequency = termFrequency;
        this.documentLength = documentLength;
    }

    public String getTerm()
    {
        return term;
    }

    public String getUrl()
    {
        return url;
    }

    public int getTermFrequency()
    {
        return termFrequency;
    }

    public int getDocumentLength()
    {
        return documentLength;
    }

    /** count(t,d) / totalTerms(d) */
    public double getTf()
    {
        return (double) termFrequency / documentLength;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Posting))
            return false;
        Posting other = (Posting) o;
        return termFrequency == other.termFrequency && documentLength == other.documentLength
                && term.equals(other.term) && url.equals(other.url);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(term, url, termFrequency, documentLength);
    }

    @Override
    public String toString()
    {
        return "Posting{" + term + " @ " + url + " x" + termFrequency + "/" + documentLength + "}";
    }
}
