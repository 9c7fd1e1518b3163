package com.unisearch.Indexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

// Text analysis shared by indexing and querying: lowercase, split on anything that is not a
// letter or digit, drop stop words, optionally stem. Stateless apart from the stemmer cache.
public class Tokenizer
{
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    private final Stemmer stemmer;

    public Tokenizer()
    {
        this(false);
    }

    public Tokenizer(boolean stemming)
    {
        this.stemmer = stemming ? new Stemmer() : null;
    }

    /** Lowercased alphanumeric runs, in order, stop words included. */
    public List<String> tokenize(String text)
    {
        return text == null ? new ArrayList<>() : words(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Alphanumeric runs in their original case, in order, stop words included.
     * Phrase matching works on these.
     */
    public List<String> words(String text)
    {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank())
            return words;

        for (String word : NON_ALPHANUMERIC.split(text))
        {
            if (!word.isEmpty())
                words.add(word);
        }
        return words;
    }

    /** The index terms for a text: tokens minus stop words, stemmed when enabled. */
    public List<String> analyze(String text)
    {
        List<String> terms = StopWords.removeStopWords(tokenize(text));
        if (stemmer != null)
            terms.replaceAll(stemmer::stem);
        return terms;
    }

    public boolean isStemming()
    {
        return stemmer != null;
    }
}
