package com.unisearch.Indexer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.tartarus.snowball.ext.PorterStemmer;

// Porter (Snowball) stemming with a bounded LRU cache.
// Words of three characters or fewer and pure numbers pass through unchanged.
public class Stemmer
{
    private static final int MAX_CACHE_SIZE = 50000;

    private final Map<String, String> stemCache;

    public Stemmer()
    {
        this.stemCache =
                Collections.synchronizedMap(new LinkedHashMap<String, String>(16, 0.75f, true)
                {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<String, String> eldest)
                    {
                        return size() > MAX_CACHE_SIZE;
                    }
                });
    }

    public String stem(String word)
    {
        if (word == null || word.length() <= 3 || isNumeric(word))
            return word;

        String cachedStem = stemCache.get(word);
        if (cachedStem != null)
            return cachedStem;

        // SnowballProgram keeps per-instance buffers, so one stemmer per call keeps this thread-safe
        PorterStemmer stemmer = new PorterStemmer();
        stemmer.setCurrent(word);
        stemmer.stem();
        String result = stemmer.getCurrent();
        if (result == null || result.isEmpty())
            result = word;

        stemCache.put(word, result);
        return result;
    }

    private boolean isNumeric(String str)
    {
        for (int i = 0; i < str.length(); i++)
        {
            if (!Character.isDigit(str.charAt(i)))
                return false;
        }
        return true;
    }
}
