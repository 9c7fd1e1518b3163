package com.unisearch.Indexer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class StopWords
{
    private static final Logger LOG = LoggerFactory.getLogger(StopWords.class);
    private static final String RESOURCE = "/stop_words.txt";
    private static final Set<String> STOP_WORDS = load();

    private StopWords()
    {
    }

    // The list ships inside the jar; a missing list would silently change every score
    private static Set<String> load()
    {
        try (InputStream in = StopWords.class.getResourceAsStream(RESOURCE))
        {
            if (in == null)
                throw new IllegalStateException("Stop word list not found on classpath: " + RESOURCE);

            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            Set<String> words = reader.lines()
                    .map(line -> line.trim().toLowerCase(Locale.ROOT))
                    .filter(word -> !word.isBlank() && !word.startsWith("#"))
                    .collect(Collectors.toCollection(HashSet::new));
            LOG.debug("Loaded {} stop words", words.size());
            return Collections.unmodifiableSet(words);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Error loading stop words", e);
        }
    }

    public static boolean isStopWord(String word)
    {
        return word != null && STOP_WORDS.contains(word);
    }

    public static List<String> removeStopWords(List<String> words)
    {
        if (words == null || words.isEmpty())
        {
            return new ArrayList<>();
        }

        return words.stream()
                .filter(word -> word != null && !word.isBlank() && !STOP_WORDS.contains(word))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public static int size()
    {
        return STOP_WORDS.size();
    }
}
