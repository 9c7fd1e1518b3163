package com.unisearch.Crawler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

//Purpose: Fingerprints page text so that mirrors (e.g. /index.html and /) are indexed once.
//Whitespace runs and letter case are folded before hashing with SHA-256.

public final class PageHasher {
    private static final String HASH_ALGORITHM = "SHA-256";

    private PageHasher() {
    }

    public static String contentHash(String text) {
        String canonical = text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        try {
            MessageDigest md = MessageDigest.getInstance(HASH_ALGORITHM);
            return HexFormat.of().formatHex(md.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " is not available", e);
        }
    }
}
