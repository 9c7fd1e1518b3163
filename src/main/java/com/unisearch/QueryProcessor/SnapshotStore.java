package com.unisearch.QueryProcessor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

// Reads and writes SearchSnapshot as JSON. Writes go to a sibling temp file first and are
// moved into place, so a crash mid-write never leaves a truncated snapshot behind.
public class SnapshotStore
{
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotStore.class);

    private final ObjectMapper mapper;

    public SnapshotStore()
    {
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void save(Path path, SearchSnapshot snapshot) throws IOException
    {
        Path target = path.toAbsolutePath();
        if (target.getParent() != null)
            Files.createDirectories(target.getParent());

        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), snapshot);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Saved snapshot with {} documents and {} terms to {}", snapshot.getDocuments().size(),
                snapshot.getPostings().size(), target);
    }

    public SearchSnapshot load(Path path) throws IOException
    {
        SearchSnapshot snapshot = mapper.readValue(path.toFile(), SearchSnapshot.class);
        if (snapshot.getVersion() != SearchSnapshot.FORMAT_VERSION)
            throw new IOException("Unsupported snapshot version " + snapshot.getVersion() + " in " + path);
        LOG.info("Loaded snapshot with {} documents and {} terms from {}", snapshot.getDocuments().size(),
                snapshot.getPostings().size(), path);
        return snapshot;
    }

    public boolean exists(Path path)
    {
        return Files.isRegularFile(path);
    }
}
