package com.unisearch.Popularity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed page -> page link graph accumulated during one crawl.
 * <p>
 * Append-only: nodes are pages that were fetched and parsed, edges are deduplicated per
 * (source, target) pair and may point anywhere, including outside the crawl scope. A redirecting
 * URL is recorded as an alias of the page it redirected to, so links to either reach the same
 * node. Once the crawl is over the graph is {@link #seal() sealed}; only a sealed graph can
 * be handed to PageRank, and a sealed graph rejects further writes.
 */
public class LinkGraph {
    private final Set<String> nodes = new LinkedHashSet<>();
    private final Map<String, Set<String>> outLinks = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private int edgeCount = 0;
    private volatile boolean sealed = false;

    public synchronized void addNode(String url) {
        checkWritable();
        nodes.add(url);
    }

    /**
     * Records source -> target for every target not already linked from source.
     *
     * @return number of new edges
     */
    public synchronized int addEdges(String source, Collection<String> targets) {
        checkWritable();
        Set<String> existing = outLinks.computeIfAbsent(source, k -> new LinkedHashSet<>());
        int added = 0;
        for (String target : targets) {
            if (target != null && existing.add(target)) {
                added++;
            }
        }
        edgeCount += added;
        return added;
    }

    /** Records that {@code from} redirects to {@code to}; edges to {@code from} count for {@code to}. */
    public synchronized void addAlias(String from, String to) {
        checkWritable();
        if (from != null && to != null && !from.equals(to)) {
            aliases.put(from, to);
        }
    }

    public synchronized Map<String, String> aliases() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public synchronized void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * The graph PageRank runs on: every node with its distinct out-neighbours that are
     * themselves nodes, after resolving redirect aliases. Targets that were never fetched
     * are dropped here.
     *
     * @throws IllegalStateException if the crawl has not finished building the graph
     */
    public synchronized Map<String, List<String>> rankableGraph() {
        if (!sealed) {
            throw new IllegalStateException("Link graph is still being built; seal() it before ranking");
        }
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (String node : nodes) {
            Set<String> targets = new LinkedHashSet<>();
            for (String target : outLinks.getOrDefault(node, Collections.emptySet())) {
                String resolved = aliases.getOrDefault(target, target);
                if (nodes.contains(resolved)) {
                    targets.add(resolved);
                }
            }
            graph.put(node, new ArrayList<>(targets));
        }
        return graph;
    }

    public synchronized List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(edgeCount);
        outLinks.forEach((source, targets) -> targets.forEach(t -> edges.add(new Edge(source, t))));
        return edges;
    }

    public synchronized Set<String> outLinks(String source) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(outLinks.getOrDefault(source, Collections.emptySet())));
    }

    public synchronized Set<String> nodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
    }

    public synchronized boolean containsNode(String url) {
        return nodes.contains(url);
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    public synchronized int edgeCount() {
        return edgeCount;
    }

    private void checkWritable() {
        if (sealed) {
            throw new IllegalStateException("Link graph is sealed; the crawl that built it has finished");
        }
    }
}
