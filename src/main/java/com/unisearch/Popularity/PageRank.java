package com.unisearch.Popularity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PageRank {
    private static final Logger LOG = LoggerFactory.getLogger(PageRank.class);

    public static final double DEFAULT_DAMPING_FACTOR = 0.85;
    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    public static Map<String, Double> computeRanks(LinkGraph graph, double dampingFactor, int maxIterations,
            double tolerance) {
        return computeRanks(graph.rankableGraph(), dampingFactor, maxIterations, tolerance);
    }

    /**
     * Classic iterative PageRank with uniform redistribution of dangling mass.
     * <p>
     * Every key of {@code graph} is a page; links to URLs that are not keys are ignored, and a
     * page whose links all point elsewhere is dangling. Duplicate links count once, a self-loop
     * counts as an ordinary out-link. Iteration stops when the L1 distance between successive
     * vectors drops below {@code tolerance} or after {@code maxIterations}; in the latter case
     * the last vector is returned as is.
     *
     * @return url -> score, scores summing to 1 (empty for an empty graph)
     */
    public static Map<String, Double> computeRanks(Map<String, List<String>> graph, double dampingFactor,
            int maxIterations, double tolerance) {
        if (dampingFactor < 0 || dampingFactor > 1 || Double.isNaN(dampingFactor)) {
            throw new IllegalArgumentException("dampingFactor must be in [0,1]: " + dampingFactor);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1: " + maxIterations);
        }
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance must not be negative: " + tolerance);
        }

        final int n = graph.size();
        if (n == 0) return Collections.emptyMap();

        String[] pages = graph.keySet().toArray(new String[0]);
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < n; i++) {
            position.put(pages[i], i);
        }

        // Precompute incoming links and out-degrees over in-graph targets only
        int[] outDegree = new int[n];
        int[][] incoming = buildIncoming(graph, pages, position, outDegree);

        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);
        final double teleport = (1 - dampingFactor) / n;

        int iter = 0;
        double delta = Double.MAX_VALUE;
        while (iter < maxIterations) {
            double danglingMass = 0.0;
            for (int i = 0; i < n; i++) {
                if (outDegree[i] == 0) {
                    danglingMass += rank[i];
                }
            }
            double base = teleport + dampingFactor * danglingMass / n;

            double[] next = new double[n];
            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                double incomingSum = 0.0;
                for (int source : incoming[i]) {
                    incomingSum += rank[source] / outDegree[source];
                }
                next[i] = base + dampingFactor * incomingSum;
                sum += next[i];
            }

            // Rescale so rounding error cannot accumulate across iterations
            delta = 0.0;
            for (int i = 0; i < n; i++) {
                next[i] /= sum;
                delta += Math.abs(next[i] - rank[i]);
            }
            rank = next;
            iter++;

            LOG.debug("Iter {}: sum={} dangling={} delta={}", iter, sum, danglingMass, delta);
            if (delta < tolerance) {
                break;
            }
        }

        if (delta < tolerance) {
            LOG.info("PageRank converged after {} iterations over {} pages", iter, n);
        } else {
            LOG.info("PageRank stopped at {} iterations over {} pages (delta {} above tolerance {})",
                    iter, n, delta, tolerance);
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            scores.put(pages[i], rank[i]);
        }
        return scores;
    }

    private static int[][] buildIncoming(Map<String, List<String>> graph, String[] pages,
            Map<String, Integer> position, int[] outDegree) {
        int n = pages.length;
        List<List<Integer>> incoming = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            incoming.add(new ArrayList<>());
        }
        for (int source = 0; source < n; source++) {
            List<String> links = graph.get(pages[source]);
            if (links == null) continue;
            Set<String> distinct = new LinkedHashSet<>(links);
            for (String link : distinct) {
                Integer target = position.get(link);
                if (target != null) {
                    incoming.get(target).add(source);
                    outDegree[source]++;
                }
            }
        }
        int[][] result = new int[n][];
        for (int i = 0; i < n; i++) {
            result[i] = incoming.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }
}
