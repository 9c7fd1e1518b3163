package com.unisearch.Crawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Purpose: robots.txt support, one cached rule set per scheme://host[:port].
//Groups for "*" and for our own user agent apply; the longest matching Allow/Disallow wins.
//A robots.txt that cannot be fetched allows everything.

public class RobotsChecker {
    private static final Logger LOG = LoggerFactory.getLogger(RobotsChecker.class);

    private final ConcurrentMap<String, RobotsRules> domainCache = new ConcurrentHashMap<>();
    private final Fetcher fetcher;
    private final String userAgent;

    public RobotsChecker(Fetcher fetcher, String userAgent) {
        this.fetcher = fetcher;
        this.userAgent = userAgent;
    }

    public boolean isAllowed(String url) {
        try {
            return rulesFor(url).isAllowed(pathOf(url));
        } catch (URISyntaxException e) {
            return true;
        }
    }

    /** Crawl-delay in milliseconds declared for the URL's host, or 0 when none is declared. */
    public long getCrawlDelayMs(String url) {
        try {
            return rulesFor(url).getCrawlDelayMs();
        } catch (URISyntaxException e) {
            return 0;
        }
    }

    private RobotsRules rulesFor(String url) throws URISyntaxException {
        String domainKey = domainKey(url);
        return domainCache.computeIfAbsent(domainKey, this::loadRules);
    }

    private RobotsRules loadRules(String domainKey) {
        String robotsUrl = domainKey + "/robots.txt";
        try {
            FetchResult result = fetcher.fetch(robotsUrl);
            LOG.debug("Loaded {}", robotsUrl);
            return RobotsRules.parse(result.getBody(), agentToken(userAgent));
        } catch (FetchException e) {
            LOG.debug("No usable robots.txt at {} ({}), allowing all", robotsUrl, e.getType());
            return RobotsRules.allowAll();
        }
    }

    private static String domainKey(String url) throws URISyntaxException {
        URI u = new URI(url);
        if (u.getScheme() == null || u.getHost() == null) {
            throw new URISyntaxException(url, "Not an absolute URL");
        }
        return u.getScheme().toLowerCase(Locale.ROOT) + "://" + u.getHost().toLowerCase(Locale.ROOT)
                + (u.getPort() != -1 ? ":" + u.getPort() : "");
    }

    private static String pathOf(String url) throws URISyntaxException {
        URI u = new URI(url);
        String path = u.getRawPath() == null || u.getRawPath().isEmpty() ? "/" : u.getRawPath();
        return u.getRawQuery() != null ? path + "?" + u.getRawQuery() : path;
    }

    // "CampusSearchBot/1.0 (+http://...)" -> "campussearchbot"
    private static String agentToken(String userAgent) {
        if (userAgent == null) {
            return "";
        }
        String token = userAgent.trim().split("[/\\s]", 2)[0];
        return token.toLowerCase(Locale.ROOT);
    }

    static class RobotsRules {
        private final List<Rule> rules;
        private final long crawlDelayMs;

        private RobotsRules(List<Rule> rules, long crawlDelayMs) {
            this.rules = rules;
            this.crawlDelayMs = crawlDelayMs;
        }

        static RobotsRules allowAll() {
            return new RobotsRules(List.of(), 0);
        }

        static RobotsRules parse(String robotsTxt, String agentToken) {
            List<Rule> wildcardRules = new ArrayList<>();
            List<Rule> agentRules = new ArrayList<>();
            long wildcardDelay = 0;
            long agentDelay = 0;
            boolean agentGroupSeen = false;

            List<String> groupAgents = new ArrayList<>();
            boolean inGroupBody = false;

            for (String rawLine : robotsTxt.split("\r?\n")) {
                String line = rawLine;
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                int colon = line.indexOf(':');
                if (colon <= 0) {
                    continue;
                }
                String field = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
                String value = line.substring(colon + 1).trim();

                if (field.equals("user-agent")) {
                    if (inGroupBody) {
                        groupAgents.clear();
                        inGroupBody = false;
                    }
                    groupAgents.add(value.toLowerCase(Locale.ROOT));
                    continue;
                }
                inGroupBody = true;
                boolean forAgent = !agentToken.isEmpty() && groupAgents.stream()
                        .anyMatch(a -> !a.equals("*") && agentToken.startsWith(a));
                boolean forWildcard = groupAgents.contains("*");
                if (!forAgent && !forWildcard) {
                    continue;
                }
                agentGroupSeen |= forAgent;

                switch (field) {
                    case "disallow":
                        if (!value.isEmpty()) {
                            (forAgent ? agentRules : wildcardRules).add(new Rule(value, false));
                        }
                        break;
                    case "allow":
                        if (!value.isEmpty()) {
                            (forAgent ? agentRules : wildcardRules).add(new Rule(value, true));
                        }
                        break;
                    case "crawl-delay":
                        long delay = parseDelayMs(value);
                        if (forAgent) {
                            agentDelay = delay;
                        } else {
                            wildcardDelay = delay;
                        }
                        break;
                    default:
                        break;
                }
            }
            return agentGroupSeen
                    ? new RobotsRules(agentRules, agentDelay)
                    : new RobotsRules(wildcardRules, wildcardDelay);
        }

        private static long parseDelayMs(String value) {
            try {
                return Math.max(0, Math.round(Double.parseDouble(value) * 1000));
            } catch (NumberFormatException e) {
                return 0;
            }
        }

        boolean isAllowed(String path) {
            Rule best = null;
            for (Rule rule : rules) {
                if (path.startsWith(rule.prefix)
                        && (best == null || rule.prefix.length() > best.prefix.length()
                            || (rule.prefix.length() == best.prefix.length() && rule.allow))) {
                    best = rule;
                }
            }
            return best == null || best.allow;
        }

        long getCrawlDelayMs() {
            return crawlDelayMs;
        }
    }

    private static class Rule {
        final String prefix;
        final boolean allow;

        Rule(String prefix, boolean allow) {
            this.prefix = prefix;
            this.allow = allow;
        }
    }
}
