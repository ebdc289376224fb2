package com.bountyscope.tools;

import com.bountyscope.core.engine.RunCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conservative breadth-first crawler: same host only, bounded depth and page count,
 * fixed delay between requests.
 */
@Component
public class HttpCrawler implements CrawlAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpCrawler.class);

    private static final Pattern HREF = Pattern.compile("href=[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);

    private final ToolProperties properties;
    private final HttpClient httpClient;

    public HttpCrawler(ToolProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(properties.getRequestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    HttpCrawler(ToolProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Override
    public List<String> crawl(String startUrl) {
        var start = HostSanitizer.sanitizeUrl(startUrl);
        if (start.isEmpty()) {
            log.warn("Invalid start URL: {}", startUrl);
            return List.of();
        }
        String baseHost = URI.create(start.get()).getHost();
        log.info("Crawling {} (max depth {}, max pages {})", start.get(),
                properties.getCrawlerMaxDepth(), properties.getCrawlerMaxPages());

        List<String> discovered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String[]> queue = new ArrayDeque<>();
        queue.add(new String[]{start.get(), "0"});

        while (!queue.isEmpty() && discovered.size() < properties.getCrawlerMaxPages()) {
            String[] next = queue.poll();
            String url = next[0];
            int depth = Integer.parseInt(next[1]);
            if (depth > properties.getCrawlerMaxDepth() || !visited.add(url)) {
                continue;
            }
            discovered.add(url);
            pause();
            try {
                var request = HttpRequest.newBuilder(URI.create(url))
                        .timeout(properties.getRequestTimeout())
                        .header("User-Agent", properties.getUserAgent())
                        .GET()
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() == 200) {
                    for (String link : extractLinks(response.body(), url, baseHost,
                            properties.getCrawlerMaxLinksPerPage())) {
                        if (!visited.contains(link)) {
                            queue.add(new String[]{link, String.valueOf(depth + 1)});
                        }
                    }
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Failed to crawl {}: {}", url, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException("interrupted");
            }
        }
        log.info("Crawled {} pages from {}", discovered.size(), start.get());
        return discovered;
    }

    /** Absolute same-host links found in {@code html}, anchors and script links skipped. */
    static List<String> extractLinks(String html, String baseUrl, String baseHost, int limit) {
        List<String> links = new ArrayList<>();
        if (html == null) {
            return links;
        }
        URI base = URI.create(baseUrl);
        Matcher m = HREF.matcher(html);
        while (m.find() && links.size() < limit) {
            String href = m.group(1).trim();
            if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")
                    || href.toLowerCase(Locale.ROOT).startsWith("mailto:")) {
                continue;
            }
            try {
                URI resolved = base.resolve(href);
                if (baseHost.equalsIgnoreCase(resolved.getHost())) {
                    String absolute = resolved.toString();
                    int fragment = absolute.indexOf('#');
                    links.add(fragment >= 0 ? absolute.substring(0, fragment) : absolute);
                }
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed link {}", href);
            }
        }
        return links;
    }

    private void pause() {
        long millis = properties.getCrawlerDelay().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("interrupted");
        }
    }
}
