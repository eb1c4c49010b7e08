package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.model.CrawlRunRequest;
import com.delta.jobharvest.crawl.model.ListingSeed;
import com.delta.jobharvest.crawl.util.UrlNormalizer;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns run input into listing seeds and computes the URL of page N of a seed. Page 1 carries no
 * page parameter; later pages add {@code p=N}.
 */
@Component
public class SeedUrlBuilder {
    private final HarvestProperties properties;
    private final SeedCsvReader seedCsvReader;

    public SeedUrlBuilder(HarvestProperties properties, SeedCsvReader seedCsvReader) {
        this.properties = properties;
        this.seedCsvReader = seedCsvReader;
    }

    /**
     * Request fields win over configuration; an explicit start URL wins over a search term. The
     * seeds CSV is only read when neither the request nor the configuration names a seed.
     */
    public List<ListingSeed> resolveSeeds(CrawlRunRequest request) {
        HarvestProperties.Search search = properties.getSearch();
        CrawlRunRequest safe = request == null ? CrawlRunRequest.defaults() : request;
        if (!isBlank(safe.startUrl())) {
            return List.of(ListingSeed.ofStartUrl(safe.startUrl().trim()));
        }
        if (!isBlank(safe.searchTerm())) {
            return List.of(ListingSeed.ofSearch(safe.searchTerm().trim(), firstNonBlank(safe.location(), search.getLocation())));
        }
        if (!isBlank(search.getStartUrl())) {
            return List.of(ListingSeed.ofStartUrl(search.getStartUrl().trim()));
        }
        if (!isBlank(search.getSearchTerm())) {
            return List.of(ListingSeed.ofSearch(search.getSearchTerm().trim(), firstNonBlank(safe.location(), search.getLocation())));
        }
        if (!isBlank(search.getSeedsCsv())) {
            List<ListingSeed> seeds = seedCsvReader.read(search.getSeedsCsv().trim());
            if (!seeds.isEmpty()) {
                return seeds;
            }
        }
        throw new IllegalArgumentException("Provide either startUrl or searchTerm");
    }

    public String pageUrl(ListingSeed seed, int pageNumber) {
        HarvestProperties.Search search = properties.getSearch();
        if (seed.hasStartUrl()) {
            return withPageParam(seed.startUrl().trim(), search.getPageParam(), pageNumber);
        }
        List<String> params = new ArrayList<>();
        params.add(encode(search.getQueryParam()) + "=" + encode(seed.searchTerm()));
        if (!isBlank(seed.location())) {
            params.add(encode(search.getLocationParam()) + "=" + encode(seed.location().trim()));
        }
        if (pageNumber > 1) {
            params.add(encode(search.getPageParam()) + "=" + pageNumber);
        }
        String base = search.getBaseUrl().trim();
        return base + (base.contains("?") ? "&" : "?") + String.join("&", params);
    }

    private String withPageParam(String startUrl, String pageParam, int pageNumber) {
        URI uri = UrlNormalizer.safeUri(startUrl);
        if (uri == null) {
            throw new IllegalArgumentException("Invalid startUrl: " + startUrl);
        }
        List<String> kept = new ArrayList<>();
        String rawQuery = uri.getRawQuery();
        if (rawQuery != null) {
            for (String part : rawQuery.split("&")) {
                if (part.isEmpty()) {
                    continue;
                }
                int eq = part.indexOf('=');
                String name = eq < 0 ? part : part.substring(0, eq);
                if (!name.equals(pageParam)) {
                    kept.add(part);
                }
            }
        }
        if (pageNumber > 1) {
            kept.add(encode(pageParam) + "=" + pageNumber);
        }
        StringBuilder out = new StringBuilder();
        out.append(uri.getScheme()).append("://").append(uri.getRawAuthority());
        out.append(uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath());
        if (!kept.isEmpty()) {
            out.append('?').append(String.join("&", kept));
        }
        return out.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value.trim(), StandardCharsets.UTF_8);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
