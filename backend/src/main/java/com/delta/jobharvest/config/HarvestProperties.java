package com.delta.jobharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "harvest")
public class HarvestProperties {
    private int maxItems = 20;
    private int maxPages = 3;
    private int maxConcurrency = 2;
    private int maxAttempts = 3;
    private int requestTimeoutSeconds = 30;
    private int workerPollIntervalMs = 200;
    private int progressIntervalSeconds = 5;
    private Search search = new Search();
    private Backoff backoff = new Backoff();
    private Identity identity = new Identity();
    private Transport transport = new Transport();
    private Extraction extraction = new Extraction();
    private Output output = new Output();
    private Cli cli = new Cli();

    public int getMaxItems() {
        return maxItems;
    }

    public void setMaxItems(int maxItems) {
        this.maxItems = maxItems;
    }

    public int getMaxPages() {
        return Math.max(1, maxPages);
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(1, maxPages);
    }

    public int getMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public int getMaxAttempts() {
        return Math.max(0, maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = Math.max(0, maxAttempts);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getWorkerPollIntervalMs() {
        return Math.max(10, workerPollIntervalMs);
    }

    public void setWorkerPollIntervalMs(int workerPollIntervalMs) {
        this.workerPollIntervalMs = Math.max(10, workerPollIntervalMs);
    }

    public int getProgressIntervalSeconds() {
        return Math.max(1, progressIntervalSeconds);
    }

    public void setProgressIntervalSeconds(int progressIntervalSeconds) {
        this.progressIntervalSeconds = Math.max(1, progressIntervalSeconds);
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public Identity getIdentity() {
        return identity;
    }

    public void setIdentity(Identity identity) {
        this.identity = identity;
    }

    public Transport getTransport() {
        return transport;
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Search {
        private String baseUrl = "https://jooble.org/SearchResult";
        private String searchTerm = "";
        private String location = "";
        private String startUrl = "";
        private String seedsCsv = "";
        private String queryParam = "ukw";
        private String locationParam = "rgns";
        private String pageParam = "p";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSearchTerm() {
            return searchTerm;
        }

        public void setSearchTerm(String searchTerm) {
            this.searchTerm = searchTerm;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getStartUrl() {
            return startUrl;
        }

        public void setStartUrl(String startUrl) {
            this.startUrl = startUrl;
        }

        public String getSeedsCsv() {
            return seedsCsv;
        }

        public void setSeedsCsv(String seedsCsv) {
            this.seedsCsv = seedsCsv;
        }

        public String getQueryParam() {
            return queryParam;
        }

        public void setQueryParam(String queryParam) {
            this.queryParam = queryParam;
        }

        public String getLocationParam() {
            return locationParam;
        }

        public void setLocationParam(String locationParam) {
            this.locationParam = locationParam;
        }

        public String getPageParam() {
            return pageParam;
        }

        public void setPageParam(String pageParam) {
            this.pageParam = pageParam;
        }
    }

    public static class Backoff {
        private long baseMs = 1000;
        private long capMs = 30000;

        public long getBaseMs() {
            return Math.max(1, baseMs);
        }

        public void setBaseMs(long baseMs) {
            this.baseMs = Math.max(1, baseMs);
        }

        public long getCapMs() {
            return Math.max(getBaseMs(), capMs);
        }

        public void setCapMs(long capMs) {
            this.capMs = Math.max(1, capMs);
        }
    }

    public static class Identity {
        private int maxPoolSize = 15;
        private int maxUsageCount = 50;
        private int maxErrorScore = 4;

        public int getMaxPoolSize() {
            return Math.max(1, maxPoolSize);
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = Math.max(1, maxPoolSize);
        }

        public int getMaxUsageCount() {
            return Math.max(1, maxUsageCount);
        }

        public void setMaxUsageCount(int maxUsageCount) {
            this.maxUsageCount = Math.max(1, maxUsageCount);
        }

        public int getMaxErrorScore() {
            return Math.max(1, maxErrorScore);
        }

        public void setMaxErrorScore(int maxErrorScore) {
            this.maxErrorScore = Math.max(1, maxErrorScore);
        }
    }

    public static class Transport {
        private int perHostDelayMs = 1000;
        private String proxyUrl = "";
        private String acceptLanguage = "en-US,en;q=0.9";

        public int getPerHostDelayMs() {
            return Math.max(0, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(0, perHostDelayMs);
        }

        public String getProxyUrl() {
            return proxyUrl;
        }

        public void setProxyUrl(String proxyUrl) {
            this.proxyUrl = proxyUrl;
        }

        public String getAcceptLanguage() {
            return acceptLanguage == null || acceptLanguage.isBlank() ? "en-US,en;q=0.9" : acceptLanguage.trim();
        }

        public void setAcceptLanguage(String acceptLanguage) {
            this.acceptLanguage = acceptLanguage;
        }
    }

    public static class Extraction {
        private List<String> blockSignals = new ArrayList<>(List.of(
            "captcha",
            "verify you are human",
            "are you a robot",
            "unusual traffic",
            "checking your browser",
            "access denied",
            "please enable cookies"
        ));
        private List<String> detailUrlPatterns = new ArrayList<>(List.of("/desc/"));
        private Map<String, List<String>> selectors = defaultSelectors();
        private int descriptionMaxChars = 20000;

        public List<String> getBlockSignals() {
            return blockSignals;
        }

        public void setBlockSignals(List<String> blockSignals) {
            this.blockSignals = blockSignals == null ? new ArrayList<>() : blockSignals;
        }

        public List<String> getDetailUrlPatterns() {
            return detailUrlPatterns;
        }

        public void setDetailUrlPatterns(List<String> detailUrlPatterns) {
            this.detailUrlPatterns = detailUrlPatterns == null ? new ArrayList<>() : detailUrlPatterns;
        }

        public Map<String, List<String>> getSelectors() {
            return selectors;
        }

        public void setSelectors(Map<String, List<String>> selectors) {
            this.selectors = selectors == null ? new LinkedHashMap<>() : selectors;
        }

        public int getDescriptionMaxChars() {
            return descriptionMaxChars;
        }

        public void setDescriptionMaxChars(int descriptionMaxChars) {
            this.descriptionMaxChars = descriptionMaxChars;
        }

        private static Map<String, List<String>> defaultSelectors() {
            Map<String, List<String>> out = new LinkedHashMap<>();
            out.put("title", new ArrayList<>(List.of(
                "h1",
                ".job-title",
                ".vacancy-title",
                "[data-qa=vacancy-title]",
                "meta[property=og:title]"
            )));
            out.put("company", new ArrayList<>(List.of(
                "[data-qa=vacancy-company-name]",
                "div[data-test=company_name]",
                "span[class*=company-name]",
                ".company-name",
                ".company",
                ".employer"
            )));
            out.put("location", new ArrayList<>(List.of(
                "[data-qa=vacancy-view-location]",
                ".job-location",
                "span[class*=location]",
                ".location"
            )));
            out.put("compensation", new ArrayList<>(List.of(
                "[data-qa=vacancy-salary]",
                ".salary",
                ".compensation",
                "div[class*=salary]"
            )));
            out.put("employmentType", new ArrayList<>(List.of(
                "span[data-qa*=employment]",
                "span[data-qa*=schedule]",
                ".job-type",
                "span[class*=type]"
            )));
            out.put("postedAt", new ArrayList<>(List.of(
                "time[datetime]",
                "span[class*=date]",
                "time"
            )));
            out.put("category", new ArrayList<>(List.of(
                "[data-qa=vacancy-category]",
                ".job-category",
                ".category",
                "meta[name=category]"
            )));
            out.put("description", new ArrayList<>(List.of(
                "[data-qa=vacancy-description]",
                ".job-description",
                ".vacancy-description",
                ".description",
                "div[class*=description]",
                "main",
                "article"
            )));
            return out;
        }
    }

    public static class Output {
        private boolean jdbcEnabled = true;
        private String jsonlPath = "";

        public boolean isJdbcEnabled() {
            return jdbcEnabled;
        }

        public void setJdbcEnabled(boolean jdbcEnabled) {
            this.jdbcEnabled = jdbcEnabled;
        }

        public String getJsonlPath() {
            return jsonlPath;
        }

        public void setJsonlPath(String jsonlPath) {
            this.jsonlPath = jsonlPath;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
