package com.delta.newsdiscovery.config;

import com.delta.newsdiscovery.crawl.model.SourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private static final String DEFAULT_USER_AGENT = "delta-news-discovery/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private boolean resume = true;
    private boolean concurrentSources;
    private String outputFile = "data/jobs.ndjson";
    private Cli cli = new Cli();
    private List<Source> sources = new ArrayList<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public boolean isResume() {
        return resume;
    }

    public void setResume(boolean resume) {
        this.resume = resume;
    }

    public boolean isConcurrentSources() {
        return concurrentSources;
    }

    public void setConcurrentSources(boolean concurrentSources) {
        this.concurrentSources = concurrentSources;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Cli {
        private boolean run;
        private String sources = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources == null ? "" : sources;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    /**
     * One configured source. {@code maxPages} / {@code maxEmptyPages}: unset keeps the variant default,
     * a negative value removes the limit, zero is used as is.
     */
    public static class Source {
        private String name;
        private SourceType type = SourceType.CATEGORY;
        private String site;
        private String variant;
        private String catalogFile;
        private List<String> categories = new ArrayList<>();
        private Integer maxPages;
        private Integer maxEmptyPages;
        private boolean includeLandingPage = true;
        private String extractor = "ANCHOR";
        private String baseUrl;
        private String articleUrlPattern;
        private String timelineUrlTemplate;
        private String bulkFile;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public SourceType getType() {
            return type;
        }

        public void setType(SourceType type) {
            this.type = type == null ? SourceType.CATEGORY : type;
        }

        public String getSite() {
            return site == null || site.isBlank() ? name : site;
        }

        public void setSite(String site) {
            this.site = site;
        }

        public String getVariant() {
            return variant;
        }

        public void setVariant(String variant) {
            this.variant = variant;
        }

        public String getCatalogFile() {
            return catalogFile;
        }

        public void setCatalogFile(String catalogFile) {
            this.catalogFile = catalogFile;
        }

        public List<String> getCategories() {
            return categories;
        }

        public void setCategories(List<String> categories) {
            this.categories = categories == null ? new ArrayList<>() : categories;
        }

        public Integer getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages;
        }

        public Integer getMaxEmptyPages() {
            return maxEmptyPages;
        }

        public void setMaxEmptyPages(Integer maxEmptyPages) {
            this.maxEmptyPages = maxEmptyPages;
        }

        public boolean isIncludeLandingPage() {
            return includeLandingPage;
        }

        public void setIncludeLandingPage(boolean includeLandingPage) {
            this.includeLandingPage = includeLandingPage;
        }

        public String getExtractor() {
            return extractor;
        }

        public void setExtractor(String extractor) {
            this.extractor = extractor;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getArticleUrlPattern() {
            return articleUrlPattern;
        }

        public void setArticleUrlPattern(String articleUrlPattern) {
            this.articleUrlPattern = articleUrlPattern;
        }

        public String getTimelineUrlTemplate() {
            return timelineUrlTemplate;
        }

        public void setTimelineUrlTemplate(String timelineUrlTemplate) {
            this.timelineUrlTemplate = timelineUrlTemplate;
        }

        public String getBulkFile() {
            return bulkFile;
        }

        public void setBulkFile(String bulkFile) {
            this.bulkFile = bulkFile;
        }
    }
}
