package com.onalog.discovery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; OnalogLeadBot/1.0; +https://onalog.com/bot)";

    private String userAgent;
    private int perHostDelayMs = 500;
    private int perHostConcurrency = 2;
    private int globalConcurrency = 8;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 4000;
    private Scheduler scheduler = new Scheduler();
    private Pipeline pipeline = new Pipeline();
    private Search search = new Search();
    private Providers providers = new Providers();
    private Classifier classifier = new Classifier();
    private Results results = new Results();

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

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
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

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Providers getProviders() {
        return providers;
    }

    public void setProviders(Providers providers) {
        this.providers = providers;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Results getResults() {
        return results;
    }

    public void setResults(Results results) {
        this.results = results;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean autoDispatch = true;
        private long cooldownMs = 60_000;
        private int creditedPriority = 10;
        private String anonymousTenant = "anonymous";

        public boolean isAutoDispatch() {
            return autoDispatch;
        }

        public void setAutoDispatch(boolean autoDispatch) {
            this.autoDispatch = autoDispatch;
        }

        public long getCooldownMs() {
            return Math.max(0, cooldownMs);
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = Math.max(0, cooldownMs);
        }

        public int getCreditedPriority() {
            return Math.max(0, Math.min(100, creditedPriority));
        }

        public void setCreditedPriority(int creditedPriority) {
            this.creditedPriority = creditedPriority;
        }

        public String getAnonymousTenant() {
            return anonymousTenant == null || anonymousTenant.isBlank() ? "anonymous" : anonymousTenant.trim();
        }

        public void setAnonymousTenant(String anonymousTenant) {
            this.anonymousTenant = anonymousTenant;
        }
    }

    public static class Pipeline {
        private int initialBatchSize = 30;
        private int workerCount = 4;
        private int foregroundDeadlineSeconds = 25;
        private int backgroundMinCandidates = 20;
        private int pauseFailsafeSeconds = 300;
        private int hostLockWaitSeconds = 30;
        private int pageTimeoutSeconds = 20;
        private int maxAuxiliaryPages = 12;
        private int decisionMakerTarget = 5;
        private int maxDecisionMakers = 12;
        private double relevanceRejectConfidence = 0.7;

        public int getInitialBatchSize() {
            return Math.max(1, initialBatchSize);
        }

        public void setInitialBatchSize(int initialBatchSize) {
            this.initialBatchSize = Math.max(1, initialBatchSize);
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getForegroundDeadlineSeconds() {
            return Math.max(1, foregroundDeadlineSeconds);
        }

        public void setForegroundDeadlineSeconds(int foregroundDeadlineSeconds) {
            this.foregroundDeadlineSeconds = Math.max(1, foregroundDeadlineSeconds);
        }

        public int getBackgroundMinCandidates() {
            return Math.max(0, backgroundMinCandidates);
        }

        public void setBackgroundMinCandidates(int backgroundMinCandidates) {
            this.backgroundMinCandidates = Math.max(0, backgroundMinCandidates);
        }

        public int getPauseFailsafeSeconds() {
            return Math.max(1, pauseFailsafeSeconds);
        }

        public void setPauseFailsafeSeconds(int pauseFailsafeSeconds) {
            this.pauseFailsafeSeconds = Math.max(1, pauseFailsafeSeconds);
        }

        public int getHostLockWaitSeconds() {
            return Math.max(1, hostLockWaitSeconds);
        }

        public void setHostLockWaitSeconds(int hostLockWaitSeconds) {
            this.hostLockWaitSeconds = Math.max(1, hostLockWaitSeconds);
        }

        public int getPageTimeoutSeconds() {
            return Math.max(1, pageTimeoutSeconds);
        }

        public void setPageTimeoutSeconds(int pageTimeoutSeconds) {
            this.pageTimeoutSeconds = Math.max(1, pageTimeoutSeconds);
        }

        public int getMaxAuxiliaryPages() {
            return Math.max(0, maxAuxiliaryPages);
        }

        public void setMaxAuxiliaryPages(int maxAuxiliaryPages) {
            this.maxAuxiliaryPages = Math.max(0, maxAuxiliaryPages);
        }

        public int getDecisionMakerTarget() {
            return Math.max(1, decisionMakerTarget);
        }

        public void setDecisionMakerTarget(int decisionMakerTarget) {
            this.decisionMakerTarget = Math.max(1, decisionMakerTarget);
        }

        public int getMaxDecisionMakers() {
            return Math.max(1, maxDecisionMakers);
        }

        public void setMaxDecisionMakers(int maxDecisionMakers) {
            this.maxDecisionMakers = Math.max(1, maxDecisionMakers);
        }

        public double getRelevanceRejectConfidence() {
            return relevanceRejectConfidence;
        }

        public void setRelevanceRejectConfidence(double relevanceRejectConfidence) {
            this.relevanceRejectConfidence = relevanceRejectConfidence;
        }
    }

    public static class Search {
        private int providerTimeoutSeconds = 12;
        private int webSearchTimeoutSeconds = 15;
        private int tierTimeoutSeconds = 45;
        private int maxExpandedTerms = 8;
        private int expansionCacheMinutes = 15;
        private int escalationFloor = 20;
        private double escalationRatio = 0.4;
        private List<Integer> scrapeBackoffSeconds = new ArrayList<>(List.of(30, 60, 120));
        private int directoryCapFloor = 15;
        private int directoryCapCeiling = 50;

        public int getProviderTimeoutSeconds() {
            return Math.max(1, providerTimeoutSeconds);
        }

        public void setProviderTimeoutSeconds(int providerTimeoutSeconds) {
            this.providerTimeoutSeconds = Math.max(1, providerTimeoutSeconds);
        }

        public int getTierTimeoutSeconds() {
            return Math.max(1, tierTimeoutSeconds);
        }

        public void setTierTimeoutSeconds(int tierTimeoutSeconds) {
            this.tierTimeoutSeconds = tierTimeoutSeconds;
        }

        public int getWebSearchTimeoutSeconds() {
            return Math.max(1, webSearchTimeoutSeconds);
        }

        public void setWebSearchTimeoutSeconds(int webSearchTimeoutSeconds) {
            this.webSearchTimeoutSeconds = Math.max(1, webSearchTimeoutSeconds);
        }

        public int getMaxExpandedTerms() {
            return Math.max(1, maxExpandedTerms);
        }

        public void setMaxExpandedTerms(int maxExpandedTerms) {
            this.maxExpandedTerms = Math.max(1, maxExpandedTerms);
        }

        public int getExpansionCacheMinutes() {
            return Math.max(1, expansionCacheMinutes);
        }

        public void setExpansionCacheMinutes(int expansionCacheMinutes) {
            this.expansionCacheMinutes = Math.max(1, expansionCacheMinutes);
        }

        public int getEscalationFloor() {
            return Math.max(0, escalationFloor);
        }

        public void setEscalationFloor(int escalationFloor) {
            this.escalationFloor = Math.max(0, escalationFloor);
        }

        public double getEscalationRatio() {
            return Math.max(0.0, escalationRatio);
        }

        public void setEscalationRatio(double escalationRatio) {
            this.escalationRatio = escalationRatio;
        }

        public List<Integer> getScrapeBackoffSeconds() {
            if (scrapeBackoffSeconds == null || scrapeBackoffSeconds.isEmpty()) {
                return List.of(30, 60, 120);
            }
            return scrapeBackoffSeconds;
        }

        public void setScrapeBackoffSeconds(List<Integer> scrapeBackoffSeconds) {
            this.scrapeBackoffSeconds = scrapeBackoffSeconds;
        }

        public int getDirectoryCapFloor() {
            return Math.max(1, directoryCapFloor);
        }

        public void setDirectoryCapFloor(int directoryCapFloor) {
            this.directoryCapFloor = Math.max(1, directoryCapFloor);
        }

        public int getDirectoryCapCeiling() {
            return Math.max(getDirectoryCapFloor(), directoryCapCeiling);
        }

        public void setDirectoryCapCeiling(int directoryCapCeiling) {
            this.directoryCapCeiling = directoryCapCeiling;
        }
    }

    public static class Providers {
        private List<String> overpassUrls = new ArrayList<>(List.of(
            "https://overpass-api.de/api/interpreter",
            "https://overpass.kumi.systems/api/interpreter"
        ));
        private String nominatimUrl = "https://nominatim.openstreetmap.org/search";
        private List<String> searxngUrls = new ArrayList<>();
        private String bingApiKey;
        private String bingUrl = "https://api.bing.microsoft.com/v7.0/search";
        private String googleCseKey;
        private String googleCseId;
        private String googleCseUrl = "https://www.googleapis.com/customsearch/v1";
        private boolean placesEnabled = true;
        private String placesApiKey;
        private String placesUrl = "https://maps.googleapis.com/maps/api/place/textsearch/json";
        private String duckDuckGoUrl = "https://html.duckduckgo.com/html/";

        public List<String> getOverpassUrls() {
            return overpassUrls == null ? List.of() : overpassUrls;
        }

        public void setOverpassUrls(List<String> overpassUrls) {
            this.overpassUrls = overpassUrls;
        }

        public String getNominatimUrl() {
            return nominatimUrl;
        }

        public void setNominatimUrl(String nominatimUrl) {
            this.nominatimUrl = nominatimUrl;
        }

        public List<String> getSearxngUrls() {
            return searxngUrls == null ? List.of() : searxngUrls;
        }

        public void setSearxngUrls(List<String> searxngUrls) {
            this.searxngUrls = searxngUrls;
        }

        public String getBingApiKey() {
            return bingApiKey;
        }

        public void setBingApiKey(String bingApiKey) {
            this.bingApiKey = bingApiKey;
        }

        public String getBingUrl() {
            return bingUrl;
        }

        public void setBingUrl(String bingUrl) {
            this.bingUrl = bingUrl;
        }

        public String getGoogleCseKey() {
            return googleCseKey;
        }

        public void setGoogleCseKey(String googleCseKey) {
            this.googleCseKey = googleCseKey;
        }

        public String getGoogleCseId() {
            return googleCseId;
        }

        public void setGoogleCseId(String googleCseId) {
            this.googleCseId = googleCseId;
        }

        public String getGoogleCseUrl() {
            return googleCseUrl;
        }

        public void setGoogleCseUrl(String googleCseUrl) {
            this.googleCseUrl = googleCseUrl;
        }

        public boolean isPlacesEnabled() {
            return placesEnabled;
        }

        public void setPlacesEnabled(boolean placesEnabled) {
            this.placesEnabled = placesEnabled;
        }

        public String getPlacesApiKey() {
            return placesApiKey;
        }

        public void setPlacesApiKey(String placesApiKey) {
            this.placesApiKey = placesApiKey;
        }

        public String getPlacesUrl() {
            return placesUrl;
        }

        public void setPlacesUrl(String placesUrl) {
            this.placesUrl = placesUrl;
        }

        public String getDuckDuckGoUrl() {
            return duckDuckGoUrl;
        }

        public void setDuckDuckGoUrl(String duckDuckGoUrl) {
            this.duckDuckGoUrl = duckDuckGoUrl;
        }
    }

    public static class Classifier {
        private int fetchTimeoutSeconds = 8;
        private int cacheMinutes = 10;
        private int rejectThreshold = -3;

        public int getFetchTimeoutSeconds() {
            return Math.max(1, fetchTimeoutSeconds);
        }

        public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
            this.fetchTimeoutSeconds = Math.max(1, fetchTimeoutSeconds);
        }

        public int getCacheMinutes() {
            return Math.max(1, cacheMinutes);
        }

        public void setCacheMinutes(int cacheMinutes) {
            this.cacheMinutes = Math.max(1, cacheMinutes);
        }

        public int getRejectThreshold() {
            return rejectThreshold;
        }

        public void setRejectThreshold(int rejectThreshold) {
            this.rejectThreshold = rejectThreshold;
        }
    }

    public static class Results {
        private int defaultPageSize = 50;
        private int maxPageSize = 200;
        private int previewCap = 10;

        public int getDefaultPageSize() {
            return Math.max(1, defaultPageSize);
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = Math.max(1, defaultPageSize);
        }

        public int getMaxPageSize() {
            return Math.max(getDefaultPageSize(), maxPageSize);
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getPreviewCap() {
            return Math.max(0, previewCap);
        }

        public void setPreviewCap(int previewCap) {
            this.previewCap = Math.max(0, previewCap);
        }
    }
}
