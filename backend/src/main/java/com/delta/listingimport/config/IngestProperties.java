package com.delta.listingimport.config;

import com.delta.listingimport.ingest.external.QuotaPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
    private static final String DEFAULT_USER_AGENT = "listing-import/0.1 (+contact)";

    private Http http = new Http();
    private Parser parser = new Parser();
    private Batch batch = new Batch();
    private ExternalApi externalApi = new ExternalApi();
    private Retry retry = new Retry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Quota quota = new Quota();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Parser getParser() {
        return parser;
    }

    public void setParser(Parser parser) {
        this.parser = parser;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public ExternalApi getExternalApi() {
        return externalApi;
    }

    public void setExternalApi(ExternalApi externalApi) {
        this.externalApi = externalApi;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public Quota getQuota() {
        return quota;
    }

    public void setQuota(Quota quota) {
        this.quota = quota;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Http {
        private String userAgent;
        private int globalConcurrency = 4;
        private int requestTimeoutSeconds = 20;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
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
    }

    public static class Parser {
        private long minRequestDelayMs = 2000;
        private int navigationTimeoutSeconds = 60;
        private int readyTimeoutSeconds = 15;
        private boolean simulateHumanBehavior = true;

        public long getMinRequestDelayMs() {
            return Math.max(0, minRequestDelayMs);
        }

        public void setMinRequestDelayMs(long minRequestDelayMs) {
            this.minRequestDelayMs = Math.max(0, minRequestDelayMs);
        }

        public int getNavigationTimeoutSeconds() {
            return Math.max(1, navigationTimeoutSeconds);
        }

        public void setNavigationTimeoutSeconds(int navigationTimeoutSeconds) {
            this.navigationTimeoutSeconds = navigationTimeoutSeconds;
        }

        public int getReadyTimeoutSeconds() {
            return Math.max(1, readyTimeoutSeconds);
        }

        public void setReadyTimeoutSeconds(int readyTimeoutSeconds) {
            this.readyTimeoutSeconds = readyTimeoutSeconds;
        }

        public boolean isSimulateHumanBehavior() {
            return simulateHumanBehavior;
        }

        public void setSimulateHumanBehavior(boolean simulateHumanBehavior) {
            this.simulateHumanBehavior = simulateHumanBehavior;
        }
    }

    public static class Batch {
        private long interItemDelayMs = 1000;
        private long fullPassDelayMs = 2000;
        private int backgroundConcurrency = 2;

        public long getInterItemDelayMs() {
            return Math.max(0, interItemDelayMs);
        }

        public void setInterItemDelayMs(long interItemDelayMs) {
            this.interItemDelayMs = Math.max(0, interItemDelayMs);
        }

        public long getFullPassDelayMs() {
            return Math.max(0, fullPassDelayMs);
        }

        public void setFullPassDelayMs(long fullPassDelayMs) {
            this.fullPassDelayMs = Math.max(0, fullPassDelayMs);
        }

        public int getBackgroundConcurrency() {
            return Math.max(1, backgroundConcurrency);
        }

        public void setBackgroundConcurrency(int backgroundConcurrency) {
            this.backgroundConcurrency = Math.max(1, backgroundConcurrency);
        }
    }

    public static class ExternalApi {
        private String baseUrl = "https://us-real-estate.p.rapidapi.com";
        private String host = "us-real-estate.p.rapidapi.com";
        private String apiKey;
        private int timeoutSeconds = 10;
        private boolean staleCacheEnabled = true;
        private int staleCacheMaxEntries = 500;
        private int staleCacheTtlMinutes = 30;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                return;
            }
            String trimmed = baseUrl.trim();
            this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            if (host != null && !host.isBlank()) {
                this.host = host.trim();
            }
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? null : apiKey.trim();
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isStaleCacheEnabled() {
            return staleCacheEnabled;
        }

        public void setStaleCacheEnabled(boolean staleCacheEnabled) {
            this.staleCacheEnabled = staleCacheEnabled;
        }

        public int getStaleCacheMaxEntries() {
            return Math.max(1, staleCacheMaxEntries);
        }

        public void setStaleCacheMaxEntries(int staleCacheMaxEntries) {
            this.staleCacheMaxEntries = staleCacheMaxEntries;
        }

        public int getStaleCacheTtlMinutes() {
            return Math.max(1, staleCacheTtlMinutes);
        }

        public void setStaleCacheTtlMinutes(int staleCacheTtlMinutes) {
            this.staleCacheTtlMinutes = staleCacheTtlMinutes;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 10000;
        private double jitterRatio = 0.3;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public long getMaxDelayMs() {
            return Math.max(getBaseDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public double getJitterRatio() {
            return jitterRatio;
        }

        public void setJitterRatio(double jitterRatio) {
            this.jitterRatio = Math.min(1.0, Math.max(0.0, jitterRatio));
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private long openTimeoutMs = 60000;

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public int getSuccessThreshold() {
            return Math.max(1, successThreshold);
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = Math.max(1, successThreshold);
        }

        public long getOpenTimeoutMs() {
            return Math.max(0, openTimeoutMs);
        }

        public void setOpenTimeoutMs(long openTimeoutMs) {
            this.openTimeoutMs = Math.max(0, openTimeoutMs);
        }
    }

    public static class Quota {
        private int monthlyLimit = 500;
        private QuotaPolicy policy = QuotaPolicy.ALL_CALLS;
        private int warnPercent = 75;
        private int criticalPercent = 90;

        public int getMonthlyLimit() {
            return Math.max(0, monthlyLimit);
        }

        public void setMonthlyLimit(int monthlyLimit) {
            this.monthlyLimit = Math.max(0, monthlyLimit);
        }

        public QuotaPolicy getPolicy() {
            return policy;
        }

        public void setPolicy(QuotaPolicy policy) {
            this.policy = policy == null ? QuotaPolicy.ALL_CALLS : policy;
        }

        public int getWarnPercent() {
            return warnPercent;
        }

        public void setWarnPercent(int warnPercent) {
            this.warnPercent = Math.min(100, Math.max(0, warnPercent));
        }

        public int getCriticalPercent() {
            return criticalPercent;
        }

        public void setCriticalPercent(int criticalPercent) {
            this.criticalPercent = Math.min(100, Math.max(0, criticalPercent));
        }
    }
}
