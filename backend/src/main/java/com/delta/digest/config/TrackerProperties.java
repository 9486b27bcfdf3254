package com.delta.digest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; PostDigestTracker/0.1)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private String sourcesFile;
    private List<Source> sources = new ArrayList<>();
    private Job job = new Job();
    private Store store = new Store();
    private Dispatch dispatch = new Dispatch();
    private Security security = new Security();
    private Notification notification = new Notification();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public String getSourcesFile() {
        return sourcesFile;
    }

    public void setSourcesFile(String sourcesFile) {
        this.sourcesFile = sourcesFile;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Security getSecurity() {
        return security;
    }

    public void setSecurity(Security security) {
        this.security = security;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Source {
        private String name;
        private String url;

        public Source() {
        }

        public Source(String name, String url) {
            this.name = name;
            this.url = url;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    public static class Job {
        private int discoveryBatchSize = 3;
        private int fetchBatchSize = 5;
        private int requestDelayMs = 3000;
        private int timeoutMinutes = 30;
        private int minSizeForContent = 1;
        private int maxAgeDays = 7;
        private int recordTtlHours = 24;
        private String zone = "UTC";

        public int getDiscoveryBatchSize() {
            return Math.max(1, discoveryBatchSize);
        }

        public void setDiscoveryBatchSize(int discoveryBatchSize) {
            this.discoveryBatchSize = Math.max(1, discoveryBatchSize);
        }

        public int getFetchBatchSize() {
            return Math.max(1, fetchBatchSize);
        }

        public void setFetchBatchSize(int fetchBatchSize) {
            this.fetchBatchSize = Math.max(1, fetchBatchSize);
        }

        public int getRequestDelayMs() {
            return Math.max(0, requestDelayMs);
        }

        public void setRequestDelayMs(int requestDelayMs) {
            this.requestDelayMs = Math.max(0, requestDelayMs);
        }

        public int getTimeoutMinutes() {
            return Math.max(1, timeoutMinutes);
        }

        public void setTimeoutMinutes(int timeoutMinutes) {
            this.timeoutMinutes = Math.max(1, timeoutMinutes);
        }

        public int getMinSizeForContent() {
            return Math.max(0, minSizeForContent);
        }

        public void setMinSizeForContent(int minSizeForContent) {
            this.minSizeForContent = Math.max(0, minSizeForContent);
        }

        public int getMaxAgeDays() {
            return Math.max(0, maxAgeDays);
        }

        public void setMaxAgeDays(int maxAgeDays) {
            this.maxAgeDays = Math.max(0, maxAgeDays);
        }

        public int getRecordTtlHours() {
            return Math.max(1, recordTtlHours);
        }

        public void setRecordTtlHours(int recordTtlHours) {
            this.recordTtlHours = Math.max(1, recordTtlHours);
        }

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Store {
        private String backend = "memory";

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }
    }

    public static class Dispatch {
        private String mode = "loopback";
        private String baseUrl = "http://localhost:8080";
        private String apiUrl = "https://qstash.upstash.io";
        private String token;
        private int retries = 3;

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiUrl() {
            return stripTrailingSlash(apiUrl);
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public int getRetries() {
            return Math.max(0, retries);
        }

        public void setRetries(int retries) {
            this.retries = Math.max(0, retries);
        }

        private static String stripTrailingSlash(String value) {
            if (value == null) {
                return "";
            }
            String trimmed = value.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            return trimmed;
        }
    }

    public static class Security {
        private String triggerSecret;
        private String currentSigningKey;
        private String nextSigningKey;
        private boolean localBypassEnabled = false;
        private int clockSkewSeconds = 60;

        public String getTriggerSecret() {
            return triggerSecret;
        }

        public void setTriggerSecret(String triggerSecret) {
            this.triggerSecret = triggerSecret;
        }

        public String getCurrentSigningKey() {
            return currentSigningKey;
        }

        public void setCurrentSigningKey(String currentSigningKey) {
            this.currentSigningKey = currentSigningKey;
        }

        public String getNextSigningKey() {
            return nextSigningKey;
        }

        public void setNextSigningKey(String nextSigningKey) {
            this.nextSigningKey = nextSigningKey;
        }

        public boolean isLocalBypassEnabled() {
            return localBypassEnabled;
        }

        public void setLocalBypassEnabled(boolean localBypassEnabled) {
            this.localBypassEnabled = localBypassEnabled;
        }

        public int getClockSkewSeconds() {
            return Math.max(0, clockSkewSeconds);
        }

        public void setClockSkewSeconds(int clockSkewSeconds) {
            this.clockSkewSeconds = Math.max(0, clockSkewSeconds);
        }
    }

    public static class Notification {
        private String apiUrl = "https://api.resend.com";
        private String apiKey;
        private String from = "Post Digest Tracker <onboarding@resend.dev>";
        private List<String> recipients = new ArrayList<>();
        private String subject = "Forum digest";
        private int previewChars = 800;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public List<String> getRecipients() {
            List<String> out = new ArrayList<>();
            if (recipients == null) {
                return out;
            }
            for (String recipient : recipients) {
                if (recipient == null) {
                    continue;
                }
                for (String part : recipient.split(",")) {
                    String trimmed = part.trim();
                    if (!trimmed.isEmpty()) {
                        out.add(trimmed);
                    }
                }
            }
            return out;
        }

        public void setRecipients(List<String> recipients) {
            this.recipients = recipients;
        }

        public String getSubject() {
            return subject;
        }

        public void setSubject(String subject) {
            this.subject = subject;
        }

        public int getPreviewChars() {
            return Math.max(1, previewChars);
        }

        public void setPreviewChars(int previewChars) {
            this.previewChars = Math.max(1, previewChars);
        }
    }
}
