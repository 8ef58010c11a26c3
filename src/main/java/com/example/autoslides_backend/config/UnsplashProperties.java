package com.example.autoslides_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "images.unsplash")
public class UnsplashProperties {
    private String baseUrl = "https://api.unsplash.com";
    private String accessKey;
    private String userAgent = "autoslides-backend/0.1";
    private long timeoutSeconds = 10;
    private int maxRetries = 3;
    private long retryBackoffMillis = 500;
    private int maxPerPage = 30;
    private String orientation;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getAccessKey() { return accessKey; }
    public void setAccessKey(String accessKey) { this.accessKey = accessKey; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public long getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public long getRetryBackoffMillis() { return retryBackoffMillis; }
    public void setRetryBackoffMillis(long retryBackoffMillis) { this.retryBackoffMillis = retryBackoffMillis; }

    public int getMaxPerPage() { return maxPerPage; }
    public void setMaxPerPage(int maxPerPage) { this.maxPerPage = maxPerPage; }

    /** Optional Unsplash orientation filter: landscape, portrait or squarish. */
    public String getOrientation() { return orientation; }
    public void setOrientation(String orientation) { this.orientation = orientation; }
}
