package com.carelog.chatwoot;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chatwoot API settings. {@code apiToken} belongs in the environment
 * ({@code CARELOG_CHATWOOT_API_TOKEN}), not in committed config.
 */
@ConfigurationProperties(prefix = "carelog.chatwoot")
public class ChatwootProperties {

    private String baseUrl = "http://localhost:3000";

    private String apiToken;

    private long accountId = 1;

    /** Upper bound for one send, connect to response. */
    private Duration sendTimeout = Duration.ofSeconds(10);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiToken() { return apiToken; }
    public void setApiToken(String apiToken) { this.apiToken = apiToken; }

    public long getAccountId() { return accountId; }
    public void setAccountId(long accountId) { this.accountId = accountId; }

    public Duration getSendTimeout() { return sendTimeout; }
    public void setSendTimeout(Duration sendTimeout) { this.sendTimeout = sendTimeout; }
}
