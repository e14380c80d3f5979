package com.tandem.client;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

/**
 * Client-side coordination settings, bound from {@code tandem.client.*}.
 * Windows and intervals are durations ({@code 500ms}, {@code 2s}, ...).
 */
@ConfigurationProperties("tandem.client")
public class ClientConfiguration {

    private String serverUrl = "http://localhost:8080";
    private String storageUrl = "http://localhost:8000";
    private String userId = "anonymous";
    private String username = "Anonymous";

    // ── Transport ───────────────────────────────────────────────────────────
    private Duration reconnectDelay = Duration.ofSeconds(2);
    private Duration maxReconnectDelay = Duration.ofSeconds(10);
    private int maxReconnectAttempts = 3;
    private Duration connectTimeout = Duration.ofSeconds(10);

    // ── Editing ─────────────────────────────────────────────────────────────
    private Duration localEchoWindow = Duration.ofSeconds(2);
    private Duration localEditDebounce = Duration.ofMillis(500);
    private Duration remoteOriginWindow = Duration.ofMillis(100);
    private Duration typingIndicator = Duration.ofSeconds(2);
    private Duration lockHeartbeatInterval = Duration.ofSeconds(120);
    private Duration presenceHeartbeatInterval = Duration.ofSeconds(30);
    private int maxNotificationsPerKind = 5;

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

    public String getStorageUrl() { return storageUrl; }
    public void setStorageUrl(String storageUrl) { this.storageUrl = storageUrl; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public Duration getReconnectDelay() { return reconnectDelay; }
    public void setReconnectDelay(Duration reconnectDelay) { this.reconnectDelay = reconnectDelay; }

    public Duration getMaxReconnectDelay() { return maxReconnectDelay; }
    public void setMaxReconnectDelay(Duration maxReconnectDelay) { this.maxReconnectDelay = maxReconnectDelay; }

    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public void setMaxReconnectAttempts(int maxReconnectAttempts) { this.maxReconnectAttempts = maxReconnectAttempts; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getLocalEchoWindow() { return localEchoWindow; }
    public void setLocalEchoWindow(Duration localEchoWindow) { this.localEchoWindow = localEchoWindow; }

    public Duration getLocalEditDebounce() { return localEditDebounce; }
    public void setLocalEditDebounce(Duration localEditDebounce) { this.localEditDebounce = localEditDebounce; }

    public Duration getRemoteOriginWindow() { return remoteOriginWindow; }
    public void setRemoteOriginWindow(Duration remoteOriginWindow) { this.remoteOriginWindow = remoteOriginWindow; }

    public Duration getTypingIndicator() { return typingIndicator; }
    public void setTypingIndicator(Duration typingIndicator) { this.typingIndicator = typingIndicator; }

    public Duration getLockHeartbeatInterval() { return lockHeartbeatInterval; }
    public void setLockHeartbeatInterval(Duration lockHeartbeatInterval) { this.lockHeartbeatInterval = lockHeartbeatInterval; }

    public Duration getPresenceHeartbeatInterval() { return presenceHeartbeatInterval; }
    public void setPresenceHeartbeatInterval(Duration presenceHeartbeatInterval) {
        this.presenceHeartbeatInterval = presenceHeartbeatInterval;
    }

    public int getMaxNotificationsPerKind() { return maxNotificationsPerKind; }
    public void setMaxNotificationsPerKind(int maxNotificationsPerKind) { this.maxNotificationsPerKind = maxNotificationsPerKind; }
}
