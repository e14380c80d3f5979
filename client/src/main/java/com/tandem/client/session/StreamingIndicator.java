package com.tandem.client.session;

/** The one "agent is writing" badge shown per resource. */
public record StreamingIndicator(String sessionId, String userId, String agentName, String color) {}
