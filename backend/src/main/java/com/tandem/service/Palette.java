package com.tandem.service;

import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Presence colours. Every user colour stays readable under white text. */
final class Palette {

    static final List<String> USER_COLORS = List.of(
        "#e6194b", "#3cb44b", "#4363d8", "#f58231", "#911eb4",
        "#c71585", "#f032e6", "#469990", "#9a6324", "#800000",
        "#808000", "#000075", "#808080", "#d63384", "#0d6efd",
        "#198754", "#6f42c1", "#dc3545", "#0dcaf0", "#fd7e14"
    );

    private static final Map<String, String> AGENT_COLORS = Map.of(
        "cursor", "#A855F7",
        "claude", "#FF6B35",
        "windsurf", "#00D4FF",
        "copilot", "#24292E"
    );

    private static final String DEFAULT_AGENT_COLOR = "#9333EA";

    private Palette() {
    }

    static String agentColor(@Nullable String agentName) {
        if (agentName == null) return DEFAULT_AGENT_COLOR;
        return AGENT_COLORS.getOrDefault(agentName.toLowerCase(Locale.ROOT), DEFAULT_AGENT_COLOR);
    }

    static String userColor(int index) {
        return USER_COLORS.get(Math.floorMod(index, USER_COLORS.size()));
    }
}
