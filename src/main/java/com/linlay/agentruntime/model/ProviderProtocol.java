package com.linlay.agentruntime.model;

import java.util.Locale;

/**
 * Wire protocol spoken by a model provider.
 */
public enum ProviderProtocol {
    OPENAI,
    ANTHROPIC;

    public static ProviderProtocol fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OPENAI;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "OPENAI", "OPENAI_COMPATIBLE" -> OPENAI;
            case "ANTHROPIC" -> ANTHROPIC;
            default -> throw new IllegalArgumentException("Unsupported provider protocol: " + value);
        };
    }
}
