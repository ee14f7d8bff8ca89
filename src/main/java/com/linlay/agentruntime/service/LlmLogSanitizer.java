package com.linlay.agentruntime.service;

import java.util.regex.Pattern;

/**
 * Masks credentials in request bodies and raw chunks before they reach the log.
 */
public final class LlmLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|refresh[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final int MAX_LOGGED_LENGTH = 2_000;

    private LlmLogSanitizer() {
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        return BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
    }

    public static String abbreviate(String text) {
        if (text == null || text.length() <= MAX_LOGGED_LENGTH) {
            return text == null ? "" : text;
        }
        return text.substring(0, MAX_LOGGED_LENGTH) + "...(" + (text.length() - MAX_LOGGED_LENGTH) + " more chars)";
    }
}
