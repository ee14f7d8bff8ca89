package com.linlay.agentruntime.json;

import java.util.List;

/**
 * Aggregated schema violations for one value. Each violation is rendered as {@code path: message}.
 */
public class SchemaValidationException extends RuntimeException {

    private final List<String> violations;

    public SchemaValidationException(List<String> violations) {
        super("validation failed: " + String.join("; ", violations == null ? List.of() : violations));
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public List<String> violations() {
        return violations;
    }
}
