package ai.acsl.injector.config;

import java.util.Locale;

/**
 * Execution mode for the injector CLI.
 */
public enum Mode {
    INJECT,
    COMPARE,
    INSPECT,
    BATCH,
    PROOF_SUMMARY;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return INJECT;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (Mode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
