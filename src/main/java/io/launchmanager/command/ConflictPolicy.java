package io.launchmanager.command;

import java.util.Locale;

/**
 * What {@link CommandRegistry#register} does when a name is already taken.
 */
public enum ConflictPolicy {
    OVERRIDE,
    REJECT;

    public static ConflictPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return OVERRIDE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "reject", "fail", "error" -> REJECT;
            default -> OVERRIDE;
        };
    }
}
