package io.github.jbellis.lazyjira.model;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Six-level priority. Declaration order is the total order used for sorting (Lowest &lt; ... &lt; Critical).
 */
public enum Priority {
    LOWEST("Lowest"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    HIGHEST("Highest"),
    CRITICAL("Critical");

    private final String displayName;

    Priority(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<Priority> fromName(@Nullable String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (var priority : values()) {
            if (priority.displayName.equals(name)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    /** Jira's stock priority scheme ids. Custom schemes use other ids and fall through to empty. */
    public static Optional<Priority> fromId(@Nullable String id) {
        if (id == null) {
            return Optional.empty();
        }
        return switch (id) {
            case "1" -> Optional.of(LOWEST);
            case "2" -> Optional.of(LOW);
            case "3" -> Optional.of(MEDIUM);
            case "4" -> Optional.of(HIGH);
            case "5" -> Optional.of(HIGHEST);
            default -> Optional.empty();
        };
    }
}
