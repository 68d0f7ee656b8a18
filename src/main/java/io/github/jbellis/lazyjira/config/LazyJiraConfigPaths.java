package io.github.jbellis.lazyjira.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves where LazyJira and jira-cli keep their configuration.
 *
 * <p>LazyJira's own directory is platform-appropriate:
 * - Windows: %APPDATA%/LazyJira (fallback: ~/AppData/Roaming/LazyJira)
 * - macOS: ~/Library/Application Support/LazyJira
 * - Linux: $XDG_CONFIG_HOME/LazyJira (fallback: ~/.config/LazyJira)
 *
 * <p>jira-cli always uses {@code ~/.config/jira-cli/config.yaml} (honouring $XDG_CONFIG_HOME), on every platform.
 */
public final class LazyJiraConfigPaths {
    private static final Logger logger = LogManager.getLogger(LazyJiraConfigPaths.class);

    public static final String PROPERTIES_FILE = "lazyjira.properties";

    private LazyJiraConfigPaths() {}

    public static Path getConfigDir() {
        return getConfigDir(Optional.empty());
    }

    /** @param configDirOverride optional override for the config directory (for testing) */
    static Path getConfigDir(Optional<String> configDirOverride) {
        return configDirOverride
                .filter(s -> !s.isBlank())
                .flatMap(override -> {
                    try {
                        return Optional.of(Path.of(override));
                    } catch (InvalidPathException e) {
                        logger.warn("Invalid override for config dir='{}': {}", override, e.getMessage());
                        return Optional.empty();
                    }
                })
                .orElseGet(() -> {
                    var os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
                    if (os.contains("win")) {
                        var appData = System.getenv("APPDATA");
                        Path base = (appData != null && !appData.isBlank())
                                ? Path.of(appData)
                                : Path.of(System.getProperty("user.home"), "AppData", "Roaming");
                        return base.resolve("LazyJira");
                    } else if (os.contains("mac")) {
                        return Path.of(System.getProperty("user.home"), "Library", "Application Support", "LazyJira");
                    } else {
                        return xdgConfigHome().resolve("LazyJira");
                    }
                });
    }

    public static Path getPropertiesFile() {
        return getConfigDir().resolve(PROPERTIES_FILE);
    }

    public static Path getJiraCliConfigFile() {
        return xdgConfigHome().resolve("jira-cli").resolve("config.yaml");
    }

    private static Path xdgConfigHome() {
        var xdg = System.getenv("XDG_CONFIG_HOME");
        return (xdg != null && !xdg.isBlank()) ? Path.of(xdg) : Path.of(System.getProperty("user.home"), ".config");
    }
}
