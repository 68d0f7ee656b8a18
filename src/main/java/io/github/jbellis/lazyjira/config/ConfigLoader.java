package io.github.jbellis.lazyjira.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.jbellis.lazyjira.api.RetryConfig;
import io.github.jbellis.lazyjira.api.SearchApiVersion;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Merges configuration sources, lowest precedence first: built-in defaults, the jira-cli YAML file,
 * {@code lazyjira.properties}, the {@code JIRA_*} environment variables, then command-line overrides.
 */
public final class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);

    public static final String ENV_INSTANCE = "JIRA_INSTANCE";
    public static final String ENV_USERNAME = "JIRA_USERNAME";
    public static final String ENV_API_TOKEN = "JIRA_API_TOKEN";

    /** Command-line values; null means "not given". */
    public record Overrides(
            @Nullable String instance,
            @Nullable String username,
            @Nullable String jql,
            boolean legacySearch,
            @Nullable Path jiraCliConfig) {

        public static final Overrides NONE = new Overrides(null, null, null, false, null);
    }

    private final Path jiraCliConfigFile;
    private final Path propertiesFile;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(LazyJiraConfigPaths.getJiraCliConfigFile(), LazyJiraConfigPaths.getPropertiesFile(), System.getenv());
    }

    public ConfigLoader(Path jiraCliConfigFile, Path propertiesFile, Map<String, String> environment) {
        this.jiraCliConfigFile = jiraCliConfigFile;
        this.propertiesFile = propertiesFile;
        this.environment = environment;
    }

    public LazyJiraConfig load(Overrides overrides) throws LazyJiraException {
        var builder = LazyJiraConfig.builder();

        var yamlFile = overrides.jiraCliConfig() != null ? overrides.jiraCliConfig() : jiraCliConfigFile;
        if (overrides.jiraCliConfig() != null && !Files.exists(yamlFile)) {
            throw LazyJiraException.config("Config file not found: " + yamlFile);
        }
        applyJiraCliConfig(yamlFile, builder);
        applyProperties(propertiesFile, builder);
        applyEnvironment(environment, builder);

        if (overrides.instance() != null) {
            builder.instance(normalizeInstance(overrides.instance()));
        }
        if (overrides.username() != null) {
            builder.username(overrides.username());
        }
        if (overrides.jql() != null && !overrides.jql().isBlank()) {
            builder.defaultJql(overrides.jql());
        }
        if (overrides.legacySearch()) {
            builder.searchApi(SearchApiVersion.LEGACY);
        }

        var config = builder.build();
        logger.debug("Loaded configuration: {}", config);
        return config;
    }

    /**
     * jira-cli's file: {@code instance}, {@code auth.type}, {@code auth.username}, {@code auth.token}. Missing file is
     * not an error; an unreadable one is.
     */
    static void applyJiraCliConfig(Path file, LazyJiraConfig.Builder builder) throws LazyJiraException {
        if (!Files.isRegularFile(file)) {
            logger.debug("No jira-cli config at {}", file);
            return;
        }
        JsonNode root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = new ObjectMapper(new YAMLFactory()).readTree(reader);
        } catch (IOException e) {
            throw LazyJiraException.config("Failed to parse jira-cli config %s: %s".formatted(file, e.getMessage()));
        }
        if (root == null || !root.isObject()) {
            logger.warn("jira-cli config {} is empty or not a mapping, ignoring", file);
            return;
        }

        var instance = textOrNull(root, "instance");
        if (instance == null) {
            // jira-cli itself writes the full URL under "server"
            instance = textOrNull(root, "server");
        }
        if (instance != null) {
            builder.instance(normalizeInstance(instance));
        }
        var auth = root.path("auth");
        var authType = textOrNull(auth, "type");
        if (authType != null) {
            builder.authType(authType);
        }
        var username = textOrNull(auth, "username");
        if (username == null) {
            username = textOrNull(root, "login");
        }
        if (username != null) {
            builder.username(username);
        }
        var token = textOrNull(auth, "token");
        if (token != null) {
            builder.apiToken(token);
        }
        logger.debug("Applied jira-cli config from {}", file);
    }

    static void applyProperties(Path file, LazyJiraConfig.Builder builder) throws LazyJiraException {
        if (!Files.isRegularFile(file)) {
            return;
        }
        var props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw LazyJiraException.config("Failed to read %s: %s".formatted(file, e.getMessage()));
        }

        try {
            ifPresent(props, "jira.instance", v -> builder.instance(normalizeInstance(v)));
            ifPresent(props, "jira.username", builder::username);
            ifPresent(props, "jira.apiToken", builder::apiToken);
            ifPresent(props, "jira.authType", builder::authType);
            ifPresent(props, "search.api", v -> builder.searchApi(SearchApiVersion.fromConfigValue(v)));
            ifPresent(props, "search.defaultJql", builder::defaultJql);
            ifPresent(props, "search.pageSize", v -> builder.pageSize(Integer.parseInt(v.trim())));
            ifPresent(props, "rateLimit.maxTokens", v -> builder.maxTokens(Integer.parseInt(v.trim())));
            ifPresent(props, "rateLimit.tokensPerRefill", v -> builder.tokensPerRefill(Integer.parseInt(v.trim())));
            ifPresent(
                    props,
                    "rateLimit.refillSeconds",
                    v -> builder.refillInterval(Duration.ofSeconds(Long.parseLong(v.trim()))));
            ifPresent(
                    props,
                    "rateLimit.penaltyMillis",
                    v -> builder.rateLimitPenalty(Duration.ofMillis(Long.parseLong(v.trim()))));
            ifPresent(
                    props,
                    "http.timeoutSeconds",
                    v -> builder.requestTimeout(Duration.ofSeconds(Long.parseLong(v.trim()))));
            builder.retryConfig(retryConfig(props));
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw LazyJiraException.config("Invalid value in %s: %s".formatted(file, e.getMessage()));
        }
        logger.debug("Applied properties from {}", file);
    }

    private static RetryConfig retryConfig(Properties props) {
        var defaults = RetryConfig.DEFAULT;
        return new RetryConfig(
                intProperty(props, "retry.maxRetries", defaults.maxRetries()),
                Duration.ofMillis(longProperty(props, "retry.initialDelayMillis", defaults.initialDelay().toMillis())),
                Duration.ofMillis(longProperty(props, "retry.maxDelayMillis", defaults.maxDelay().toMillis())),
                doubleProperty(props, "retry.backoffMultiplier", defaults.backoffMultiplier()));
    }

    static void applyEnvironment(Map<String, String> env, LazyJiraConfig.Builder builder) {
        var instance = env.get(ENV_INSTANCE);
        if (instance != null && !instance.isBlank()) {
            builder.instance(normalizeInstance(instance));
        }
        var username = env.get(ENV_USERNAME);
        if (username != null && !username.isBlank()) {
            builder.username(username);
        }
        var token = env.get(ENV_API_TOKEN);
        if (token != null && !token.isBlank()) {
            builder.apiToken(token);
        }
    }

    /**
     * Rejects configurations that cannot possibly connect: empty or non-domain instance, empty username, missing
     * token for api-token auth, and rate-limit or timeout settings the client cannot be built with.
     */
    public static void validate(LazyJiraConfig config) throws LazyJiraException {
        if (config.instance().isEmpty()) {
            throw LazyJiraException.config("Jira instance URL is empty");
        }
        if (!config.instance().contains(".")) {
            throw LazyJiraException.config("Jira instance must be a domain, got '%s'".formatted(config.instance()));
        }
        if (config.username().isEmpty()) {
            throw LazyJiraException.config("Username is empty");
        }
        if (LazyJiraConfig.AUTH_API_TOKEN.equals(config.authType()) && config.apiToken().isEmpty()) {
            throw LazyJiraException.config("API token is required for api-token authentication");
        }
        if (config.pageSize() <= 0) {
            throw LazyJiraException.config("Page size must be positive, got " + config.pageSize());
        }
        if (config.maxTokens() <= 0) {
            throw LazyJiraException.config("rateLimit.maxTokens must be positive, got " + config.maxTokens());
        }
        if (config.tokensPerRefill() <= 0) {
            throw LazyJiraException.config(
                    "rateLimit.tokensPerRefill must be positive, got " + config.tokensPerRefill());
        }
        if (!isPositive(config.refillInterval())) {
            throw LazyJiraException.config("rateLimit.refillSeconds must be positive, got " + config.refillInterval());
        }
        if (config.rateLimitPenalty().isNegative()) {
            throw LazyJiraException.config(
                    "rateLimit.penaltyMillis must not be negative, got " + config.rateLimitPenalty());
        }
        if (!isPositive(config.requestTimeout())) {
            throw LazyJiraException.config("http.timeoutSeconds must be positive, got " + config.requestTimeout());
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isZero() && !duration.isNegative();
    }

    /** Strips scheme and trailing slashes so both {@code host} and {@code https://host/} are accepted. */
    static String normalizeInstance(String raw) {
        var instance = raw.trim();
        int scheme = instance.indexOf("://");
        if (scheme >= 0) {
            instance = instance.substring(scheme + 3);
        }
        while (instance.endsWith("/")) {
            instance = instance.substring(0, instance.length() - 1);
        }
        return instance;
    }

    private static void ifPresent(Properties props, String key, Consumer<String> action) {
        var value = props.getProperty(key);
        if (value != null && !value.isBlank()) {
            action.accept(value);
        }
    }

    private static int intProperty(Properties props, String key, int fallback) {
        var value = props.getProperty(key);
        return value == null || value.isBlank() ? fallback : Integer.parseInt(value.trim());
    }

    private static long longProperty(Properties props, String key, long fallback) {
        var value = props.getProperty(key);
        return value == null || value.isBlank() ? fallback : Long.parseLong(value.trim());
    }

    private static double doubleProperty(Properties props, String key, double fallback) {
        var value = props.getProperty(key);
        return value == null || value.isBlank() ? fallback : Double.parseDouble(value.trim());
    }

    private static @Nullable String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
