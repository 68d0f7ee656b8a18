package io.github.jbellis.lazyjira.config;

import io.github.jbellis.lazyjira.api.RateLimiter;
import io.github.jbellis.lazyjira.api.RetryConfig;
import io.github.jbellis.lazyjira.api.SearchApiVersion;
import java.time.Duration;

/**
 * Fully merged runtime configuration. Built by {@link ConfigLoader}; {@link #builder()} starts from the defaults.
 */
public record LazyJiraConfig(
        String instance,
        String username,
        String apiToken,
        String authType,
        SearchApiVersion searchApi,
        String defaultJql,
        int pageSize,
        int maxTokens,
        Duration refillInterval,
        int tokensPerRefill,
        RetryConfig retryConfig,
        Duration rateLimitPenalty,
        Duration requestTimeout) {

    public static final String AUTH_API_TOKEN = "api-token";
    public static final String DEFAULT_JQL = "assignee = currentUser() ORDER BY updated DESC";
    public static final int DEFAULT_PAGE_SIZE = 50;

    /** REST v3 root for the configured Cloud instance. */
    public String baseUrl() {
        return "https://" + instance + "/rest/api/3";
    }

    public RateLimiter newRateLimiter() {
        return new RateLimiter(maxTokens, refillInterval, tokensPerRefill);
    }

    /** Redacts the API token. */
    @Override
    public String toString() {
        return "LazyJiraConfig[instance=%s, username=%s, apiToken=%s, authType=%s, searchApi=%s, pageSize=%d]"
                .formatted(
                        instance,
                        username,
                        apiToken.isEmpty() ? "<unset>" : "<redacted>",
                        authType,
                        searchApi,
                        pageSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var b = new Builder();
        b.instance = instance;
        b.username = username;
        b.apiToken = apiToken;
        b.authType = authType;
        b.searchApi = searchApi;
        b.defaultJql = defaultJql;
        b.pageSize = pageSize;
        b.maxTokens = maxTokens;
        b.refillInterval = refillInterval;
        b.tokensPerRefill = tokensPerRefill;
        b.retryConfig = retryConfig;
        b.rateLimitPenalty = rateLimitPenalty;
        b.requestTimeout = requestTimeout;
        return b;
    }

    public static final class Builder {
        private String instance = "";
        private String username = "";
        private String apiToken = "";
        private String authType = AUTH_API_TOKEN;
        private SearchApiVersion searchApi = SearchApiVersion.JQL;
        private String defaultJql = DEFAULT_JQL;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private int maxTokens = 100;
        private Duration refillInterval = Duration.ofSeconds(60);
        private int tokensPerRefill = 100;
        private RetryConfig retryConfig = RetryConfig.DEFAULT;
        private Duration rateLimitPenalty = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(30);

        private Builder() {}

        public Builder instance(String instance) {
            this.instance = instance.trim();
            return this;
        }

        public Builder username(String username) {
            this.username = username.trim();
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken.trim();
            return this;
        }

        public Builder authType(String authType) {
            this.authType = authType.trim();
            return this;
        }

        public Builder searchApi(SearchApiVersion searchApi) {
            this.searchApi = searchApi;
            return this;
        }

        public Builder defaultJql(String defaultJql) {
            this.defaultJql = defaultJql;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder refillInterval(Duration refillInterval) {
            this.refillInterval = refillInterval;
            return this;
        }

        public Builder tokensPerRefill(int tokensPerRefill) {
            this.tokensPerRefill = tokensPerRefill;
            return this;
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }

        public Builder rateLimitPenalty(Duration rateLimitPenalty) {
            this.rateLimitPenalty = rateLimitPenalty;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public LazyJiraConfig build() {
            return new LazyJiraConfig(
                    instance,
                    username,
                    apiToken,
                    authType,
                    searchApi,
                    defaultJql,
                    pageSize,
                    maxTokens,
                    refillInterval,
                    tokensPerRefill,
                    retryConfig,
                    rateLimitPenalty,
                    requestTimeout);
        }
    }
}
