package io.github.jbellis.lazyjira.api;

import io.github.jbellis.lazyjira.config.LazyJiraConfig;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import java.util.concurrent.TimeUnit;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Builds the OkHttp client that carries Jira Cloud credentials on every request. */
public class JiraAuth {
    private static final Logger logger = LogManager.getLogger(JiraAuth.class);
    private final LazyJiraConfig config;

    public JiraAuth(LazyJiraConfig config) {
        this.config = config;
    }

    /** Basic auth header value: base64 of {@code username:token}. */
    public static String basicCredentials(String username, String apiToken) {
        return Credentials.basic(username, apiToken);
    }

    public OkHttpClient buildAuthenticatedClient() throws LazyJiraException {
        if (!LazyJiraConfig.AUTH_API_TOKEN.equals(config.authType())) {
            String errorMessage = "Unsupported auth type '%s'; only '%s' is supported"
                    .formatted(config.authType(), LazyJiraConfig.AUTH_API_TOKEN);
            logger.error(errorMessage);
            throw LazyJiraException.config(errorMessage);
        }
        if (config.apiToken().isBlank()) {
            String errorMessage = "Jira API token not configured. Set JIRA_API_TOKEN or auth.token in the config file.";
            logger.error(errorMessage);
            throw LazyJiraException.config(errorMessage);
        }

        String credentials = basicCredentials(config.username(), config.apiToken());
        long timeoutMillis = config.requestTimeout().toMillis();

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .followRedirects(true);

        builder.addInterceptor(chain -> {
            Request originalRequest = chain.request();
            Request authenticatedRequest = originalRequest.newBuilder()
                    .header("Authorization", credentials)
                    .header("Accept", "application/json")
                    .build();
            return chain.proceed(authenticatedRequest);
        });
        logger.debug("Authenticated OkHttpClient (Basic) created for {} as {}", config.instance(), config.username());
        return builder.build();
    }
}
