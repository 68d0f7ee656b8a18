package io.github.jbellis.lazyjira.api;

import io.github.jbellis.lazyjira.exception.LazyJiraException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Startup probe: one bounded search proves the instance is reachable and the credentials work. */
public final class ConnectionValidator {
    private static final Logger logger = LogManager.getLogger(ConnectionValidator.class);

    /** The current search endpoint rejects unbounded queries, so the probe is restricted to the caller's issues. */
    static final String PROBE_JQL = "assignee = currentUser() ORDER BY updated DESC";

    private ConnectionValidator() {}

    public static ConnectionStatus testConnection(JiraClient client) {
        logger.info("Testing connection to Jira instance...");
        try {
            client.search(PROBE_JQL, 0, 1);
            logger.info("Connection test successful");
            return ConnectionStatus.CONNECTED;
        } catch (LazyJiraException e) {
            logger.warn("Connection test failed: {}", e.getMessage(), e);
            return switch (e.getKind()) {
                case AUTHENTICATION -> ConnectionStatus.AUTHENTICATION_FAILED;
                case NETWORK -> ConnectionStatus.NETWORK_ERROR;
                case CONFIG -> ConnectionStatus.CONFIGURATION_ERROR;
                default -> ConnectionStatus.unknown(e.getMessage());
            };
        }
    }
}
