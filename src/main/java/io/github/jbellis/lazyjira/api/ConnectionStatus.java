package io.github.jbellis.lazyjira.api;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Outcome of the startup connectivity probe. {@code detail} is set only for {@link State#UNKNOWN_ERROR}. */
public record ConnectionStatus(State state, @Nullable String detail) {

    public enum State {
        CONNECTED,
        AUTHENTICATION_FAILED,
        NETWORK_ERROR,
        CONFIGURATION_ERROR,
        UNKNOWN_ERROR
    }

    public static final ConnectionStatus CONNECTED = new ConnectionStatus(State.CONNECTED, null);
    public static final ConnectionStatus AUTHENTICATION_FAILED =
            new ConnectionStatus(State.AUTHENTICATION_FAILED, null);
    public static final ConnectionStatus NETWORK_ERROR = new ConnectionStatus(State.NETWORK_ERROR, null);
    public static final ConnectionStatus CONFIGURATION_ERROR = new ConnectionStatus(State.CONFIGURATION_ERROR, null);

    public static ConnectionStatus unknown(String detail) {
        return new ConnectionStatus(State.UNKNOWN_ERROR, detail);
    }

    public boolean isConnected() {
        return state == State.CONNECTED;
    }

    /** User-facing explanation; empty when connected. */
    public Optional<String> errorMessage() {
        return switch (state) {
            case CONNECTED -> Optional.empty();
            case AUTHENTICATION_FAILED -> Optional.of("Authentication failed. Please check your credentials.");
            case NETWORK_ERROR -> Optional.of("Network error. Please check your internet connection.");
            case CONFIGURATION_ERROR -> Optional.of("Configuration error. Please check your jira-cli config.");
            case UNKNOWN_ERROR -> Optional.of(detail == null ? "Unknown error" : detail);
        };
    }
}
