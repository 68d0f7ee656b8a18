package io.github.jbellis.lazyjira.exception;

import org.jetbrains.annotations.Nullable;

public class LazyJiraException extends Exception {
    public enum Kind {
        NETWORK,
        AUTHENTICATION,
        VALIDATION,
        API,
        CONFIG,
        PARSE,
        INTERNAL,
        IO
    }

    private final Kind kind;
    private final @Nullable Integer statusCode;
    private final @Nullable String field;

    public LazyJiraException(Kind kind, String message) {
        this(kind, message, null, null, null);
    }

    public LazyJiraException(Kind kind, String message, @Nullable Throwable cause) {
        this(kind, message, null, null, cause);
    }

    private LazyJiraException(
            Kind kind,
            String message,
            @Nullable Integer statusCode,
            @Nullable String field,
            @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.field = field;
    }

    public static LazyJiraException network(String message, Throwable cause) {
        return new LazyJiraException(Kind.NETWORK, "Network error: " + message, cause);
    }

    public static LazyJiraException authentication(String message) {
        return new LazyJiraException(Kind.AUTHENTICATION, "Authentication error: " + message);
    }

    public static LazyJiraException validation(String message) {
        return new LazyJiraException(Kind.VALIDATION, "Validation error: " + message);
    }

    /** Non-2xx response. The message always carries the status so logs and UI show it. */
    public static LazyJiraException api(int statusCode, String body) {
        return new LazyJiraException(
                Kind.API, "API error (%d): %s".formatted(statusCode, body), statusCode, null, null);
    }

    public static LazyJiraException config(String message) {
        return new LazyJiraException(Kind.CONFIG, "Configuration error: " + message);
    }

    public static LazyJiraException parse(String field, String message) {
        return new LazyJiraException(Kind.PARSE, "Parse error: " + message, null, field, null);
    }

    public static LazyJiraException parse(String field, String message, Throwable cause) {
        return new LazyJiraException(Kind.PARSE, "Parse error: " + message, null, field, cause);
    }

    public static LazyJiraException internal(String message) {
        return new LazyJiraException(Kind.INTERNAL, "Internal error: " + message);
    }

    public static LazyJiraException io(String message, Throwable cause) {
        return new LazyJiraException(Kind.IO, "IO error: " + message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /** HTTP status for {@link Kind#API} errors, null otherwise. */
    public @Nullable Integer getStatusCode() {
        return statusCode;
    }

    /** Name of the offending JSON field for {@link Kind#PARSE} errors, when known. */
    public @Nullable String getField() {
        return field;
    }

    /**
     * Whether a later attempt could plausibly succeed: transport and IO failures, 429 and 5xx responses.
     */
    public boolean isRetryable() {
        return switch (kind) {
            case NETWORK, IO -> true;
            case API -> statusCode != null && (statusCode == 429 || (statusCode >= 500 && statusCode <= 599));
            case AUTHENTICATION, VALIDATION, CONFIG, PARSE, INTERNAL -> false;
        };
    }
}
