package io.github.jbellis.lazyjira.api;

import io.github.jbellis.lazyjira.exception.LazyJiraException;

/** Caller-input checks run before a request is sent. All failures are VALIDATION errors and are never retried. */
public final class IssueValidators {
    private IssueValidators() {}

    public static void validateInstance(String instance) throws LazyJiraException {
        if (instance.isBlank()) {
            throw LazyJiraException.validation("Instance cannot be empty");
        }
        if (!instance.contains(".")) {
            throw LazyJiraException.validation("Instance must be a valid domain, got '%s'".formatted(instance));
        }
    }

    /** Accepts human keys ({@code PROJECT-NUMBER}) and numeric issue ids. */
    public static void validateIssueKey(String key) throws LazyJiraException {
        if (key.isBlank()) {
            throw LazyJiraException.validation("Issue key cannot be empty");
        }
        if (!key.contains("-") && !key.chars().allMatch(Character::isDigit)) {
            throw LazyJiraException.validation("Issue key must be in format PROJECT-NUMBER, got '%s'".formatted(key));
        }
    }

    public static void validateComment(String text) throws LazyJiraException {
        if (text.isBlank()) {
            throw LazyJiraException.validation("Comment cannot be empty");
        }
    }

    public static void validateCreateIssue(CreateIssueData data) throws LazyJiraException {
        if (data.projectKey().isBlank()) {
            throw LazyJiraException.validation("Project key cannot be empty");
        }
        if (data.issueType().isBlank()) {
            throw LazyJiraException.validation("Issue type cannot be empty");
        }
        if (data.summary().isBlank()) {
            throw LazyJiraException.validation("Summary cannot be empty");
        }
    }
}
