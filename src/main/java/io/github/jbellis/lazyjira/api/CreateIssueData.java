package io.github.jbellis.lazyjira.api;

import org.jetbrains.annotations.Nullable;

/**
 * Input for {@link JiraClient#createIssue}.
 *
 * @param assigneeAccountId account id, not display name
 * @param priority priority name as configured on the server, e.g. "High"
 */
public record CreateIssueData(
        String projectKey,
        String issueType,
        String summary,
        @Nullable String description,
        @Nullable String assigneeAccountId,
        @Nullable String priority) {

    public CreateIssueData(String projectKey, String issueType, String summary) {
        this(projectKey, issueType, summary, null, null, null);
    }
}
