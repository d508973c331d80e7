package io.github.drompincen.aigov.runtime.github;

import java.util.List;

/**
 * Issue-creation capability behind the {@code send} notification tool.
 */
public interface IssueTracker {

    boolean isAvailable();

    IssueRef createIssue(String repository, String title, String body, List<String> labels);
}
