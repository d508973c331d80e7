package io.github.drompincen.aigov.runtime.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.error.GitHubApiException;
import io.github.drompincen.aigov.runtime.trust.RepositoryCoordinates;
import io.github.drompincen.aigov.runtime.trust.RepositoryPermissionLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Minimal GitHub REST client. Disabled when {@code aigov.github.token} is empty.
 */
@Component
public class GitHubClient implements RepositoryPermissionLookup, IssueTracker {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final String apiUrl;
    private final String token;

    public GitHubClient(HttpClient httpClient,
                        @Value("${aigov.github.api-url:https://api.github.com}") String apiUrl,
                        @Value("${aigov.github.token:}") String token) {
        this.httpClient = httpClient;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.token = token;
    }

    @Override
    public boolean isAvailable() {
        return token != null && !token.isBlank();
    }

    @Override
    public String permissionFor(String owner, String repo, String username) {
        JsonNode body = get("/repos/" + owner + "/" + repo + "/collaborators/" + encode(username) + "/permission");
        return body.path("permission").asText("none");
    }

    @Override
    public IssueRef createIssue(String repository, String title, String body, List<String> labels) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("title", title);
        payload.put("body", body);
        ArrayNode labelArray = payload.putArray("labels");
        for (String label : labels) labelArray.add(label);
        JsonNode created = send("POST", repoPath(repository) + "/issues", payload);
        IssueRef ref = new IssueRef(created.path("number").asInt(), created.path("html_url").asText(null));
        log.info("Created issue #{} in {}", ref.number(), repository);
        return ref;
    }

    public JsonNode getIssue(String repository, int number) {
        return get(repoPath(repository) + "/issues/" + number);
    }

    public JsonNode getPullRequest(String repository, int number) {
        return get(repoPath(repository) + "/pulls/" + number);
    }

    public JsonNode listPullRequestFiles(String repository, int number) {
        return get(repoPath(repository) + "/pulls/" + number + "/files?per_page=100");
    }

    public JsonNode addIssueComment(String repository, int number, String body) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("body", body);
        return send("POST", repoPath(repository) + "/issues/" + number + "/comments", payload);
    }

    public JsonNode addLabels(String repository, int number, List<String> labels) {
        ObjectNode payload = MAPPER.createObjectNode();
        ArrayNode labelArray = payload.putArray("labels");
        for (String label : labels) labelArray.add(label);
        return send("POST", repoPath(repository) + "/issues/" + number + "/labels", payload);
    }

    public JsonNode closeIssue(String repository, int number, String reason) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("state", "closed");
        if (reason != null) payload.put("state_reason", reason);
        return send("PATCH", repoPath(repository) + "/issues/" + number, payload);
    }

    public JsonNode createReview(String repository, int number, String event, String body) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("event", event);
        if (body != null) payload.put("body", body);
        return send("POST", repoPath(repository) + "/pulls/" + number + "/reviews", payload);
    }

    public JsonNode mergePullRequest(String repository, int number, String method, String commitTitle) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("merge_method", method != null ? method : "squash");
        if (commitTitle != null) payload.put("commit_title", commitTitle);
        return send("PUT", repoPath(repository) + "/pulls/" + number + "/merge", payload);
    }

    private JsonNode get(String path) {
        return exchange(builder(path).GET().build());
    }

    private JsonNode send(String method, String path, JsonNode payload) {
        String body;
        try {
            body = MAPPER.writeValueAsString(payload);
        } catch (IOException e) {
            throw new GitHubApiException("Failed to serialize request for " + path, e);
        }
        return exchange(builder(path)
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body))
                .build());
    }

    private HttpRequest.Builder builder(String path) {
        if (!isAvailable()) {
            throw new GitHubApiException("GitHub token not configured (aigov.github.token)", null);
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/vnd.github+json")
                .header("Authorization", "Bearer " + token)
                .header("X-GitHub-Api-Version", "2022-11-28");
    }

    private JsonNode exchange(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GitHubApiException("GitHub request failed: " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException("Interrupted calling " + request.uri(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new GitHubApiException(response.statusCode(), truncate(response.body()));
        }
        String body = response.body();
        if (body == null || body.isBlank()) return MAPPER.createObjectNode();
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            throw new GitHubApiException("Unparseable GitHub response from " + request.uri(), e);
        }
    }

    private static String repoPath(String repository) {
        RepositoryCoordinates coordinates = RepositoryCoordinates.parse(repository)
                .orElseThrow(() -> new GitHubApiException("Not an owner/repo repository: " + repository, null));
        return "/repos/" + coordinates.owner() + "/" + coordinates.repo();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() > 500 ? body.substring(0, 500) : body;
    }
}
