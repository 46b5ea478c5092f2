package org.springaicommunity.github.reporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary.
 */
public class GitHubReviewService implements ReviewService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubReviewService.class);

	private static final String MOVED_PERMANENTLY = "Moved Permanently";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final int perPage;

	public GitHubReviewService(GitHubClient httpClient, ObjectMapper objectMapper, int perPage) {
		if (perPage <= 0 || perPage > 100) {
			throw new IllegalArgumentException("perPage must be between 1 and 100 (got: " + perPage + ")");
		}
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.perPage = perPage;
	}

	@Override
	public PullRequestRef getPullRequest(String repoSlug, int number) {
		String response;
		try {
			response = httpClient.get("/repos/" + repoSlug + "/pulls/" + number);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isMoved()) {
				throw new GitHubHttpClient.GitHubApiException(GitHubHttpClient.GitHubApiException.MOVED_MESSAGE,
						e.getStatusCode(), e.getResponseBody());
			}
			throw e;
		}

		JsonNode node = readTree(response, "pull request #" + number);
		if (MOVED_PERMANENTLY.equals(node.path("message").asText(null))) {
			throw new GitHubHttpClient.GitHubApiException(GitHubHttpClient.GitHubApiException.MOVED_MESSAGE, 301,
					response);
		}
		return parsePullRequest(repoSlug, number, node);
	}

	@Override
	public List<ReportComment> getIssueComments(String repoSlug, int number) {
		List<ReportComment> comments = new ArrayList<>();
		int page = 1;
		while (true) {
			String url = String.format("/repos/%s/issues/%d/comments?per_page=%d&page=%d", repoSlug, number, perPage,
					page);
			JsonNode nodes = readTree(httpClient.get(url), "comments of #" + number);
			int pageSize = 0;
			if (nodes.isArray()) {
				for (JsonNode node : nodes) {
					comments.add(parseComment(node));
					pageSize++;
				}
			}
			if (pageSize < perPage) {
				break;
			}
			page++;
		}
		logger.debug("Fetched {} comments for {}#{} ({} pages)", comments.size(), repoSlug, number, page);
		return comments;
	}

	@Override
	public CommentResult createComment(String repoSlug, int number, String body) {
		ObjectNode payload = objectMapper.createObjectNode().put("body", body);
		String response = httpClient.post("/repos/" + repoSlug + "/issues/" + number + "/comments",
				write(payload));
		return parseCommentResult(readTree(response, "created comment"));
	}

	@Override
	public CommentResult updateComment(String repoSlug, long commentId, String body) {
		ObjectNode payload = objectMapper.createObjectNode().put("body", body);
		String response = httpClient.patch("/repos/" + repoSlug + "/issues/comments/" + commentId, write(payload));
		return parseCommentResult(readTree(response, "updated comment " + commentId));
	}

	@Override
	public void deleteComment(String repoSlug, long commentId) {
		httpClient.delete("/repos/" + repoSlug + "/issues/comments/" + commentId);
	}

	@Override
	public void setCommitStatus(String repoSlug, String sha, StatusOutcome status, String context) {
		ObjectNode payload = objectMapper.createObjectNode()
			.put("state", status.state().value())
			.put("description", status.description())
			.put("context", context);
		if (status.targetUrl() != null) {
			payload.put("target_url", status.targetUrl());
		}
		httpClient.post("/repos/" + repoSlug + "/statuses/" + sha, write(payload));
	}

	// ========== JSON Parsing Methods ==========

	private PullRequestRef parsePullRequest(String repoSlug, int number, JsonNode node) {
		JsonNode base = node.path("base");
		return new PullRequestRef(repoSlug, node.path("number").asInt(number),
				node.path("head").path("sha").asText(null), base.path("sha").asText(null),
				RepoVisibility.fromPrivateFlag(base.path("repo").path("private").asBoolean(false)),
				node.path("body").asText(null), node.path("html_url").asText(""));
	}

	private ReportComment parseComment(JsonNode node) {
		JsonNode user = node.path("user");
		Author author = user.isMissingNode() || user.isNull() ? new Author("unknown", null)
				: new Author(user.path("login").asText("unknown"), user.path("name").asText(null));
		return new ReportComment(node.path("id").asLong(), author, node.path("body").asText(""));
	}

	private CommentResult parseCommentResult(JsonNode node) {
		return new CommentResult(node.path("id").asLong(), node.path("html_url").asText(null));
	}

	private JsonNode readTree(String response, String what) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to parse {}: {}", what, e.getMessage());
			throw new GitHubHttpClient.GitHubApiException("Failed to parse " + what, e);
		}
	}

	private String write(ObjectNode payload) {
		try {
			return objectMapper.writeValueAsString(payload);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize request body", e);
		}
	}

}
