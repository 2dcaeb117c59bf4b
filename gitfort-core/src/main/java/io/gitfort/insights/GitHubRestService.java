package io.gitfort.insights;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 * Paged endpoints follow the {@code rel="last"} hint of the {@code Link} header when
 * present, enqueueing the remaining pages at once; otherwise pages are requested one by one
 * until a page returns fewer items than the page size.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	static final int PAGE_SIZE = 100;

	private final RequestEngine engine;

	private final ObjectMapper objectMapper;

	public GitHubRestService(RequestEngine engine, ObjectMapper objectMapper) {
		this.engine = engine;
		this.objectMapper = objectMapper;
	}

	@Override
	public RateLimitInfo getRateLimit() {
		JsonNode rate = readTree(engine.execute(GitHubRequest.get("/rate_limit"))).path("rate");
		return new RateLimitInfo(rate.path("limit").asInt(), rate.path("remaining").asInt(),
				rate.path("reset").asLong(), rate.path("used").asInt());
	}

	@Override
	public List<Repository> getRepositories(String username) {
		String path = "/users/" + encode(username) + "/repos?per_page=" + PAGE_SIZE + "&sort=updated";
		return fetchAllPages(path, null, this::parseRepository);
	}

	@Override
	public List<WorkflowRun> getWorkflowRuns(String owner, String repo) {
		return getWorkflowRuns(owner, repo, WorkflowRunQuery.all());
	}

	@Override
	public List<WorkflowRun> getWorkflowRuns(String owner, String repo, WorkflowRunQuery query) {
		String filters = query.toQueryString();
		String path = repoPath(owner, repo) + "/actions/runs?" + (filters.isEmpty() ? "" : filters + "&")
				+ "per_page=" + PAGE_SIZE;
		return fetchAllPages(path, "workflow_runs", this::parseWorkflowRun);
	}

	@Override
	public List<WorkflowJob> getWorkflowRunJobs(String owner, String repo, long runId) {
		String path = repoPath(owner, repo) + "/actions/runs/" + runId + "/jobs?per_page=" + PAGE_SIZE;
		return fetchAllPages(path, "jobs", this::parseJob);
	}

	@Override
	public String getRepositoryContent(String owner, String repo, String path) {
		GitHubResponse response;
		try {
			response = engine.execute(GitHubRequest.get(repoPath(owner, repo) + "/contents/" + encodePath(path)));
		}
		catch (GitHubApiException e) {
			if (e.getStatusCode() == 404) {
				throw new ContentNotFoundException(path);
			}
			throw e;
		}

		JsonNode node = readTree(response);
		String content = JsonNodes.text(node, "content");
		if (!"file".equals(JsonNodes.text(node, "type")) || content == null) {
			throw new ContentNotFoundException(path);
		}
		byte[] decoded = Base64.getMimeDecoder().decode(content);
		return new String(decoded, StandardCharsets.UTF_8);
	}

	@Override
	public List<TreeEntry> getRepositoryTree(String owner, String repo) {
		JsonNode tree = readTree(
				engine.execute(GitHubRequest.get(repoPath(owner, repo) + "/git/trees/HEAD?recursive=1")));
		if (tree.path("truncated").asBoolean(false)) {
			logger.warn("Tree of {}/{} is truncated; only the first {} entries are visible", owner, repo,
					tree.path("tree").size());
		}
		List<TreeEntry> entries = new ArrayList<>();
		for (JsonNode entry : JsonNodes.array(tree.path("tree"))) {
			if ("blob".equals(JsonNodes.text(entry, "type"))) {
				entries.add(new TreeEntry(JsonNodes.text(entry, "path", ""), entry.path("size").asLong(0)));
			}
		}
		return entries;
	}

	// ========== Pagination ==========

	/**
	 * Fetch every page of a list endpoint.
	 * @param basePath path including query parameters and {@code per_page}
	 * @param itemsField field holding the items, or null when the body is the array
	 * @param parser item parser; items it maps to null are skipped
	 */
	<T> List<T> fetchAllPages(String basePath, @Nullable String itemsField, Function<JsonNode, @Nullable T> parser) {
		GitHubResponse first = engine.execute(pageRequest(basePath, 1));
		List<T> items = new ArrayList<>();
		int firstCount = collect(first, itemsField, parser, items);

		OptionalInt lastPage = LinkHeader.lastPage(first.link());
		if (lastPage.isPresent()) {
			fetchRemainingPages(basePath, lastPage.getAsInt(), itemsField, parser, items);
			return items;
		}

		int page = 1;
		int pageCount = firstCount;
		while (pageCount >= PAGE_SIZE) {
			page++;
			pageCount = collect(engine.execute(pageRequest(basePath, page)), itemsField, parser, items);
		}
		return items;
	}

	private <T> void fetchRemainingPages(String basePath, int lastPage, @Nullable String itemsField,
			Function<JsonNode, @Nullable T> parser, List<T> items) {
		logger.debug("Fetching pages 2..{} of {}", lastPage, basePath);
		List<CompletableFuture<GitHubResponse>> pending = new ArrayList<>();
		int page = 2;
		while (page <= lastPage) {
			try {
				pending.add(engine.enqueue(pageRequest(basePath, page)));
				page++;
			}
			catch (QueueFullException e) {
				if (pending.isEmpty()) {
					throw e;
				}
				logger.debug("Queue full at page {}, waiting for {} pending pages", page, pending.size());
				awaitPages(pending, itemsField, parser, items);
			}
		}
		awaitPages(pending, itemsField, parser, items);
	}

	private <T> void awaitPages(List<CompletableFuture<GitHubResponse>> pending, @Nullable String itemsField,
			Function<JsonNode, @Nullable T> parser, List<T> items) {
		for (CompletableFuture<GitHubResponse> future : pending) {
			collect(RequestEngine.await(future), itemsField, parser, items);
		}
		pending.clear();
	}

	private <T> int collect(GitHubResponse response, @Nullable String itemsField,
			Function<JsonNode, @Nullable T> parser, List<T> items) {
		JsonNode root = readTree(response);
		JsonNode array = itemsField != null ? root.path(itemsField) : root;
		List<JsonNode> nodes = JsonNodes.array(array);
		for (JsonNode node : nodes) {
			T item = parser.apply(node);
			if (item != null) {
				items.add(item);
			}
		}
		return nodes.size();
	}

	private static GitHubRequest pageRequest(String basePath, int page) {
		String separator = basePath.contains("?") ? "&" : "?";
		return GitHubRequest.get(basePath + separator + "page=" + page);
	}

	// ========== JSON Parsing Methods ==========

	private JsonNode readTree(GitHubResponse response) {
		try {
			return objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw new GitHubException("Invalid JSON response: " + e.getOriginalMessage(), e);
		}
	}

	private @Nullable Repository parseRepository(JsonNode node) {
		String name = JsonNodes.text(node, "name");
		if (name == null) {
			logger.warn("Skipping repository without name");
			return null;
		}
		return new Repository(node.path("id").asLong(), name, JsonNodes.text(node, "full_name", name),
				JsonNodes.text(node.path("owner"), "login", ""), node.path("private").asBoolean(false),
				node.path("fork").asBoolean(false), JsonNodes.text(node, "language"),
				JsonNodes.text(node, "default_branch"), JsonNodes.instant(node, "updated_at"));
	}

	private WorkflowRun parseWorkflowRun(JsonNode node) {
		String name = JsonNodes.text(node, "name", "");
		return new WorkflowRun(node.path("id").asLong(), name, node.path("workflow_id").asLong(),
				JsonNodes.text(node, "workflow_name", name), JsonNodes.text(node, "head_branch"),
				JsonNodes.text(node, "head_sha"), JsonNodes.text(node, "status", ""), JsonNodes.text(node, "conclusion"),
				JsonNodes.text(node, "event"), JsonNodes.text(node.path("actor"), "login"),
				node.path("run_number").asInt(0), node.path("run_attempt").asInt(1),
				JsonNodes.instant(node, "created_at"), JsonNodes.instant(node, "updated_at"),
				JsonNodes.instant(node, "run_started_at"), JsonNodes.text(node, "html_url"));
	}

	private WorkflowJob parseJob(JsonNode node) {
		List<WorkflowStep> steps = new ArrayList<>();
		for (JsonNode step : JsonNodes.array(node.path("steps"))) {
			steps.add(new WorkflowStep(step.path("number").asInt(), JsonNodes.text(step, "name", ""),
					JsonNodes.text(step, "status", ""), JsonNodes.text(step, "conclusion"),
					JsonNodes.instant(step, "started_at"), JsonNodes.instant(step, "completed_at")));
		}
		return new WorkflowJob(node.path("id").asLong(), node.path("run_id").asLong(), JsonNodes.text(node, "name", ""),
				JsonNodes.text(node, "status", ""), JsonNodes.text(node, "conclusion"),
				JsonNodes.instant(node, "started_at"), JsonNodes.instant(node, "completed_at"),
				JsonNodes.text(node, "runner_name"), steps);
	}

	private static String repoPath(String owner, String repo) {
		return "/repos/" + encode(owner) + "/" + encode(repo);
	}

	private static String encode(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8);
	}

	private static String encodePath(String path) {
		String[] segments = path.split("/");
		StringBuilder encoded = new StringBuilder();
		for (int i = 0; i < segments.length; i++) {
			if (i > 0) {
				encoded.append('/');
			}
			encoded.append(encode(segments[i]).replace("+", "%20"));
		}
		return encoded.toString();
	}

}
