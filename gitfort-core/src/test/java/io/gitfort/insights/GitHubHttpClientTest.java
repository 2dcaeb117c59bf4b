package io.gitfort.insights;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GitHubHttpClient} against an in-process HTTP server.
 */
@DisplayName("GitHubHttpClient Tests")
class GitHubHttpClientTest {

	private HttpServer server;

	private String apiBase;

	private final Map<String, String> received = new ConcurrentHashMap<>();

	private final AtomicInteger status = new AtomicInteger(200);

	private final Map<String, String> responseHeaders = new ConcurrentHashMap<>();

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", this::handle);
		server.start();
		apiBase = "http://127.0.0.1:" + server.getAddress().getPort();
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	private void handle(HttpExchange exchange) throws IOException {
		received.put("method", exchange.getRequestMethod());
		received.put("path", exchange.getRequestURI().toString());
		received.put("authorization", String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
		received.put("accept", String.valueOf(exchange.getRequestHeaders().getFirst("Accept")));
		received.put("userAgent", String.valueOf(exchange.getRequestHeaders().getFirst("User-Agent")));
		received.put("contentType", String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
		try (InputStream in = exchange.getRequestBody()) {
			received.put("body", new String(in.readAllBytes(), StandardCharsets.UTF_8));
		}
		responseHeaders.forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
		byte[] body = "{\"ok\": true}".getBytes(StandardCharsets.UTF_8);
		exchange.sendResponseHeaders(status.get(), body.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(body);
		}
	}

	private GitHubHttpClient client(String token) {
		return new GitHubHttpClient(TokenAccessor.of(token), apiBase, "GitFort-Insights/1.0");
	}

	@Test
	@DisplayName("Should send authentication and content headers")
	void shouldSendHeaders() {
		GitHubResponse response = client("ghp_secret").execute(GitHubRequest.get("/rate_limit"));

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.body()).contains("\"ok\"");
		assertThat(received).containsEntry("method", "GET")
			.containsEntry("path", "/rate_limit")
			.containsEntry("authorization", "Bearer ghp_secret")
			.containsEntry("accept", "application/vnd.github.v3+json")
			.containsEntry("userAgent", "GitFort-Insights/1.0");
	}

	@Test
	@DisplayName("Should post GraphQL bodies to the graphql endpoint of the API base")
	void shouldPostGraphQL() {
		client("ghp_secret").execute(GitHubRequest.graphQL("{\"query\":\"{ viewer { login } }\"}"));

		assertThat(received).containsEntry("method", "POST")
			.containsEntry("path", "/graphql")
			.containsEntry("contentType", "application/json")
			.containsEntry("body", "{\"query\":\"{ viewer { login } }\"}");
	}

	@Test
	@DisplayName("Should parse rate limit and Link headers")
	void shouldParseHeaders() {
		responseHeaders.put("x-ratelimit-limit", "5000");
		responseHeaders.put("x-ratelimit-remaining", "4321");
		responseHeaders.put("x-ratelimit-reset", "1717500000");
		responseHeaders.put("x-ratelimit-used", "679");
		responseHeaders.put("Link", "<" + apiBase + "/user/repos?page=2>; rel=\"next\"");

		GitHubResponse response = client("ghp_secret").execute(GitHubRequest.get("/user/repos"));

		assertThat(response.rateLimit()).isEqualTo(new RateLimitInfo(5000, 4321, 1717500000L, 679));
		assertThat(response.link()).contains("rel=\"next\"");
	}

	@Test
	@DisplayName("Should report an exhausted 403 as a rate limit error")
	void shouldMapRateLimited403() {
		status.set(403);
		responseHeaders.put("x-ratelimit-remaining", "0");
		responseHeaders.put("x-ratelimit-reset", "1717500000");

		assertThatThrownBy(() -> client("ghp_secret").execute(GitHubRequest.get("/user")))
			.isInstanceOfSatisfying(GitHubApiException.class, e -> {
				assertThat(e.getStatusCode()).isEqualTo(403);
				assertThat(e.isRateLimitError()).isTrue();
				assertThat(e.getResetEpochSeconds()).isEqualTo(1717500000L);
			});
	}

	@Test
	@DisplayName("Should report a plain 403 as permanent")
	void shouldMapForbidden() {
		status.set(403);

		assertThatThrownBy(() -> client("ghp_secret").execute(GitHubRequest.get("/user")))
			.isInstanceOfSatisfying(GitHubApiException.class, e -> {
				assertThat(e.isRateLimitError()).isFalse();
				assertThat(e.isPermanent()).isTrue();
			});
	}

	@Test
	@DisplayName("Should carry the status of server errors")
	void shouldMapServerError() {
		status.set(502);

		assertThatThrownBy(() -> client("ghp_secret").execute(GitHubRequest.get("/user")))
			.isInstanceOfSatisfying(GitHubApiException.class, e -> {
				assertThat(e.getStatusCode()).isEqualTo(502);
				assertThat(e.isPermanent()).isFalse();
			});
	}

	@Test
	@DisplayName("Should refuse to send without a valid token")
	void shouldRejectInvalidToken() {
		GitHubHttpClient client = new GitHubHttpClient(() -> TokenInfo.invalid("session expired"), apiBase,
				"GitFort-Insights/1.0");

		assertThatThrownBy(() -> client.execute(GitHubRequest.get("/user"))).isInstanceOf(TokenInvalidException.class)
			.hasMessage("session expired");
		assertThat(received).isEmpty();
	}

	@Test
	@DisplayName("Should map connection failures to status -1")
	void shouldMapNetworkFailure() {
		server.stop(0);

		assertThatThrownBy(() -> client("ghp_secret").execute(GitHubRequest.get("/user")))
			.isInstanceOfSatisfying(GitHubApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(-1));
	}

}
