package de.mirkosertic.mcp.coursesync.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.mirkosertic.mcp.coursesync.tree.EntryKind;
import de.mirkosertic.mcp.coursesync.tree.TreeEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GitHubRepositoryClient Tests")
class GitHubRepositoryClientTest {

    private HttpServer server;
    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private final Map<String, String> authorizationByPath = new ConcurrentHashMap<>();

    private record Response(int status, String body, Map<String, String> headers) {
    }

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(final HttpExchange exchange) throws IOException {
        final String key = exchange.getRequestURI().getRawPath()
                + (exchange.getRequestURI().getRawQuery() != null ? "?" + exchange.getRequestURI().getRawQuery() : "");
        final String authorization = exchange.getRequestHeaders().getFirst("Authorization");
        if (authorization != null) {
            authorizationByPath.put(key, authorization);
        }
        final Response response = responses.getOrDefault(key, new Response(404, "{\"message\":\"Not Found\"}", Map.of()));
        response.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
        final byte[] body = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(response.status(), body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private GitHubRepositoryClient client(final String token) {
        final String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new GitHubRepositoryClient(HttpClient.newHttpClient(), new ObjectMapper(), baseUrl,
                new GitHubRepository("octo", "course"), "main", token, "coursesync-test", Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("Successful requests")
    class SuccessTests {

        @Test
        @DisplayName("Should return the commit SHA of the branch and send the token")
        void shouldReturnSnapshotIdentity() throws TransportException {
            // Given
            responses.put("/repos/octo/course/commits/main", new Response(200, "{\"sha\":\"abc123\"}",
                    Map.of("X-RateLimit-Remaining", "4999", "X-RateLimit-Reset", "1700000000")));

            // When
            final GitHubRepositoryClient client = client("secret");
            final String sha = client.getSnapshotIdentity();

            // Then
            assertThat(sha).isEqualTo("abc123");
            assertThat(authorizationByPath.get("/repos/octo/course/commits/main")).isEqualTo("token secret");
            assertThat(client.getRateLimitStatus())
                    .isEqualTo(new GitHubRepositoryClient.RateLimitStatus(4999, 1700000000L));
        }

        @Test
        @DisplayName("Should list blobs and trees and skip submodules")
        void shouldListTree() throws TransportException {
            // Given
            responses.put("/repos/octo/course/git/trees/main?recursive=1", new Response(200, """
                    {"sha":"t","truncated":false,"tree":[
                      {"path":"sections","type":"tree","sha":"s1"},
                      {"path":"sections/01/a.md","type":"blob","sha":"b1","size":12},
                      {"path":"vendor/lib","type":"commit","sha":"c1"}
                    ]}
                    """, Map.of()));

            // When
            final List<TreeEntry> entries = client(null).listTree();

            // Then
            assertThat(entries).containsExactly(
                    new TreeEntry("sections", EntryKind.TREE, 0, "s1"),
                    new TreeEntry("sections/01/a.md", EntryKind.BLOB, 12, "b1"));
            assertThat(authorizationByPath).isEmpty();
        }

        @Test
        @DisplayName("Should decode base64 file contents with line breaks")
        void shouldDecodeContents() throws TransportException {
            responses.put("/repos/octo/course/contents/sections/01/a%20b.md?ref=main", new Response(200,
                    "{\"size\":11,\"encoding\":\"base64\",\"content\":\"SGVsbG8g\\nV29ybGQ=\\n\"}", Map.of()));

            final byte[] contents = client(null).getFileContents("sections/01/a b.md");

            assertThat(new String(contents, StandardCharsets.UTF_8)).isEqualTo("Hello World");
        }

        @Test
        @DisplayName("Should fetch large files through the blob API")
        void shouldFetchLargeFilesAsBlob() throws TransportException {
            responses.put("/repos/octo/course/contents/big.bin?ref=main", new Response(200,
                    "{\"size\":2000000,\"sha\":\"bigsha\",\"content\":\"\"}", Map.of()));
            responses.put("/repos/octo/course/git/blobs/bigsha", new Response(200,
                    "{\"content\":\"QUJD\",\"encoding\":\"base64\"}", Map.of()));

            assertThat(client(null).getFileContents("big.bin")).isEqualTo("ABC".getBytes(StandardCharsets.UTF_8));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should report an empty tree as empty snapshot")
        void shouldReportEmptyTree() {
            responses.put("/repos/octo/course/git/trees/main?recursive=1",
                    new Response(200, "{\"tree\":[]}", Map.of()));

            assertThatThrownBy(() -> client(null).listTree()).isInstanceOf(EmptySnapshotException.class);
        }

        @Test
        @DisplayName("Should refuse a truncated tree listing")
        void shouldRefuseTruncatedTree() {
            responses.put("/repos/octo/course/git/trees/main?recursive=1", new Response(200, """
                    {"sha":"t","truncated":true,"tree":[
                      {"path":"sections","type":"tree","sha":"a"},
                      {"path":"sections/01-intro/01-a.md","type":"blob","sha":"b","size":3}
                    ]}""", Map.of()));

            assertThatThrownBy(() -> client(null).listTree())
                    .isInstanceOf(TransportException.class)
                    .isNotInstanceOf(EmptySnapshotException.class)
                    .hasMessageContaining("truncated");
        }

        @Test
        @DisplayName("Should report exhausted rate limits")
        void shouldReportRateLimit() {
            responses.put("/repos/octo/course/commits/main", new Response(403, "{\"message\":\"rate limit\"}",
                    Map.of("X-RateLimit-Remaining", "0", "X-RateLimit-Reset", "1700000123")));

            assertThatThrownBy(() -> client(null).getSnapshotIdentity())
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("rate limit exceeded")
                    .hasMessageContaining("1700000123");
        }

        @Test
        @DisplayName("Should carry the HTTP status of failed requests")
        void shouldCarryStatusCode() {
            assertThatThrownBy(() -> client(null).getSnapshotIdentity())
                    .isInstanceOfSatisfying(TransportException.class,
                            e -> assertThat(e.getStatusCode()).isEqualTo(404));
        }

        @Test
        @DisplayName("Should report authentication failures")
        void shouldReportAuthenticationFailure() {
            responses.put("/repos/octo/course/commits/main", new Response(401, "{}", Map.of()));

            assertThatThrownBy(() -> client("wrong").getSnapshotIdentity())
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("authentication failed");
        }
    }
}
