package io.restactions.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkHttpClientAdapterTest {

    private static final URI UNREACHABLE = URI.create("http://127.0.0.1:1/gone");

    private MockWebServer server;
    private JdkHttpClientAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = JdkHttpClientAdapter.create();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void sendReturnsStatusHeadersAndBody() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"ok\":true}"));

        HttpClientResponse response = adapter.send(HttpClientRequest.get(server.url("/companies").uri())
                .header("Authorization", "Bearer k")
                .build());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.header("content-type")).contains("application/json");
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"ok\":true}");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer k");
    }

    @Test
    void errorStatusesAreOrdinaryResponses() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"nope\"}"));

        HttpClientResponse response = adapter.send(HttpClientRequest.get(server.url("/x").uri()).build());

        assertThat(response.statusCode()).isEqualTo(404);
    }

    @Test
    void patchSendsBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        adapter.send(HttpClientRequest.patch(server.url("/companies/1").uri())
                .header("Content-Type", "application/json")
                .body("{\"name\":\"X\"}".getBytes(StandardCharsets.UTF_8))
                .build());

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("PATCH");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"name\":\"X\"}");
    }

    @Test
    void sendAsyncCompletesWithResponse() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        HttpClientResponse response = adapter.sendAsync(HttpClientRequest.delete(server.url("/items/1").uri()).build())
                .get(5, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(204);
    }

    @Test
    void timeoutSurfacesAsHttpTimeoutException() {
        server.enqueue(new MockResponse().setBody("{}").setHeadersDelay(2, TimeUnit.SECONDS));

        HttpClientRequest request = HttpClientRequest.get(server.url("/slow").uri())
                .timeout(Duration.ofMillis(200))
                .build();

        assertThatThrownBy(() -> adapter.send(request)).isInstanceOf(HttpTimeoutException.class);
    }

    @Test
    void asyncTransportFailureCompletesExceptionally() {
        assertThatThrownBy(() -> adapter.sendAsync(HttpClientRequest.get(UNREACHABLE).build())
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(HttpClientException.class);
    }
}
