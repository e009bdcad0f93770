package io.restactions.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkHttpClientAdapterTest {

    private static final URI UNREACHABLE = URI.create("http://127.0.0.1:1/gone");

    private MockWebServer server;
    private OkHttpClientAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = OkHttpClientAdapter.create();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void postSendsJsonBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\":\"1\"}"));

        HttpClientResponse response = adapter.send(HttpClientRequest.post(server.url("/invoices").uri())
                .header("Content-Type", "application/json")
                .body("{\"total\":10}".getBytes(StandardCharsets.UTF_8))
                .build());

        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":\"1\"}");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"total\":10}");
    }

    @Test
    void sendAsyncReadsBodyBeforeCompleting() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[1,2]"));

        HttpClientResponse response = adapter.sendAsync(HttpClientRequest.get(server.url("/list").uri()).build())
                .get(5, TimeUnit.SECONDS);

        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("[1,2]");
    }

    @Test
    void refusedConnectionSurfacesAsHttpClientException() {
        assertThatThrownBy(() -> adapter.send(HttpClientRequest.get(UNREACHABLE).build()))
                .isInstanceOf(HttpClientException.class);
    }

    @Test
    void asyncRefusedConnectionCompletesExceptionally() {
        assertThatThrownBy(() -> adapter.sendAsync(HttpClientRequest.get(UNREACHABLE).build())
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(HttpClientException.class);
    }
}
