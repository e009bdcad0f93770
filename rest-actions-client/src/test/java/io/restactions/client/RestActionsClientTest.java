package io.restactions.client;

import io.restactions.core.ActionRegistry;
import io.restactions.core.ActionResult;
import io.restactions.core.AsyncResourceHandle;
import io.restactions.core.ClassifiedError;
import io.restactions.core.ErrorKind;
import io.restactions.core.ResourceHandle;
import io.restactions.core.RestActionException;
import io.restactions.http.spi.ApacheHttpClientAdapter;
import io.restactions.http.spi.HttpTimeoutException;
import io.restactions.http.spi.OkHttpClientAdapter;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestActionsClientTest {

    record Company(String id, String name) {}

    record Payroll(String id, String status) {}

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private ClientConfig.Builder config() {
        return ClientConfig.builder()
                .baseUrl(server.url("/v1").toString())
                .apiKey("test-key");
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static ActionRegistry<Company> companies() {
        return ActionRegistry.builder(Company.class)
                .get("company")
                .update("company")
                .list("companies")
                .delete()
                .build();
    }

    @Test
    void getSendsCredentialsAndUnwraps() throws Exception {
        server.enqueue(json(200, "{\"company\": {\"id\": \"1\", \"name\": \"Acme\"}}"));
        RestActionsClient client = RestActionsClient.builder().config(config().build()).build();

        Company company = client.resource("company", companies()).get("1").orThrow();

        assertThat(company).isEqualTo(new Company("1", "Acme"));
        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/v1/company/1");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
        assertThat(recorded.getBodySize()).isZero();
    }

    @Test
    void updateSendsJsonPatch() throws Exception {
        server.enqueue(json(200, "{\"company\": {\"id\": \"1\", \"name\": \"Renamed\"}}"));
        RestActionsClient client = RestActionsClient.builder()
                .config(config().header("X-Tenant", "acme").build())
                .build();

        client.resource("company", companies()).update("1", Map.of("name", "Renamed")).orThrow();

        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("PATCH");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getHeader("X-Tenant")).isEqualTo("acme");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"name\":\"Renamed\"}");
    }

    @Test
    void listSendsSortedQuery() throws Exception {
        server.enqueue(json(200, "{\"companies\": [{\"id\": \"1\"}, {\"id\": \"2\"}]}"));
        RestActionsClient client = RestActionsClient.builder().config(config().build()).build();

        List<Company> page = client.resource("company", companies())
                .list(Map.of("start", "0", "limit", "2"))
                .orThrow();

        assertThat(page).extracting(Company::id).containsExactly("1", "2");
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getPath()).isEqualTo("/v1/company?limit=2&start=0");
    }

    @Test
    void deleteNoContentIsTrue() {
        server.enqueue(new MockResponse().setResponseCode(204));
        RestActionsClient client = RestActionsClient.builder().config(config().build()).build();

        assertThat(client.resource("company", companies()).delete("1").orThrow()).isTrue();
    }

    @Test
    void errorStatusIsClassifiedWithUrl() {
        server.enqueue(json(403, "{\"message\": \"Plan does not include payroll\"}"));
        RestActionsClient client = RestActionsClient.builder().config(config().build()).build();

        ActionResult<Company> result = client.resource("company", companies()).get("1");

        ClassifiedError error = result.failureCause().orElseThrow();
        assertThat(error.kind()).isEqualTo(ErrorKind.AUTHORIZATION);
        assertThat(error.statusCode()).isEqualTo(403);
        assertThat(error.url()).isEqualTo(server.url("/v1/company/1").toString());
        assertThat(error.message()).contains("API message: Plan does not include payroll");
        assertThatThrownBy(result::orThrow).isInstanceOf(RestActionException.Authorization.class);
    }

    @Test
    void timeoutIsATransportFailure() {
        server.enqueue(json(200, "{}").setHeadersDelay(2, TimeUnit.SECONDS));
        RestActionsClient client = RestActionsClient.builder()
                .config(config().timeout(Duration.ofMillis(200)).build())
                .build();

        ClassifiedError error = client.resource("company", companies()).get("1").failureCause().orElseThrow();

        assertThat(error.kind()).isEqualTo(ErrorKind.HTTP);
        assertThat(error.status()).isEmpty();
        assertThat(error.message()).startsWith("Network error occurred");
        assertThat(error.cause()).isInstanceOf(HttpTimeoutException.class);
        assertThat(error.url()).isEqualTo(server.url("/v1/company/1").toString());
    }

    @Test
    void asyncTransportFailureCarriesResolvedUrl() throws Exception {
        RestActionsClient client = RestActionsClient.builder()
                .config(config().mode(ExecutionMode.ASYNC).build())
                .asyncHttpClient(request -> CompletableFuture.failedFuture(new HttpTimeoutException("Request timed out")))
                .build();

        ActionResult<Company> result = client.asyncResource("company", companies()).get("1").get(5, TimeUnit.SECONDS);

        ClassifiedError error = result.failureCause().orElseThrow();
        assertThat(error.kind()).isEqualTo(ErrorKind.HTTP);
        assertThat(error.url()).isEqualTo(server.url("/v1/company/1").toString());
    }

    @Test
    void okHttpTransportCanBeInjected() throws Exception {
        server.enqueue(json(200, "{\"payroll\": {\"id\": \"7\", \"status\": \"cancelled\"}}"));
        RestActionsClient client = RestActionsClient.builder()
                .config(config().build())
                .httpClient(OkHttpClientAdapter.create())
                .build();
        ResourceHandle<Payroll> payrolls = client.resource("payroll",
                ActionRegistry.builder(Payroll.class).subaction("cancel", "payroll").build());

        Payroll cancelled = payrolls.performSubaction("7", "cancel", null, Payroll.class).orThrow();

        assertThat(cancelled.status()).isEqualTo("cancelled");
        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/v1/payroll/7/cancel");
    }

    @Test
    void asyncModeUsesAsyncHandles() throws Exception {
        server.enqueue(json(200, "{\"company\": {\"id\": \"1\", \"name\": \"Acme\"}}"));
        RestActionsClient client = RestActionsClient.builder()
                .config(config().mode(ExecutionMode.ASYNC).build())
                .build();

        AsyncResourceHandle<Company> handle = client.asyncResource("company", companies());
        ActionResult<Company> result = handle.get("1").get(5, TimeUnit.SECONDS);

        assertThat(result.orThrow().name()).isEqualTo("Acme");
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getHeader("Authorization")).isEqualTo("Bearer test-key");
    }

    @Test
    void asyncTransportTakesPrecedenceInAsyncMode() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        RestActionsClient client = RestActionsClient.builder()
                .config(config().mode(ExecutionMode.ASYNC).build())
                .httpClient(request -> { throw new AssertionError("async transport expected"); })
                .asyncHttpClient(OkHttpClientAdapter.create())
                .build();

        ActionResult<Boolean> deleted = client.asyncResource("company", companies()).delete("1").get(5, TimeUnit.SECONDS);

        assertThat(deleted.orThrow()).isTrue();
    }

    @Test
    void blockingOnlyTransportRunsOnExecutorInAsyncMode() throws Exception {
        server.enqueue(json(200, "{\"companies\": [{\"id\": \"1\"}]}"));
        RestActionsClient client = RestActionsClient.builder()
                .config(config().mode(ExecutionMode.ASYNC).build())
                .httpClient(ApacheHttpClientAdapter.create())
                .blockingExecutor(Runnable::run)
                .build();

        ActionResult<List<Company>> page = client.asyncResource("company", companies()).list().get(5, TimeUnit.SECONDS);

        assertThat(page.orThrow()).extracting(Company::id).containsExactly("1");
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getHeader("Authorization")).isEqualTo("Bearer test-key");
    }

    @Test
    void modeMismatchIsAConfigurationError() {
        RestActionsClient blocking = RestActionsClient.builder().config(config().build()).build();
        RestActionsClient async = RestActionsClient.builder().config(config().mode(ExecutionMode.ASYNC).build()).build();

        assertThatThrownBy(() -> blocking.asyncResource("company", companies()))
                .isInstanceOf(RestActionException.Configuration.class);
        assertThatThrownBy(() -> async.resource("company", companies()))
                .isInstanceOf(RestActionException.Configuration.class);
    }

    @Test
    void missingConfigIsRejected() {
        assertThatThrownBy(() -> RestActionsClient.builder().build())
                .isInstanceOf(RestActionException.Configuration.class);
    }
}
