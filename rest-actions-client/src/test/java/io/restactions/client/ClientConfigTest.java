package io.restactions.client;

import io.restactions.core.ErrorKind;
import io.restactions.core.RestActionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientConfigTest {

    @Test
    void defaults() {
        ClientConfig config = ClientConfig.builder()
                .baseUrl("https://sandbox-api.test/v1")
                .apiKey("  secret  ")
                .build();

        assertThat(config.apiKey()).isEqualTo("secret");
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.mode()).isEqualTo(ExecutionMode.BLOCKING);
        assertThat(config.headers()).isEmpty();
        assertThat(config.toString()).doesNotContain("secret");
    }

    @Test
    void blankApiKeyIsRejected() {
        assertThatThrownBy(() -> ClientConfig.builder().baseUrl("https://api.test").apiKey("   ").build())
                .isInstanceOf(RestActionException.Configuration.class)
                .hasMessage("API key cannot be empty");
    }

    @Test
    void relativeOrNonHttpBaseUrlIsRejected() {
        assertThatThrownBy(() -> ClientConfig.builder().baseUrl("/v1").apiKey("k").build())
                .isInstanceOf(RestActionException.Configuration.class);
        assertThatThrownBy(() -> ClientConfig.builder().baseUrl("ftp://api.test").apiKey("k").build())
                .isInstanceOf(RestActionException.Configuration.class);
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThatThrownBy(() -> ClientConfig.builder().baseUrl("https://api.test").apiKey("k").timeout(Duration.ZERO).build())
                .isInstanceOf(RestActionException.Configuration.class);
    }

    @Test
    void readsEnvironment() {
        ClientConfig config = ClientConfig.fromEnvironment(Map.of(
                "RESTACTIONS_BASE_URL", "https://api.test/v1",
                "RESTACTIONS_API_KEY", "k",
                "RESTACTIONS_TIMEOUT_SECONDS", "5",
                "RESTACTIONS_MODE", "async"));

        assertThat(config.baseUrl()).hasToString("https://api.test/v1");
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.mode()).isEqualTo(ExecutionMode.ASYNC);
    }

    @Test
    void missingEnvironmentVariableIsAConfigurationError() {
        assertThatThrownBy(() -> ClientConfig.fromEnvironment(Map.of("RESTACTIONS_API_KEY", "k")))
                .isInstanceOfSatisfying(RestActionException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIGURATION))
                .hasMessageContaining("RESTACTIONS_BASE_URL");
    }

    @Test
    void invalidModeIsAConfigurationError() {
        assertThatThrownBy(() -> ClientConfig.fromEnvironment(Map.of(
                "RESTACTIONS_BASE_URL", "https://api.test",
                "RESTACTIONS_API_KEY", "k",
                "RESTACTIONS_MODE", "reactive")))
                .isInstanceOf(RestActionException.Configuration.class)
                .hasMessageContaining("reactive");
    }

    @Test
    void toBuilderKeepsSettings() {
        ClientConfig original = ClientConfig.builder()
                .baseUrl("https://api.test")
                .apiKey("k")
                .header("X-Tenant", "acme")
                .build();

        ClientConfig copy = original.toBuilder().mode(ExecutionMode.ASYNC).build();

        assertThat(copy.headers()).containsEntry("X-Tenant", "acme");
        assertThat(copy.mode()).isEqualTo(ExecutionMode.ASYNC);
        assertThat(copy.apiKey()).isEqualTo("k");
    }
}
