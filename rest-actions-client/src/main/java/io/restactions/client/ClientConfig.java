package io.restactions.client;

import io.restactions.core.RestActionException;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable client settings.
 *
 * <p>The API key is sent as {@code Authorization: Bearer <key>}. The timeout is the per-call
 * deadline applied by the transport; expiry surfaces as a transport failure.
 */
public final class ClientConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String ENV_BASE_URL = "RESTACTIONS_BASE_URL";
    static final String ENV_API_KEY = "RESTACTIONS_API_KEY";
    static final String ENV_TIMEOUT_SECONDS = "RESTACTIONS_TIMEOUT_SECONDS";
    static final String ENV_MODE = "RESTACTIONS_MODE";

    private final URI baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final ExecutionMode mode;
    private final Map<String, String> headers;

    private ClientConfig(Builder builder) {
        this.baseUrl = validateBaseUrl(builder.baseUrl);
        this.apiKey = validateApiKey(builder.apiKey);
        this.timeout = builder.timeout == null ? DEFAULT_TIMEOUT : builder.timeout;
        if (timeout.isZero() || timeout.isNegative()) {
            throw RestActionException.configuration("Timeout must be positive, got " + timeout);
        }
        this.mode = builder.mode == null ? ExecutionMode.BLOCKING : builder.mode;
        this.headers = Map.copyOf(builder.headers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code RESTACTIONS_BASE_URL}, {@code RESTACTIONS_API_KEY} and the optional
     * {@code RESTACTIONS_TIMEOUT_SECONDS} and {@code RESTACTIONS_MODE} from the process environment.
     */
    public static ClientConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ClientConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder()
                .baseUrl(required(env, ENV_BASE_URL))
                .apiKey(required(env, ENV_API_KEY));

        String seconds = env.get(ENV_TIMEOUT_SECONDS);
        if (seconds != null && !seconds.isBlank()) {
            try {
                builder.timeout(Duration.ofSeconds(Long.parseLong(seconds.trim())));
            } catch (NumberFormatException e) {
                throw RestActionException.configuration(ENV_TIMEOUT_SECONDS + " must be a whole number of seconds, got '" + seconds + "'");
            }
        }

        String mode = env.get(ENV_MODE);
        if (mode != null && !mode.isBlank()) {
            try {
                builder.mode(ExecutionMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw RestActionException.configuration("Invalid " + ENV_MODE + " '" + mode + "'. Must be one of: blocking, async");
            }
        }
        return builder.build();
    }

    public URI baseUrl() {
        return baseUrl;
    }

    public String apiKey() {
        return apiKey;
    }

    public Duration timeout() {
        return timeout;
    }

    public ExecutionMode mode() {
        return mode;
    }

    /**
     * Extra headers sent with every request.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .baseUrl(baseUrl.toString())
                .apiKey(apiKey)
                .timeout(timeout)
                .mode(mode);
        headers.forEach(builder::header);
        return builder;
    }

    @Override
    public String toString() {
        return "ClientConfig{baseUrl=" + baseUrl + ", apiKey=****, timeout=" + timeout + ", mode=" + mode + "}";
    }

    private static String required(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw RestActionException.configuration("Environment variable " + name + " is not set");
        }
        return value;
    }

    private static URI validateBaseUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw RestActionException.configuration("Base URL cannot be empty");
        }
        URI uri;
        try {
            uri = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            throw RestActionException.configuration("Invalid base URL '" + raw + "': " + e.getMessage());
        }
        String scheme = uri.getScheme();
        if (!uri.isAbsolute() || uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw RestActionException.configuration("Base URL must be an absolute http or https URL, got '" + raw + "'");
        }
        return uri;
    }

    private static String validateApiKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw RestActionException.configuration("API key cannot be empty");
        }
        return raw.trim();
    }

    public static final class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private ExecutionMode mode;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {}

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * @throws RestActionException.Configuration if a setting is missing or invalid
         */
        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
