package io.restactions.core;

import io.restactions.http.spi.HttpClientException;
import io.restactions.json.spi.JsonCodec;
import io.restactions.json.spi.JsonException;
import io.restactions.json.spi.JsonNode;

import java.util.Objects;

/**
 * Maps failed exchanges to {@link ClassifiedError} values.
 *
 * <p>The status table is fixed: 401 authentication, 403 authorization, 404 not found,
 * 422 validation, 429 rate limit, 500 and above server, anything else from 400 http.
 * When the body is a JSON object with a {@code message} (or else {@code errors}) field
 * its text is appended to the summary; it never changes the kind.
 */
public final class ErrorClassifier {

    private final JsonCodec codec;

    public ErrorClassifier(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public static boolean isFailure(int statusCode) {
        return statusCode >= 400;
    }

    public static ErrorKind kindOf(int statusCode) {
        if (statusCode == 401) return ErrorKind.AUTHENTICATION;
        if (statusCode == 403) return ErrorKind.AUTHORIZATION;
        if (statusCode == 404) return ErrorKind.NOT_FOUND;
        if (statusCode == 422) return ErrorKind.VALIDATION;
        if (statusCode == 429) return ErrorKind.RATE_LIMIT;
        if (statusCode >= 500) return ErrorKind.SERVER;
        return ErrorKind.HTTP;
    }

    static String summaryOf(ErrorKind kind) {
        return switch (kind) {
            case AUTHENTICATION -> "Authentication failed. Please check your API key.";
            case AUTHORIZATION -> "Access forbidden. You don't have permission to access this resource.";
            case NOT_FOUND -> "Resource not found.";
            case VALIDATION -> "Validation error. Please check your request data.";
            case RATE_LIMIT -> "Rate limit exceeded. Please try again later.";
            case SERVER -> "Server error occurred. Please try again later.";
            default -> "HTTP error occurred";
        };
    }

    /**
     * Classifies a response whose status is 400 or above.
     *
     * @param statusCode   the HTTP status
     * @param rawBodyText  the response text, retained verbatim; may be null
     * @param url          the request URL; may be null
     */
    public ClassifiedError classify(int statusCode, String rawBodyText, String url) {
        ErrorKind kind = kindOf(statusCode);
        StringBuilder message = new StringBuilder("HTTP ").append(statusCode).append(" error");
        if (url != null) {
            message.append(" for ").append(url);
        }
        message.append(": ").append(summaryOf(kind));

        String detail = apiDetail(rawBodyText);
        if (detail != null) {
            message.append(detail);
        }
        return new ClassifiedError(kind, message.toString(), statusCode, rawBodyText, url, null, null, null);
    }

    /**
     * Classifies a failure below the HTTP layer. No status is attached.
     */
    public ClassifiedError transportFailure(String url, HttpClientException failure) {
        Throwable root = failure.getCause() != null ? failure.getCause() : failure;
        String reason = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return new ClassifiedError(ErrorKind.HTTP, "Network error occurred: " + reason,
                null, reason, url, null, null, failure);
    }

    private String apiDetail(String rawBodyText) {
        if (rawBodyText == null || rawBodyText.isBlank()) {
            return null;
        }
        JsonNode body;
        try {
            body = codec.readTree(rawBodyText);
        } catch (JsonException e) {
            // non-JSON error pages keep only the raw text
            return null;
        }
        if (!body.isObject()) {
            return null;
        }
        if (body.has("message")) {
            return " - API message: " + text(body.get("message"));
        }
        if (body.has("errors")) {
            return " - API errors: " + text(body.get("errors"));
        }
        return null;
    }

    static String text(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }
}
