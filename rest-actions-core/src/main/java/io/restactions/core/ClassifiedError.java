package io.restactions.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of a failed action.
 *
 * <p>{@code kind} and {@code statusCode} are meant for programmatic handling; {@code message}
 * is the human readable summary and may fold in text supplied by the remote API.
 * Optional components are null when not applicable: {@code statusCode} is null for
 * transport and configuration failures, {@code rawBody} is null when no body was read.
 *
 * @param kind       the error category
 * @param message    human readable summary
 * @param statusCode HTTP status, or null
 * @param rawBody    response text (or offending value for shape failures), or null
 * @param url        absolute request URL; for transport failures the request path when the executor cannot resolve it, or null
 * @param action     action key such as {@code get} or {@code perform__cancel}, or null
 * @param endpoint   resource endpoint, or null
 * @param cause      underlying failure, or null
 */
public record ClassifiedError(
        ErrorKind kind,
        String message,
        Integer statusCode,
        String rawBody,
        String url,
        String action,
        String endpoint,
        Throwable cause
) {
    public ClassifiedError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static ClassifiedError of(ErrorKind kind, String message) {
        return new ClassifiedError(kind, message, null, null, null, null, null, null);
    }

    public static ClassifiedError configuration(String message) {
        return of(ErrorKind.CONFIGURATION, message);
    }

    public static ClassifiedError responseParse(String message, String rawBody, Throwable cause) {
        String detailed = "Failed to parse API response: " + message;
        if (cause != null && cause.getMessage() != null && !cause.getMessage().equals(message)) {
            detailed += " (Original error: " + cause.getMessage() + ")";
        }
        return new ClassifiedError(ErrorKind.RESPONSE_PARSE, detailed, null, rawBody, null, null, null, cause);
    }

    public Optional<Integer> status() {
        return Optional.ofNullable(statusCode);
    }

    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Fills in the action identity without overwriting values already present.
     */
    public ClassifiedError withContext(ActionKey key, String endpoint) {
        return new ClassifiedError(kind, message, statusCode, rawBody, url,
                action != null ? action : (key == null ? null : key.toString()),
                this.endpoint != null ? this.endpoint : endpoint,
                cause);
    }

    public ClassifiedError withStatus(int status) {
        return new ClassifiedError(kind, message, status, rawBody, url, action, endpoint, cause);
    }

    public ClassifiedError withUrl(String url) {
        return new ClassifiedError(kind, message, statusCode, rawBody, url, action, endpoint, cause);
    }

    /**
     * Converts this error into the matching {@link RestActionException} subtype.
     */
    public RestActionException toException() {
        return RestActionException.of(this);
    }
}
