package io.restactions.core;

import java.util.Objects;

/**
 * Unchecked exception carrying a {@link ClassifiedError}.
 *
 * <p>Raised by {@link ActionResult#orThrow()} and by configuration validation. One
 * subclass exists per {@link ErrorKind}, so callers may either catch a specific type or
 * catch this class and branch on {@link #kind()}.
 */
public abstract class RestActionException extends RuntimeException {

    private final ClassifiedError error;

    protected RestActionException(ClassifiedError error) {
        super(Objects.requireNonNull(error, "error").message(), error.cause());
        this.error = error;
    }

    public ClassifiedError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }

    /**
     * HTTP status of the failed exchange, or null when none was received.
     */
    public Integer statusCode() {
        return error.statusCode();
    }

    public static RestActionException of(ClassifiedError error) {
        return switch (error.kind()) {
            case AUTHENTICATION -> new Authentication(error);
            case AUTHORIZATION -> new Authorization(error);
            case NOT_FOUND -> new NotFound(error);
            case VALIDATION -> new Validation(error);
            case RATE_LIMIT -> new RateLimit(error);
            case SERVER -> new Server(error);
            case HTTP -> new Http(error);
            case RESPONSE_PARSE -> new ResponseParse(error);
            case CONFIGURATION -> new Configuration(error);
        };
    }

    public static Configuration configuration(String message) {
        return new Configuration(ClassifiedError.configuration(message));
    }

    /** Raised for 401 responses. */
    public static class Authentication extends RestActionException {
        public Authentication(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised for 403 responses. */
    public static class Authorization extends RestActionException {
        public Authorization(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised for 404 responses. */
    public static class NotFound extends RestActionException {
        public NotFound(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised for 422 responses. */
    public static class Validation extends RestActionException {
        public Validation(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised for 429 responses. */
    public static class RateLimit extends RestActionException {
        public RateLimit(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised for 5xx responses. */
    public static class Server extends RestActionException {
        public Server(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised for other HTTP failures, transport failures and missing unwrap keys. */
    public static class Http extends RestActionException {
        public Http(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised when a response body cannot be parsed or validated. */
    public static class ResponseParse extends RestActionException {
        public ResponseParse(ClassifiedError error) {
            super(error);
        }
    }

    /** Raised for actions that are not configured and for invalid client settings. */
    public static class Configuration extends RestActionException {
        public Configuration(ClassifiedError error) {
            super(error);
        }
    }
}
