package io.restactions.core;

/**
 * Discriminant of a {@link ClassifiedError}.
 *
 * <p>Status-driven kinds are assigned by {@link ErrorClassifier#kindOf(int)}.
 * {@link #RESPONSE_PARSE} and {@link #CONFIGURATION} never come from a status code.
 */
public enum ErrorKind {
    /** 401. */
    AUTHENTICATION,
    /** 403. */
    AUTHORIZATION,
    /** 404. */
    NOT_FOUND,
    /** 422. */
    VALIDATION,
    /** 429. */
    RATE_LIMIT,
    /** 500 and above. */
    SERVER,
    /** Any other status of 400 and above, transport failures, and missing unwrap keys. */
    HTTP,
    /** The body is not JSON or does not match the declared result shape. */
    RESPONSE_PARSE,
    /** The action is not configured for the resource, or the client is misconfigured. */
    CONFIGURATION
}
