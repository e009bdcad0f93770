package io.restactions.core;

/**
 * HTTP methods issued by resource actions.
 */
public enum HttpVerb {
    GET,
    POST,
    PATCH,
    DELETE
}
