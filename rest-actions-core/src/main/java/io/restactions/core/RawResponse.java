package io.restactions.core;

import java.nio.charset.StandardCharsets;

/**
 * Status and body of one completed exchange.
 *
 * @param statusCode HTTP status
 * @param body       response bytes, or null when the server sent none
 * @param url        the requested URL
 */
public record RawResponse(int statusCode, byte[] body, String url) {

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    /**
     * The body decoded as UTF-8, or null when empty.
     */
    public String bodyText() {
        return hasBody() ? new String(body, StandardCharsets.UTF_8) : null;
    }

    @Override
    public String toString() {
        return "RawResponse[" + statusCode + " " + url + ", " + (body == null ? 0 : body.length) + " bytes]";
    }
}
