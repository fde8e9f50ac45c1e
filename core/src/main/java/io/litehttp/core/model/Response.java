package io.litehttp.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable result of a successful (2xx) exchange.
 *
 * <p>
 * Header lookups are case-insensitive. A header that the server sent several
 * times appears once, with its values joined by commas in arrival order.
 *
 * @param statusCode the HTTP status code
 * @param body       the response body decoded as text; empty for bodyless
 *                   responses such as 204 or HEAD
 * @param headers    header name to comma-joined value
 */
public record Response(int statusCode, String body, Map<String, String> headers) {

    public Response {
        body = body != null ? body : "";
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
    }

    /**
     * Value of a header (case-insensitive).
     *
     * @return the value, or {@code null} if the header is absent
     */
    public String header(String name) {
        return headers.get(name);
    }
}
