package io.litehttp.core.model;

import java.util.Objects;

/**
 * A single request header field. Names are not unique within a request: duplicate names are all
 * sent, and the server decides how to merge them.
 *
 * @param name  the header name, as it should appear on the wire
 * @param value the header value
 */
public record Header(String name, String value) {

    public Header {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
