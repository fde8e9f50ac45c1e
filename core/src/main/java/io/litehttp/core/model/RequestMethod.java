package io.litehttp.core.model;

/** HTTP methods supported by the client. */
public enum RequestMethod {
    HEAD,
    OPTIONS,
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
