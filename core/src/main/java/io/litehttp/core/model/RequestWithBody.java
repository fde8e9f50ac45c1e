package io.litehttp.core.model;

import java.util.Objects;

/**
 * A request that carries a text payload, sent as {@code application/json}. The
 * body is expected to be encoded by the caller already.
 */
public abstract class RequestWithBody extends Request {

    private String body;

    protected RequestWithBody(RequestMethod method, String url, String body) {
        super(method, url);
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public String body() {
        return body;
    }

    public void setBody(String body) {
        this.body = Objects.requireNonNull(body, "body must not be null");
    }
}
