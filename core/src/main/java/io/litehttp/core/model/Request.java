package io.litehttp.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base type for all outgoing requests.
 *
 * <p>
 * The method is fixed at construction. The URL and the header list are
 * mutable so that {@link io.litehttp.core.spi.RequestInterceptor}s can rewrite
 * the request in place before it is dispatched. Header order is preserved and
 * duplicate names are allowed.
 *
 * <p>
 * Instances are not thread-safe. A request is expected to be executed once.
 */
public abstract class Request {

    private final RequestMethod method;
    private final List<Header> headers = new ArrayList<>();
    private String url;

    protected Request(RequestMethod method, String url) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.url = Objects.requireNonNull(url, "url must not be null");
    }

    public RequestMethod method() {
        return method;
    }

    public String url() {
        return url;
    }

    public void setUrl(String url) {
        this.url = Objects.requireNonNull(url, "url must not be null");
    }

    /** The live, mutable header list. */
    public List<Header> headers() {
        return headers;
    }

    /**
     * Appends a header. An existing header with the same name is kept.
     *
     * @return this request, for chaining
     */
    public Request addHeader(String name, String value) {
        headers.add(new Header(name, value));
        return this;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + method + " " + url + "]";
    }
}
