package io.litehttp.core.model;

/** An HTTP {@code GET} request. */
public final class GetRequest extends Request {

    public GetRequest(String url) {
        super(RequestMethod.GET, url);
    }
}
