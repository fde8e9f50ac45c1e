package io.litehttp.core.model;

/** An HTTP {@code HEAD} request. */
public final class HeadRequest extends Request {

    public HeadRequest(String url) {
        super(RequestMethod.HEAD, url);
    }
}
