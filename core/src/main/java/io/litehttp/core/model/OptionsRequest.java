package io.litehttp.core.model;

/** An HTTP {@code OPTIONS} request. */
public final class OptionsRequest extends Request {

    public OptionsRequest(String url) {
        super(RequestMethod.OPTIONS, url);
    }
}
