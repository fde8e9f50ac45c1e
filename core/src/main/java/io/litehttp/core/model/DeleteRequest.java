package io.litehttp.core.model;

/** An HTTP {@code DELETE} request. */
public final class DeleteRequest extends Request {

    public DeleteRequest(String url) {
        super(RequestMethod.DELETE, url);
    }
}
