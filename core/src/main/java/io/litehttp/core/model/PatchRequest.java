package io.litehttp.core.model;

/** An HTTP {@code PATCH} request with a JSON body. */
public final class PatchRequest extends RequestWithBody {

    public PatchRequest(String url, String body) {
        super(RequestMethod.PATCH, url, body);
    }
}
