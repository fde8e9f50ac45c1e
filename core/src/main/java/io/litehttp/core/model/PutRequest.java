package io.litehttp.core.model;

/** An HTTP {@code PUT} request with a JSON body. */
public final class PutRequest extends RequestWithBody {

    public PutRequest(String url, String body) {
        super(RequestMethod.PUT, url, body);
    }
}
