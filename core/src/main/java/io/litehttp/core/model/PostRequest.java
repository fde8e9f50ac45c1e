package io.litehttp.core.model;

/** An HTTP {@code POST} request with a JSON body. */
public final class PostRequest extends RequestWithBody {

    public PostRequest(String url, String body) {
        super(RequestMethod.POST, url, body);
    }
}
