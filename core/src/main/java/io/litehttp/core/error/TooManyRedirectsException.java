package io.litehttp.core.error;

/** Thrown when following redirects would exceed the configured maximum number of hops. */
public class TooManyRedirectsException extends HttpClientException {

    private static final long serialVersionUID = 1L;

    private final int maxRedirects;

    public TooManyRedirectsException(String requestUrl, int maxRedirects) {
        super("Request to " + requestUrl + " exceeded the maximum of " + maxRedirects + " redirects", requestUrl);
        this.maxRedirects = maxRedirects;
    }

    public int maxRedirects() {
        return maxRedirects;
    }
}
