package io.litehttp.core.error;

/**
 * Abstract parent for failures where the server did answer, but with a status
 * the client does not return as a success. Carries the status code and the
 * body text that came with it.
 */
public abstract class ResponseStatusException extends HttpClientException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String responseBody;

    protected ResponseStatusException(String message, String requestUrl, int statusCode, String responseBody) {
        super(message, requestUrl);
        this.statusCode = statusCode;
        this.responseBody = responseBody != null ? responseBody : "";
    }

    public int statusCode() {
        return statusCode;
    }

    /** The body text sent with the status, or an empty string. */
    public String responseBody() {
        return responseBody;
    }
}
