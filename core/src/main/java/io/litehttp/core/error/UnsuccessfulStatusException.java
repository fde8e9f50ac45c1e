package io.litehttp.core.error;

/**
 * Thrown for a response whose status is neither 2xx nor 3xx (in practice 1xx,
 * 4xx and 5xx). The body of the error response is available through
 * {@link #errorBody()}.
 */
public class UnsuccessfulStatusException extends ResponseStatusException {

    private static final long serialVersionUID = 1L;

    public UnsuccessfulStatusException(String requestUrl, int statusCode, String errorBody) {
        super(
                "Request to " + requestUrl + " failed with status code " + statusCode + ". "
                        + "See errorBody() for details.",
                requestUrl,
                statusCode,
                errorBody);
    }

    /** The error response body (alias for {@link #responseBody()}). */
    public String errorBody() {
        return responseBody();
    }
}
