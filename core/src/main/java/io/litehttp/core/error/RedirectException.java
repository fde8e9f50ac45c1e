package io.litehttp.core.error;

/**
 * Thrown for a 3xx response that was not followed: either redirect following
 * is disabled, or the response has no {@code Location} header. In the latter
 * case {@link #responseBody()} is {@value #NO_LOCATION_HEADER}.
 */
public class RedirectException extends ResponseStatusException {

    private static final long serialVersionUID = 1L;

    public static final String NO_LOCATION_HEADER = "No Location header";

    public RedirectException(String requestUrl, int statusCode, String responseBody) {
        super(
                "Request to " + requestUrl + " was redirected (status code " + statusCode + "). "
                        + "See responseBody() for details.",
                requestUrl,
                statusCode,
                responseBody);
    }
}
