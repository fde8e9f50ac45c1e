package io.litehttp.core.error;

/**
 * Abstract base for every failure returned by
 * {@link io.litehttp.core.engine.HttpClient#execute}.
 *
 * <p>
 * Subtypes represent specific failure modes:
 * <ul>
 * <li>{@link TransportException} — network or I/O failure, no status received
 * <li>{@link TooManyRedirectsException} — redirect chain exceeded the
 * configured limit
 * <li>{@link ResponseStatusException} — the server answered with a status the
 * client does not treat as success
 * </ul>
 */
public abstract class HttpClientException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String requestUrl;

    protected HttpClientException(String message, String requestUrl) {
        super(message);
        this.requestUrl = requestUrl;
    }

    protected HttpClientException(String message, Throwable cause, String requestUrl) {
        super(message, cause);
        this.requestUrl = requestUrl;
    }

    /** The URL of the request that failed. */
    public String requestUrl() {
        return requestUrl;
    }
}
