package io.litehttp.core.error;

/**
 * Thrown when the exchange fails below HTTP: DNS resolution, connection
 * refused, connect or read timeout, TLS handshake failure (including an
 * untrusted certificate chain), or a broken stream.
 *
 * <p>
 * The underlying exception is always available as {@link #getCause()}. No
 * retry is attempted.
 */
public class TransportException extends HttpClientException {

    private static final long serialVersionUID = 1L;

    public TransportException(String requestUrl, Throwable cause) {
        super("Request to " + requestUrl + " failed: " + describe(cause), cause, requestUrl);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
