package io.litehttp.core.error;

/**
 * Thrown when an {@link io.litehttp.core.engine.HttpClient} cannot be
 * constructed because its TLS context could not be built, typically because
 * the configured trust anchor is not a parseable X.509 certificate.
 */
public class TlsSetupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TlsSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
