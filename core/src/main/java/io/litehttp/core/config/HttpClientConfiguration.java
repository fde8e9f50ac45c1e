package io.litehttp.core.config;

import java.io.InputStream;

/**
 * Immutable configuration of an {@link io.litehttp.core.engine.HttpClient}.
 *
 * <p>
 * Use {@link #builder()} to construct instances; the builder rejects negative
 * values. A timeout of {@code 0} disables that timeout.
 *
 * @param readTimeoutMs          maximum wait for the complete response once
 *                               connected, in ms (default 3000); together with
 *                               the connect timeout it bounds the whole exchange
 * @param connectTimeoutMs       maximum wait for the TCP/TLS connection, in ms
 *                               (default 3000)
 * @param certificateInputStream optional X.509 certificate (PEM or DER) to
 *                               trust in addition to the platform trust store;
 *                               consumed and closed when the client is built
 * @param followRedirects        follow 3xx responses carrying a
 *                               {@code Location} header (default true)
 * @param maxRedirects           maximum number of redirect hops per execution
 *                               (default 10)
 */
public record HttpClientConfiguration(
        int readTimeoutMs,
        int connectTimeoutMs,
        InputStream certificateInputStream,
        boolean followRedirects,
        int maxRedirects) {

    public static final int DEFAULT_READ_TIMEOUT_MS = 3000;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 3000;
    public static final int DEFAULT_MAX_REDIRECTS = 10;

    public HttpClientConfiguration {
        requireNonNegative(readTimeoutMs, "Read timeout must be non-negative");
        requireNonNegative(connectTimeoutMs, "Connect timeout must be non-negative");
        requireNonNegative(maxRedirects, "Max redirects must be non-negative");
    }

    /** Creates a new builder with the default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Configuration with every default applied. */
    public static HttpClientConfiguration defaults() {
        return builder().build();
    }

    public boolean hasCustomCertificate() {
        return certificateInputStream != null;
    }

    private static void requireNonNegative(int value, String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message + ": " + value);
        }
    }

    /** Builder for {@link HttpClientConfiguration}. */
    public static final class Builder {
        private int readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private InputStream certificateInputStream;
        private boolean followRedirects = true;
        private int maxRedirects = DEFAULT_MAX_REDIRECTS;

        Builder() {}

        public Builder readTimeoutMs(int readTimeoutMs) {
            requireNonNegative(readTimeoutMs, "Read timeout must be non-negative");
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            requireNonNegative(connectTimeoutMs, "Connect timeout must be non-negative");
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder certificateInputStream(InputStream certificateInputStream) {
            this.certificateInputStream = certificateInputStream;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            requireNonNegative(maxRedirects, "Max redirects must be non-negative");
            this.maxRedirects = maxRedirects;
            return this;
        }

        public HttpClientConfiguration build() {
            return new HttpClientConfiguration(
                    readTimeoutMs, connectTimeoutMs, certificateInputStream, followRedirects, maxRedirects);
        }
    }
}
