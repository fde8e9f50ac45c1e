package io.litehttp.core.security;

import java.security.cert.CertificateException;

/**
 * Thrown by {@link CompositeTrustManager} when none of its delegates trusts a
 * certificate chain. Names neither the rejecting delegate nor the
 * chain. During a handshake it surfaces to callers wrapped in a
 * {@link io.litehttp.core.error.TransportException}.
 */
public class TrustFailureException extends CertificateException {

    private static final long serialVersionUID = 1L;

    public TrustFailureException() {
        super("None of the trust managers trust this certificate chain");
    }
}
