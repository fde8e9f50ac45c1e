package io.litehttp.core.security;

import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;

/** Turns a raw X.509 certificate (PEM or DER) into an in-memory trust store. */
public final class CertificateLoader {

    static final String ALIAS = "ca";

    private CertificateLoader() {
        // utility class
    }

    /**
     * Parses one X.509 certificate and returns a key store that trusts it. The
     * stream is closed afterwards, also when parsing fails.
     *
     * @param certificateStream the certificate bytes
     * @return a key store of the platform default type holding the certificate
     *         under a trusted-certificate entry
     * @throws GeneralSecurityException if the bytes are not a valid certificate
     * @throws IOException              if the stream cannot be read
     */
    public static KeyStore loadKeyStore(InputStream certificateStream) throws GeneralSecurityException, IOException {
        Certificate certificate;
        try (InputStream in = certificateStream) {
            certificate = CertificateFactory.getInstance("X.509").generateCertificate(in);
        }
        KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        keyStore.load(null, null);
        keyStore.setCertificateEntry(ALIAS, certificate);
        return keyStore;
    }
}
