package io.litehttp.core.security;

import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link X509TrustManager} that combines the platform's default trust with any
 * number of caller-supplied trust stores.
 *
 * <p>
 * A chain is trusted if <em>any</em> delegate trusts it. Delegates are asked
 * in construction order, the platform default first, and the first one that
 * accepts ends the evaluation. If every delegate rejects, a
 * {@link TrustFailureException} is thrown; the individual rejections are
 * dropped.
 *
 * <p>
 * This lets a client talk to publicly trusted hosts and to a host with a
 * pinned or self-signed certificate without replacing the system trust store.
 *
 * <p>
 * Immutable after construction and therefore thread-safe.
 */
public final class CompositeTrustManager implements X509TrustManager {

    private static final Logger LOG = LoggerFactory.getLogger(CompositeTrustManager.class);

    private final List<X509TrustManager> delegates;

    CompositeTrustManager(List<X509TrustManager> delegates) {
        if (delegates.isEmpty()) {
            throw new IllegalArgumentException("at least one delegate trust manager is required");
        }
        this.delegates = List.copyOf(delegates);
    }

    /**
     * Creates a trust manager backed by the platform default plus one delegate
     * per key store.
     *
     * @param keyStores additional trust stores, possibly empty
     * @throws GeneralSecurityException if the platform trust algorithm is
     *                                  unavailable or a store cannot be read
     */
    public static CompositeTrustManager withDefaults(List<KeyStore> keyStores) throws GeneralSecurityException {
        List<X509TrustManager> delegates = new ArrayList<>(keyStores.size() + 1);
        delegates.add(trustManagerFor(null));
        for (KeyStore keyStore : keyStores) {
            delegates.add(trustManagerFor(keyStore));
        }
        LOG.debug("CompositeTrustManager initialized: platform default + {} custom trust store(s)", keyStores.size());
        return new CompositeTrustManager(delegates);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        requireAnyAccepts(delegate -> delegate.checkClientTrusted(chain, authType));
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        requireAnyAccepts(delegate -> delegate.checkServerTrusted(chain, authType));
    }

    /** All delegates' accepted issuers, concatenated in delegate order without de-duplication. */
    @Override
    public X509Certificate[] getAcceptedIssuers() {
        List<X509Certificate> issuers = new ArrayList<>();
        for (X509TrustManager delegate : delegates) {
            issuers.addAll(Arrays.asList(delegate.getAcceptedIssuers()));
        }
        return issuers.toArray(new X509Certificate[0]);
    }

    /** Number of delegates, the platform default included. */
    public int delegateCount() {
        return delegates.size();
    }

    private void requireAnyAccepts(TrustCheck check) throws TrustFailureException {
        if (delegates.stream().noneMatch(delegate -> accepts(check, delegate))) {
            throw new TrustFailureException();
        }
    }

    private static boolean accepts(TrustCheck check, X509TrustManager delegate) {
        try {
            check.verify(delegate);
            return true;
        } catch (CertificateException rejected) {
            return false;
        }
    }

    private static X509TrustManager trustManagerFor(KeyStore keyStore) throws GeneralSecurityException {
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(keyStore);
        for (TrustManager trustManager : factory.getTrustManagers()) {
            if (trustManager instanceof X509TrustManager x509) {
                return x509;
            }
        }
        throw new GeneralSecurityException("No X509TrustManager available for " + factory.getAlgorithm());
    }

    /** One role-specific validation call against a single delegate. */
    @FunctionalInterface
    private interface TrustCheck {
        void verify(X509TrustManager delegate) throws CertificateException;
    }
}
