package io.litehttp.core.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.InputStream;
import java.security.KeyStore;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.List;
import javax.net.ssl.X509TrustManager;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CompositeTrustManager")
class CompositeTrustManagerTest {

    private static X509Certificate serverCert;
    private static X509Certificate otherCert;
    private static X509Certificate[] chain;

    @BeforeAll
    static void loadCertificates() throws Exception {
        serverCert = certificate("tls/server.pem");
        otherCert = certificate("tls/other.pem");
        chain = new X509Certificate[] {serverCert};
    }

    static X509Certificate certificate(String resource) throws Exception {
        try (InputStream in = CompositeTrustManagerTest.class.getClassLoader().getResourceAsStream(resource)) {
            return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
        }
    }

    private static X509TrustManager accepting(X509Certificate... issuers) {
        X509TrustManager delegate = mock(X509TrustManager.class);
        when(delegate.getAcceptedIssuers()).thenReturn(issuers);
        return delegate;
    }

    private static X509TrustManager rejecting() throws CertificateException {
        X509TrustManager delegate = mock(X509TrustManager.class);
        doThrow(new CertificateException("untrusted")).when(delegate).checkServerTrusted(any(), anyString());
        doThrow(new CertificateException("untrusted")).when(delegate).checkClientTrusted(any(), anyString());
        when(delegate.getAcceptedIssuers()).thenReturn(new X509Certificate[0]);
        return delegate;
    }

    @Nested
    @DisplayName("Chain validation")
    class Validation {

        @Test
        @DisplayName("Chain accepted when a later delegate trusts it")
        void secondDelegateAccepts() throws Exception {
            CompositeTrustManager trustManager = new CompositeTrustManager(List.of(rejecting(), accepting()));

            assertThatCode(() -> trustManager.checkServerTrusted(chain, "RSA")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("First accepting delegate ends the evaluation")
        void shortCircuits() throws Exception {
            X509TrustManager first = accepting();
            X509TrustManager second = accepting();
            CompositeTrustManager trustManager = new CompositeTrustManager(List.of(first, second));

            trustManager.checkServerTrusted(chain, "RSA");

            verify(first).checkServerTrusted(chain, "RSA");
            verify(second, never()).checkServerTrusted(any(), anyString());
        }

        @Test
        @DisplayName("Every delegate rejecting → TrustFailureException without delegate detail")
        void allReject() throws Exception {
            CompositeTrustManager trustManager = new CompositeTrustManager(List.of(rejecting(), rejecting()));

            assertThatThrownBy(() -> trustManager.checkServerTrusted(chain, "RSA"))
                    .isInstanceOf(TrustFailureException.class)
                    .hasMessage("None of the trust managers trust this certificate chain")
                    .hasNoCause();
        }

        @Test
        @DisplayName("Client role is evaluated the same way")
        void clientRole() throws Exception {
            X509TrustManager accepting = accepting();
            CompositeTrustManager trustManager = new CompositeTrustManager(List.of(rejecting(), accepting));

            trustManager.checkClientTrusted(chain, "RSA");

            verify(accepting).checkClientTrusted(chain, "RSA");
            assertThatThrownBy(() -> new CompositeTrustManager(List.of(rejecting())).checkClientTrusted(chain, "RSA"))
                    .isInstanceOf(TrustFailureException.class);
        }

        @Test
        @DisplayName("Empty delegate list is rejected")
        void emptyDelegates() {
            assertThatThrownBy(() -> new CompositeTrustManager(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Accepted issuers")
    class Issuers {

        @Test
        @DisplayName("Issuers of all delegates are concatenated in order, duplicates kept")
        void concatenated() {
            CompositeTrustManager trustManager = new CompositeTrustManager(List.of(
                    accepting(serverCert, otherCert), accepting(), accepting(serverCert)));

            assertThat(trustManager.getAcceptedIssuers()).containsExactly(serverCert, otherCert, serverCert);
        }
    }

    @Nested
    @DisplayName("Platform defaults")
    class Defaults {

        @Test
        @DisplayName("withDefaults adds the platform trust manager first")
        void platformOnly() throws Exception {
            CompositeTrustManager trustManager = CompositeTrustManager.withDefaults(List.of());

            assertThat(trustManager.delegateCount()).isEqualTo(1);
            assertThat(trustManager.getAcceptedIssuers()).isNotEmpty();
            assertThatThrownBy(() -> trustManager.checkServerTrusted(chain, "RSA"))
                    .isInstanceOf(TrustFailureException.class);
        }

        @Test
        @DisplayName("Custom store makes its certificate trusted and issuers grow by one")
        void customStore() throws Exception {
            KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
            store.load(null, null);
            store.setCertificateEntry("server", serverCert);

            CompositeTrustManager platform = CompositeTrustManager.withDefaults(List.of());
            CompositeTrustManager trustManager = CompositeTrustManager.withDefaults(List.of(store));

            assertThat(trustManager.delegateCount()).isEqualTo(2);
            assertThat(trustManager.getAcceptedIssuers()).hasSize(platform.getAcceptedIssuers().length + 1);
            assertThatCode(() -> trustManager.checkServerTrusted(chain, "RSA")).doesNotThrowAnyException();
        }
    }
}
