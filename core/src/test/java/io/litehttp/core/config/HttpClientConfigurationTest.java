package io.litehttp.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HttpClientConfiguration")
class HttpClientConfigurationTest {

    @Test
    @DisplayName("Defaults: 3000 ms timeouts, redirects followed up to 10 hops, no certificate")
    void defaults() {
        HttpClientConfiguration config = HttpClientConfiguration.defaults();

        assertThat(config.readTimeoutMs()).isEqualTo(3000);
        assertThat(config.connectTimeoutMs()).isEqualTo(3000);
        assertThat(config.followRedirects()).isTrue();
        assertThat(config.maxRedirects()).isEqualTo(10);
        assertThat(config.certificateInputStream()).isNull();
        assertThat(config.hasCustomCertificate()).isFalse();
    }

    @Test
    @DisplayName("Builder values are carried over")
    void builderValues() {
        ByteArrayInputStream cert = new ByteArrayInputStream(new byte[0]);

        HttpClientConfiguration config = HttpClientConfiguration.builder()
                .readTimeoutMs(0)
                .connectTimeoutMs(250)
                .followRedirects(false)
                .maxRedirects(2)
                .certificateInputStream(cert)
                .build();

        assertThat(config.readTimeoutMs()).isZero();
        assertThat(config.connectTimeoutMs()).isEqualTo(250);
        assertThat(config.followRedirects()).isFalse();
        assertThat(config.maxRedirects()).isEqualTo(2);
        assertThat(config.certificateInputStream()).isSameAs(cert);
        assertThat(config.hasCustomCertificate()).isTrue();
    }

    @Test
    @DisplayName("Negative values are rejected by builder and constructor")
    void negativeRejected() {
        assertThatThrownBy(() -> HttpClientConfiguration.builder().readTimeoutMs(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Read timeout must be non-negative: -1");
        assertThatThrownBy(() -> HttpClientConfiguration.builder().connectTimeoutMs(-5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Connect timeout must be non-negative: -5");
        assertThatThrownBy(() -> HttpClientConfiguration.builder().maxRedirects(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HttpClientConfiguration(3000, -1, null, true, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
