package io.litehttp.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link HttpClientConfiguration} from a YAML file with an optional
 * environment variable overlay.
 *
 * <pre>
 * http-client:
 *   read-timeout-ms: 5000
 *   connect-timeout-ms: 2000
 *   follow-redirects: true
 *   max-redirects: 5
 *   tls:
 *     certificate: /etc/ssl/private-ca.pem
 * </pre>
 *
 * <p>
 * Missing keys receive the defaults of {@link HttpClientConfiguration.Builder}.
 * Environment variables take precedence over YAML values. A variable counts as
 * set only if it is defined and its trimmed value is non-empty.
 *
 * <p>
 * The certificate file, if any, is opened during loading; the resulting
 * configuration should be handed to an
 * {@link io.litehttp.core.engine.HttpClient}, which consumes and closes it.
 */
public final class ConfigLoader {

    static final String ENV_READ_TIMEOUT_MS = "HTTP_CLIENT_READ_TIMEOUT_MS";
    static final String ENV_CONNECT_TIMEOUT_MS = "HTTP_CLIENT_CONNECT_TIMEOUT_MS";
    static final String ENV_FOLLOW_REDIRECTS = "HTTP_CLIENT_FOLLOW_REDIRECTS";
    static final String ENV_MAX_REDIRECTS = "HTTP_CLIENT_MAX_REDIRECTS";
    static final String ENV_TLS_CERTIFICATE = "HTTP_CLIENT_TLS_CERTIFICATE";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a configuration from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or
     *                             holds invalid values
     */
    public static HttpClientConfiguration load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a configuration from the given YAML file, applying overrides from
     * the supplied lookup function. The function returns {@code null} for
     * undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or
     *                             holds invalid values
     */
    public static HttpClientConfiguration load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return mapToConfig(root != null ? root.path("http-client") : YAML_MAPPER.missingNode(), envLookup);
    }

    /** Builds a configuration from environment variables and defaults only. */
    public static HttpClientConfiguration fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
    }

    private static HttpClientConfiguration mapToConfig(JsonNode section, Function<String, String> envLookup) {
        HttpClientConfiguration.Builder builder = HttpClientConfiguration.builder();
        try {
            // --- YAML mapping ---
            if (section.has("read-timeout-ms"))
                builder.readTimeoutMs(section.get("read-timeout-ms").asInt());
            if (section.has("connect-timeout-ms"))
                builder.connectTimeoutMs(section.get("connect-timeout-ms").asInt());
            if (section.has("follow-redirects"))
                builder.followRedirects(section.get("follow-redirects").asBoolean());
            if (section.has("max-redirects"))
                builder.maxRedirects(section.get("max-redirects").asInt());
            String certificate = textOrNull(section.path("tls"), "certificate");

            // --- Environment variable overlay ---
            envInt(envLookup, ENV_READ_TIMEOUT_MS, builder::readTimeoutMs);
            envInt(envLookup, ENV_CONNECT_TIMEOUT_MS, builder::connectTimeoutMs);
            envBool(envLookup, ENV_FOLLOW_REDIRECTS, builder::followRedirects);
            envInt(envLookup, ENV_MAX_REDIRECTS, builder::maxRedirects);
            certificate = envStringOrDefault(envLookup, ENV_TLS_CERTIFICATE, certificate);

            if (certificate != null) {
                builder.certificateInputStream(openCertificate(Path.of(certificate)));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid HTTP client configuration: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static InputStream openCertificate(Path certificatePath) {
        if (!Files.isRegularFile(certificatePath)) {
            throw new ConfigLoadException("TLS certificate file not found: " + certificatePath);
        }
        try {
            return Files.newInputStream(certificatePath);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to open TLS certificate: " + certificatePath, e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " is not an integer: " + raw, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.has(field) ? node.get(field).asText() : null;
    }
}
