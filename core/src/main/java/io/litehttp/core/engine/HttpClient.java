package io.litehttp.core.engine;

import io.litehttp.core.config.HttpClientConfiguration;
import io.litehttp.core.error.HttpClientException;
import io.litehttp.core.error.RedirectException;
import io.litehttp.core.error.TlsSetupException;
import io.litehttp.core.error.TooManyRedirectsException;
import io.litehttp.core.error.TransportException;
import io.litehttp.core.error.UnsuccessfulStatusException;
import io.litehttp.core.model.DeleteRequest;
import io.litehttp.core.model.GetRequest;
import io.litehttp.core.model.HeadRequest;
import io.litehttp.core.model.Header;
import io.litehttp.core.model.HttpResult;
import io.litehttp.core.model.OptionsRequest;
import io.litehttp.core.model.PatchRequest;
import io.litehttp.core.model.PostRequest;
import io.litehttp.core.model.PutRequest;
import io.litehttp.core.model.Request;
import io.litehttp.core.model.RequestWithBody;
import io.litehttp.core.model.Response;
import io.litehttp.core.security.CertificateLoader;
import io.litehttp.core.security.CompositeTrustManager;
import io.litehttp.core.spi.RequestInterceptor;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous HTTP client for JSON APIs.
 *
 * <p>
 * Each call to {@link #execute} runs the registered
 * {@link RequestInterceptor}s over the request, sends it over HTTP/1.1 on the
 * calling thread and blocks until the complete response, body included, has
 * arrived. The body is buffered in memory. The status then decides the
 * outcome:
 * <ul>
 * <li>2xx — {@link HttpResult#success} with the body read as UTF-8 text
 * <li>3xx — followed with a GET to {@code Location} when redirects are
 * enabled, otherwise a {@link RedirectException}
 * <li>anything else — an {@link UnsuccessfulStatusException} carrying the
 * error body
 * </ul>
 * Network and TLS failures become a {@link TransportException}, as does an
 * exchange that outlasts the connect timeout plus the read timeout. Failures are
 * returned, never thrown; only exceptions raised by interceptors propagate.
 *
 * <p>
 * The TLS context, its {@link CompositeTrustManager} and the underlying JDK
 * client are built once in the constructor. Instances are thread-safe and meant
 * to be reused.
 */
public final class HttpClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpClient.class);

    static final String ACCEPT_JSON = "application/json";
    static final String CONTENT_TYPE_JSON = "application/json; utf-8";

    /** Headers the JDK client manages itself and refuses to accept from callers. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClientConfiguration configuration;
    private final InterceptorChain interceptors = new InterceptorChain();
    private final CompositeTrustManager trustManager;
    private final java.net.http.HttpClient transport;
    private final long exchangeTimeoutMs;

    /** Creates a client with the default configuration. */
    public HttpClient() {
        this(HttpClientConfiguration.defaults());
    }

    /**
     * Creates a client. A configured trust certificate is parsed here and its
     * stream closed.
     *
     * @param configuration the client configuration
     * @throws TlsSetupException if the trust certificate cannot be parsed or the
     *                           TLS context cannot be initialized
     */
    public HttpClient(HttpClientConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
        this.trustManager = buildTrustManager(configuration);

        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NEVER)
                .sslContext(buildSslContext(trustManager));
        if (configuration.connectTimeoutMs() > 0) {
            builder.connectTimeout(Duration.ofMillis(configuration.connectTimeoutMs()));
        }
        this.transport = builder.build();
        this.exchangeTimeoutMs = exchangeTimeoutMs(configuration);

        LOG.debug(
                "HttpClient initialized: connectTimeoutMs={}, readTimeoutMs={}, followRedirects={}, "
                        + "maxRedirects={}, trustDelegates={}",
                configuration.connectTimeoutMs(),
                configuration.readTimeoutMs(),
                configuration.followRedirects(),
                configuration.maxRedirects(),
                trustManager.delegateCount());
    }

    public HttpClientConfiguration configuration() {
        return configuration;
    }

    // --- Interceptors ---

    public void addRequestInterceptor(RequestInterceptor interceptor) {
        interceptors.add(interceptor);
    }

    public void removeRequestInterceptor(RequestInterceptor interceptor) {
        interceptors.remove(interceptor);
    }

    public void removeAllRequestInterceptors() {
        interceptors.clear();
    }

    // --- Per-method entry points ---

    public HttpResult executeGetRequest(GetRequest request) {
        return execute(request);
    }

    public HttpResult executePostRequest(PostRequest request) {
        return execute(request);
    }

    public HttpResult executePutRequest(PutRequest request) {
        return execute(request);
    }

    public HttpResult executeDeleteRequest(DeleteRequest request) {
        return execute(request);
    }

    public HttpResult executeHeadRequest(HeadRequest request) {
        return execute(request);
    }

    public HttpResult executeOptionsRequest(OptionsRequest request) {
        return execute(request);
    }

    public HttpResult executePatchRequest(PatchRequest request) {
        return execute(request);
    }

    /**
     * Executes a request and classifies the outcome.
     *
     * @param request the request; interceptors may mutate it
     * @return a SUCCESS result for 2xx responses, a FAILURE result otherwise
     */
    public HttpResult execute(Request request) {
        Objects.requireNonNull(request, "request must not be null");
        return execute(request, 0);
    }

    private HttpResult execute(Request request, int redirectHops) {
        interceptors.apply(request);

        String requestUrl = request.url();
        URI uri;
        try {
            uri = toRequestUri(requestUrl);
        } catch (MalformedURLException e) {
            return failure(request, new TransportException(requestUrl, e));
        }

        LOG.debug("Dispatching {} {}", request.method(), requestUrl);

        HttpResponse<String> response;
        try {
            response = exchange(toHttpRequest(request, uri));
        } catch (IOException e) {
            return failure(request, new TransportException(requestUrl, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while awaiting response");
            interrupted.initCause(e);
            return failure(request, new TransportException(requestUrl, interrupted));
        }

        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";
        LOG.debug("{} {} → {}", request.method(), requestUrl, status);

        if (isSuccessful(status)) {
            return HttpResult.success(new Response(status, body, collectHeaders(response.headers())));
        }
        if (!isRedirect(status) || !configuration.followRedirects()) {
            return failure(
                    request,
                    isRedirect(status)
                            ? new RedirectException(requestUrl, status, body)
                            : new UnsuccessfulStatusException(requestUrl, status, body));
        }
        Optional<String> location = response.headers().firstValue("Location");
        if (location.isEmpty()) {
            return failure(request, new RedirectException(requestUrl, status, RedirectException.NO_LOCATION_HEADER));
        }
        return followRedirect(request, uri, location.get(), redirectHops);
    }

    /**
     * Sends the request and waits for the complete response, body included.
     * When a read timeout is configured the whole exchange is bounded by the
     * connect timeout plus the read timeout; on expiry the exchange is
     * cancelled and an {@link HttpTimeoutException} is thrown.
     */
    private HttpResponse<String> exchange(HttpRequest httpRequest) throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<String>> future =
                transport.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        try {
            return exchangeTimeoutMs > 0 ? future.get(exchangeTimeoutMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException("Response not completed within " + exchangeTimeoutMs + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause);
        }
    }

    private HttpResult followRedirect(Request request, URI base, String location, int redirectHops) {
        if (redirectHops >= configuration.maxRedirects()) {
            return failure(request, new TooManyRedirectsException(request.url(), configuration.maxRedirects()));
        }

        String target;
        try {
            target = base.resolve(parseUri(location)).toString();
        } catch (MalformedURLException e) {
            return failure(request, new TransportException(request.url(), e));
        }

        GetRequest redirect = new GetRequest(target);
        redirect.headers().addAll(request.headers());

        LOG.debug(
                "Following redirect {} → {} (hop {}/{})",
                request.url(),
                target,
                redirectHops + 1,
                configuration.maxRedirects());
        return execute(redirect, redirectHops + 1);
    }

    private HttpRequest toHttpRequest(Request request, URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);
        if (configuration.readTimeoutMs() > 0) {
            builder.timeout(Duration.ofMillis(configuration.readTimeoutMs()));
        }

        builder.header("Accept", ACCEPT_JSON);
        for (Header header : request.headers()) {
            if (RESTRICTED_HEADERS.contains(header.name().toLowerCase(Locale.ROOT))) {
                LOG.debug("Skipping header '{}': managed by the transport", header.name());
                continue;
            }
            builder.header(header.name(), header.value());
        }

        if (request instanceof RequestWithBody withBody) {
            builder.setHeader("Content-Type", CONTENT_TYPE_JSON);
            byte[] bytes = withBody.body().getBytes(StandardCharsets.UTF_8);
            builder.method(request.method().name(), HttpRequest.BodyPublishers.ofByteArray(bytes));
        } else {
            builder.method(request.method().name(), HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    /** Package-private for testing. */
    CompositeTrustManager trustManager() {
        return trustManager;
    }

    private static HttpResult failure(Request request, HttpClientException error) {
        if (error instanceof TransportException) {
            LOG.warn("{} {} failed: {}", request.method(), request.url(), error.getCause().toString());
        } else {
            LOG.debug("{} {} failed: {}", request.method(), request.url(), error.getMessage());
        }
        return HttpResult.failure(error);
    }

    /** Total time allowed for one exchange, or {@code 0} for no limit. */
    private static long exchangeTimeoutMs(HttpClientConfiguration configuration) {
        if (configuration.readTimeoutMs() == 0) {
            return 0;
        }
        return (long) configuration.readTimeoutMs() + configuration.connectTimeoutMs();
    }

    /** Joins repeated fields of the same name with commas. */
    private static Map<String, String> collectHeaders(java.net.http.HttpHeaders headers) {
        Map<String, String> collected = new LinkedHashMap<>();
        headers.map().forEach((name, values) -> collected.put(name, String.join(",", values)));
        return collected;
    }

    /** Parses an absolute {@code http} or {@code https} URL with a host. */
    private static URI toRequestUri(String url) throws MalformedURLException {
        URI uri = parseUri(url);
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new MalformedURLException("Unsupported URL scheme: " + url);
        }
        // URI leaves the host undefined for names that are not valid hostnames, e.g. "my_service"
        if (uri.getHost() == null) {
            throw new MalformedURLException("URL has no valid host name: " + url);
        }
        return uri;
    }

    private static URI parseUri(String value) throws MalformedURLException {
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            MalformedURLException malformed = new MalformedURLException("Malformed URL: " + value);
            malformed.initCause(e);
            throw malformed;
        }
    }

    private static boolean isSuccessful(int status) {
        return status >= 200 && status <= 299;
    }

    private static boolean isRedirect(int status) {
        return status >= 300 && status <= 399;
    }

    private static CompositeTrustManager buildTrustManager(HttpClientConfiguration configuration) {
        try {
            List<KeyStore> keyStores = configuration.hasCustomCertificate()
                    ? List.of(CertificateLoader.loadKeyStore(configuration.certificateInputStream()))
                    : List.of();
            return CompositeTrustManager.withDefaults(keyStores);
        } catch (GeneralSecurityException | IOException e) {
            throw new TlsSetupException("Failed to load trusted certificate", e);
        }
    }

    private static SSLContext buildSslContext(CompositeTrustManager trustManager) {
        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[] {trustManager}, null);
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new TlsSetupException("Failed to initialize TLS context", e);
        }
    }
}
