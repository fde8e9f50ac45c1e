package io.litehttp.core.model;

import io.litehttp.core.error.HttpClientException;
import java.util.Objects;

/**
 * Outcome of executing a request. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS} — the server answered with a 2xx status;
 * {@link #response()} holds the response.
 * <li>{@link Type#FAILURE} — the exchange failed or was classified as an
 * error; {@link #error()} holds the typed cause.
 * </ul>
 *
 * <p>
 * Callers branch on the error's concrete type to decide remediation, for
 * example by inspecting
 * {@link io.litehttp.core.error.UnsuccessfulStatusException#statusCode()}.
 */
public final class HttpResult {

    /** The type of outcome. */
    public enum Type {
        SUCCESS,
        FAILURE
    }

    private final Type type;
    private final Response response;
    private final HttpClientException error;

    private HttpResult(Type type, Response response, HttpClientException error) {
        this.type = type;
        this.response = response;
        this.error = error;
    }

    /** Creates a SUCCESS result. */
    public static HttpResult success(Response response) {
        Objects.requireNonNull(response, "response must not be null for SUCCESS");
        return new HttpResult(Type.SUCCESS, response, null);
    }

    /** Creates a FAILURE result. */
    public static HttpResult failure(HttpClientException error) {
        Objects.requireNonNull(error, "error must not be null for FAILURE");
        return new HttpResult(Type.FAILURE, null, error);
    }

    public Type type() {
        return type;
    }

    /** Returns the response. Only valid when {@code type() == SUCCESS}. */
    public Response response() {
        return response;
    }

    /** Returns the failure cause. Only valid when {@code type() == FAILURE}. */
    public HttpClientException error() {
        return error;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isFailure() {
        return type == Type.FAILURE;
    }

    /**
     * Returns the response, or throws the failure cause.
     *
     * @throws HttpClientException if this is a FAILURE result
     */
    public Response getOrThrow() throws HttpClientException {
        if (type == Type.FAILURE) {
            throw error;
        }
        return response;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "HttpResult[SUCCESS, status=" + response.statusCode() + "]";
            case FAILURE -> "HttpResult[FAILURE, " + error.getClass().getSimpleName() + "]";
        };
    }
}
