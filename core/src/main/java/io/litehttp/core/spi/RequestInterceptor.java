package io.litehttp.core.spi;

import io.litehttp.core.model.Request;

/**
 * Hook for cross-cutting request mutation, such as adding authentication
 * headers or rewriting the URL.
 *
 * <p>
 * Interceptors receive the live request and modify it in place. They run in
 * registration order before every dispatch, including the follow-up GET sent
 * for a redirect. An exception thrown by an interceptor is not caught: it
 * aborts the execution and propagates to the caller of
 * {@link io.litehttp.core.engine.HttpClient#execute}.
 */
@FunctionalInterface
public interface RequestInterceptor {

    /**
     * Mutates the request before it is sent.
     *
     * @param request the request about to be dispatched
     */
    void intercept(Request request);
}
