package io.litehttp.core.engine;

import io.litehttp.core.model.Request;
import io.litehttp.core.spi.RequestInterceptor;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, mutable list of {@link RequestInterceptor}s.
 *
 * <p>
 * Thread-safe: backed by a {@link CopyOnWriteArrayList}, so {@link #apply}
 * iterates over a snapshot and registrations made while a request is in
 * flight take effect from the next dispatch on.
 */
public final class InterceptorChain {

    private final List<RequestInterceptor> interceptors = new CopyOnWriteArrayList<>();

    public void add(RequestInterceptor interceptor) {
        interceptors.add(Objects.requireNonNull(interceptor, "interceptor must not be null"));
    }

    /**
     * Removes the first registration of the interceptor.
     *
     * @return {@code true} if it was registered
     */
    public boolean remove(RequestInterceptor interceptor) {
        return interceptors.remove(interceptor);
    }

    public void clear() {
        interceptors.clear();
    }

    public int size() {
        return interceptors.size();
    }

    /** Runs every interceptor once, in registration order, on the same request instance. */
    public void apply(Request request) {
        for (RequestInterceptor interceptor : interceptors) {
            interceptor.intercept(request);
        }
    }
}
