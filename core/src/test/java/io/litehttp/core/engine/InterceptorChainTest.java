package io.litehttp.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.litehttp.core.model.GetRequest;
import io.litehttp.core.model.Header;
import io.litehttp.core.model.Request;
import io.litehttp.core.spi.RequestInterceptor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InterceptorChain")
class InterceptorChainTest {

    private final InterceptorChain chain = new InterceptorChain();
    private final Request request = new GetRequest("http://example.com/");

    @Test
    @DisplayName("Empty chain leaves the request untouched")
    void empty_noop() {
        chain.apply(request);

        assertThat(request.url()).isEqualTo("http://example.com/");
        assertThat(request.headers()).isEmpty();
    }

    @Test
    @DisplayName("Each interceptor sees the mutations of the ones before it")
    void mutationsVisibleDownstream() {
        chain.add(r -> r.addHeader("X-Step", "1"));
        chain.add(r -> r.addHeader("X-Step", String.valueOf(r.headers().size() + 1)));

        chain.apply(request);

        assertThat(request.headers()).extracting(Header::value).containsExactly("1", "2");
    }

    @Test
    @DisplayName("Same interceptor registered twice runs twice; remove drops one registration")
    void duplicateRegistration() {
        List<String> calls = new ArrayList<>();
        RequestInterceptor interceptor = r -> calls.add("x");
        chain.add(interceptor);
        chain.add(interceptor);

        assertThat(chain.remove(interceptor)).isTrue();
        chain.apply(request);

        assertThat(calls).hasSize(1);
        assertThat(chain.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Removing an unknown interceptor reports false")
    void removeUnknown() {
        assertThat(chain.remove(r -> {})).isFalse();
    }

    @Test
    @DisplayName("clear empties the chain")
    void clear() {
        chain.add(r -> {});
        chain.add(r -> {});

        chain.clear();

        assertThat(chain.size()).isZero();
    }

    @Test
    @DisplayName("Registration during apply takes effect from the next apply")
    void registrationDuringApply() {
        List<String> calls = new ArrayList<>();
        chain.add(r -> {
            calls.add("outer");
            if (calls.size() == 1) {
                chain.add(inner -> calls.add("late"));
            }
        });

        chain.apply(request);
        assertThat(calls).containsExactly("outer");

        chain.apply(request);
        assertThat(calls).containsExactly("outer", "outer", "late");
    }

    @Test
    @DisplayName("null interceptor is rejected")
    void nullRejected() {
        assertThatThrownBy(() -> chain.add(null)).isInstanceOf(NullPointerException.class);
    }
}
