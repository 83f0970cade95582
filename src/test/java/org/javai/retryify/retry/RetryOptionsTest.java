package org.javai.retryify.retry;

import org.javai.retryify.ops.RetryReporter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.*;

class RetryOptionsTest {

    @Test
    void defaults_matchDocumentedPolicy() throws Exception {
        RetryOptions options = RetryOptions.defaults();

        assertThat(options.maxRetries()).isEqualTo(5);
        assertThat(options.retryDelay().delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(options.retryDelay().delayFor(4)).isEqualTo(Duration.ofMillis(500));
        assertThat(options.shouldRetry().test(new IOException())).isTrue();
        assertThat(options.memberSelector().test("_anything")).isTrue();
        assertThat(options.onExhausted()).isEmpty();
        assertThat(options.attemptTimeout()).isEmpty();
        assertThat(options.unlimited()).isFalse();

        CompletionStage<?> hook = options.beforeRetry().beforeRetry(1, new Object[0]);
        assertThat(hook.toCompletableFuture()).isCompleted();
    }

    @Test
    void builder_overridesOnlyGivenKeys() {
        RetryOptions options = RetryOptions.builder()
                .maxRetries(2)
                .shouldRetry(err -> false)
                .build();

        assertThat(options.maxRetries()).isEqualTo(2);
        assertThat(options.shouldRetry().test(new IOException())).isFalse();
        assertThat(options.retryDelay().delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(options.memberSelector().test("any")).isTrue();
    }

    @Test
    void builder_nullKeepsDefault() {
        RetryOptions options = RetryOptions.builder()
                .retryDelay((Duration) null)
                .shouldRetry(null)
                .beforeRetry(null)
                .memberSelector(null)
                .onExhausted(null)
                .reporter(null)
                .timer(null)
                .build();

        assertThat(options.retryDelay().delayFor(3)).isEqualTo(RetryOptions.DEFAULT_RETRY_DELAY);
        assertThat(options.shouldRetry().test(new IllegalStateException())).isTrue();
        assertThat(options.onExhausted()).isEmpty();
        assertThat(options.reporter()).isNotNull();
        assertThat(options.timer()).isNotNull();
    }

    @Test
    void unlimitedRetries_removesCeiling() {
        RetryOptions options = RetryOptions.builder().unlimitedRetries().build();

        assertThat(options.unlimited()).isTrue();
        assertThat(options.maxRetries()).isEqualTo(RetryOptions.UNLIMITED);
    }

    @Test
    void toBuilder_derivesVariantWithoutChangingOriginal() {
        RetryReporter reporter = new RetryReporter() {};
        ExhaustionListener listener = (failure, args) -> {};
        RetryOptions original = RetryOptions.builder()
                .maxRetries(1)
                .reporter(reporter)
                .onExhausted(listener)
                .attemptTimeout(Duration.ofSeconds(2))
                .build();

        RetryOptions variant = original.toBuilder().maxRetries(7).build();

        assertThat(original.maxRetries()).isEqualTo(1);
        assertThat(variant.maxRetries()).isEqualTo(7);
        assertThat(variant.reporter()).isSameAs(reporter);
        assertThat(variant.onExhausted()).containsSame(listener);
        assertThat(variant.attemptTimeout()).contains(Duration.ofSeconds(2));
    }
}
