package org.javai.retryify.retry;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Ready-made retry conditions for {@link RetryOptions.Builder#shouldRetry(Predicate)}.
 */
public final class RetryConditions {

    private RetryConditions() {}

    public static Predicate<Throwable> always() {
        return failure -> true;
    }

    public static Predicate<Throwable> never() {
        return failure -> false;
    }

    /**
     * Retries when the failure is an instance of any of the given types.
     */
    @SafeVarargs
    public static Predicate<Throwable> instanceOf(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> accepted = List.of(types);
        return failure -> matches(accepted, failure);
    }

    /**
     * Retries when the failure, or any exception in its cause chain, is an instance of
     * any of the given types.
     */
    @SafeVarargs
    public static Predicate<Throwable> causedBy(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> accepted = List.of(types);
        return failure -> {
            Throwable current = failure;
            // Bounded walk; some libraries build cyclic cause chains.
            for (int depth = 0; current != null && depth < 32; depth++) {
                if (matches(accepted, current)) {
                    return true;
                }
                current = current.getCause();
            }
            return false;
        };
    }

    private static boolean matches(List<Class<? extends Throwable>> types, Throwable failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }
}
