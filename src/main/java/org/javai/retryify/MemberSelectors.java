package org.javai.retryify;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Ready-made member selectors for {@link org.javai.retryify.retry.RetryOptions.Builder#memberSelector(Predicate)}.
 */
public final class MemberSelectors {

    private MemberSelectors() {}

    public static Predicate<String> all() {
        return name -> true;
    }

    /**
     * Skips members whose names start with an underscore, the usual marker for
     * internal helpers on client objects.
     */
    public static Predicate<String> publicNames() {
        return name -> !name.startsWith("_");
    }

    public static Predicate<String> named(String... names) {
        Set<String> selected = Set.of(names);
        return selected::contains;
    }

    public static Predicate<String> excluding(String... names) {
        Set<String> excluded = Set.of(names);
        return name -> !excluded.contains(name);
    }
}
