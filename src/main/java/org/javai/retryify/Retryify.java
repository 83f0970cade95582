package org.javai.retryify;

import org.javai.retryify.retry.RetryEngine;
import org.javai.retryify.retry.RetryOptions;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Produces retrying versions of asynchronous operations while keeping their call surface.
 *
 * <p>Three surfaces are supported:</p>
 * <ul>
 *   <li>a single {@link AsyncOperation};</li>
 *   <li>a map of named members, where each selected {@link AsyncOperation} value is decorated
 *       and every other value is copied by reference;</li>
 *   <li>an object seen through an interface, where each selected method returning a
 *       {@link java.util.concurrent.CompletionStage} (or any supertype of
 *       {@link CompletableFuture}) is decorated, inherited interface methods included.</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TrackApi retrying = Retryify.decorate(TrackApi.class, client, RetryOptions.builder()
 *     .maxRetries(1)
 *     .retryDelay(Duration.ofMillis(100))
 *     .shouldRetry(err -> err instanceof ApiException api && api.status() == 401)
 *     .beforeRetry((attempt, args) -> client.refreshAccessToken())
 *     .memberSelector(MemberSelectors.publicNames())
 *     .build());
 * }</pre>
 *
 * <p>Decoration never mutates the input. Each decorated surface is an independent retry
 * domain: calls share the immutable options but never their attempt counters.</p>
 */
public final class Retryify {

    static final String ANONYMOUS = "anonymous";

    private Retryify() {}

    public static AsyncOperation decorate(AsyncOperation operation) {
        return decorate(ANONYMOUS, operation, RetryOptions.defaults());
    }

    public static AsyncOperation decorate(AsyncOperation operation, RetryOptions options) {
        return decorate(ANONYMOUS, operation, options);
    }

    /**
     * Decorates a single operation.
     *
     * @param name the name used when reporting retry events
     * @param operation the operation to decorate
     * @param options the retry policy
     * @return the decorated operation
     */
    public static AsyncOperation decorate(String name, AsyncOperation operation, RetryOptions options) {
        return new RetryEngine(options).decorate(name, operation);
    }

    /**
     * Decorates every selected {@link AsyncOperation} in a map of named members.
     *
     * @param members the original members, left untouched
     * @param options the retry policy; its member selector picks which operations are decorated
     * @return a new mutable map with the same keys, in the same iteration order
     */
    public static Map<String, Object> decorate(Map<String, ?> members, RetryOptions options) {
        Objects.requireNonNull(members, "members must not be null");
        RetryEngine engine = new RetryEngine(options);

        Map<String, Object> surface = new LinkedHashMap<>();
        for (Map.Entry<String, ?> member : members.entrySet()) {
            String name = member.getKey();
            Object value = member.getValue();
            if (value instanceof AsyncOperation operation && options.memberSelector().test(name)) {
                surface.put(name, engine.decorate(name, operation));
            } else {
                surface.put(name, value);
            }
        }
        return surface;
    }

    /**
     * Decorates an object through one of its interfaces.
     *
     * <p>Methods that are not selected, or whose return type cannot hold a
     * {@link CompletableFuture}, are delegated to {@code target} unchanged. {@code toString}
     * is delegated; {@code equals} and {@code hashCode} follow proxy identity.</p>
     *
     * @param type the interface describing the call surface
     * @param target the object to decorate, left untouched
     * @param options the retry policy; its member selector is applied to method names
     * @return a proxy implementing {@code type}
     * @throws IllegalArgumentException if {@code type} is not an interface
     */
    public static <T> T decorate(Class<T> type, T target, RetryOptions options) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (!type.isInterface()) {
            throw new IllegalArgumentException(type.getName() + " is not an interface");
        }
        RetryEngine engine = new RetryEngine(options);

        Map<Method, AsyncOperation> decorated = new HashMap<>();
        // getMethods() includes methods inherited from super-interfaces
        for (Method method : type.getMethods()) {
            method.trySetAccessible();
            if (!isAsync(method) || !options.memberSelector().test(method.getName())) {
                continue;
            }
            String name = type.getSimpleName() + "." + method.getName();
            decorated.put(method, engine.decorate(name,
                    arguments -> RetryingInvocationHandler.invokeTarget(target, method, arguments)));
        }

        Object proxy = Proxy.newProxyInstance(
                type.getClassLoader(),
                new Class<?>[] {type},
                new RetryingInvocationHandler(target, decorated));
        return type.cast(proxy);
    }

    private static boolean isAsync(Method method) {
        return !Modifier.isStatic(method.getModifiers())
                && method.getReturnType().isAssignableFrom(CompletableFuture.class);
    }
}
