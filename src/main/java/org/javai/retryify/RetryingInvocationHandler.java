package org.javai.retryify;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;

/**
 * Routes proxy calls either to a decorated operation or straight to the target.
 */
final class RetryingInvocationHandler implements InvocationHandler {

    private final Object target;
    private final Map<Method, AsyncOperation> decorated;

    RetryingInvocationHandler(Object target, Map<Method, AsyncOperation> decorated) {
        this.target = target;
        this.decorated = Map.copyOf(decorated);
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }
        AsyncOperation operation = decorated.get(method);
        if (operation != null) {
            return operation.invoke(args != null ? args : new Object[0]);
        }
        // Interfaces need not be public; the proxy's Method instances are not yet opened.
        method.trySetAccessible();
        return invokeTarget(target, method, args);
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) throws Exception {
        return switch (method.getName()) {
            case "equals" -> proxy == args[0];
            case "hashCode" -> System.identityHashCode(proxy);
            default -> invokeTarget(target, method, args);
        };
    }

    /**
     * Calls {@code method} on {@code target}, rethrowing whatever the target threw.
     */
    static Object invokeTarget(Object target, Method method, Object[] args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
