package org.arpha.routing.target;

import lombok.extern.slf4j.Slf4j;
import org.arpha.exception.ActionInvocationException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public final class Reflections {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class
    );

    private Reflections() {
    }

    /**
     * Whether a call with {@code args} can be bound to parameters of {@code types} without conversion.
     */
    public static boolean accepts(Class<?>[] types, Object[] args) {
        if (types.length != args.length) {
            return false;
        }
        for (int i = 0; i < types.length; i++) {
            Object arg = args[i];
            if (arg == null) {
                if (types[i].isPrimitive()) {
                    return false;
                }
                continue;
            }
            Class<?> type = box(types[i]);
            if (!type.isInstance(arg)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds a public method named {@code name} that can be called with {@code args}.
     * Methods inherited from {@link Object} are never dispatch targets. When several overloads accept
     * the arguments the most specific one wins; without a single most specific one nothing is found.
     */
    public static Optional<Method> findMethod(Class<?> type, String name, Object[] args) {
        List<Method> candidates = Arrays.stream(type.getMethods())
                .filter(method -> method.getName().equals(name))
                .filter(method -> method.getDeclaringClass() != Object.class)
                .filter(method -> !method.isBridge())
                .filter(method -> accepts(method.getParameterTypes(), args))
                .toList();
        if (candidates.size() <= 1) {
            return candidates.stream().findFirst();
        }

        List<Method> mostSpecific = candidates.stream()
                .filter(candidate -> candidates.stream().allMatch(other -> isAtLeastAsSpecific(candidate, other)))
                .toList();
        if (mostSpecific.size() == 1) {
            return Optional.of(mostSpecific.get(0));
        }
        log.warn("Ambiguous method {}::{} for {} argument(s): {}", type.getName(), name, args.length, candidates);
        return Optional.empty();
    }

    private static boolean isAtLeastAsSpecific(Method method, Method other) {
        Class<?>[] types = method.getParameterTypes();
        Class<?>[] otherTypes = other.getParameterTypes();
        for (int i = 0; i < types.length; i++) {
            if (!box(otherTypes[i]).isAssignableFrom(box(types[i]))) {
                return false;
            }
        }
        return true;
    }

    private static Class<?> box(Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    public static Object invoke(Method method, Object target, Object[] args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw unwrap(target.getClass().getName() + "::" + method.getName() + " failed", e);
        } catch (IllegalAccessException e) {
            throw new ActionInvocationException("Cannot access " + target.getClass().getName() + "::" + method.getName(), e);
        }
    }

    /**
     * Surfaces the exception thrown inside a reflective call. Unchecked exceptions and errors are
     * rethrown as they are, checked ones are wrapped.
     */
    public static RuntimeException unwrap(String message, InvocationTargetException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new ActionInvocationException(message, cause);
    }

}
