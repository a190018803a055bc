package org.arpha.routing.action;

import org.arpha.exception.InvalidActionResultException;

import java.util.Map;

public final class ActionResults {

    private ActionResults() {
    }

    /**
     * Accepts {@code null}, scalars and objects with their own string form.
     * Arrays, collections and maps are rejected, as is anything relying on {@link Object#toString()}.
     */
    public static void check(Object result) {
        if (result == null || isScalar(result)) {
            return;
        }
        if (result.getClass().isArray() || result instanceof Iterable || result instanceof Map
                || !overridesToString(result.getClass())) {
            throw new InvalidActionResultException(result.getClass());
        }
    }

    public static String stringify(Object result) {
        return result == null ? "" : String.valueOf(result);
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum;
    }

    private static boolean overridesToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("toString() missing on " + type.getName(), e);
        }
    }

}
