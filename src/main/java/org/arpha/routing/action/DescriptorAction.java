package org.arpha.routing.action;

import org.arpha.util.StringUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Parsed form of an action descriptor such as {@code App\Blog::show/0/2/1}: the target name,
 * the method name and the keys of the action parameters to pass, in call order.
 */
public record DescriptorAction(String target, String method, List<String> paramKeys) implements RouteAction {

    public static final String METHOD_SEPARATOR = "::";
    public static final String PARAM_SEPARATOR = "/";

    public DescriptorAction {
        paramKeys = List.copyOf(paramKeys);
    }

    /**
     * Parses a descriptor, trimming leading namespace separators and appending
     * {@code ::defaultMethod} when the descriptor names no method.
     */
    public static DescriptorAction parse(String descriptor, String defaultMethod) {
        String normalized = StringUtils.stripLeading(descriptor, '\\');
        if (!normalized.contains(METHOD_SEPARATOR)) {
            normalized += METHOD_SEPARATOR + defaultMethod;
        }

        int separator = normalized.indexOf(METHOD_SEPARATOR);
        String target = normalized.substring(0, separator);
        String[] methodParts = normalized.substring(separator + METHOD_SEPARATOR.length()).split(PARAM_SEPARATOR, -1);

        return new DescriptorAction(target, methodParts[0], Arrays.asList(methodParts).subList(1, methodParts.length));
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(target).append(METHOD_SEPARATOR).append(method);
        paramKeys.forEach(key -> builder.append(PARAM_SEPARATOR).append(key));
        return builder.toString();
    }

}
