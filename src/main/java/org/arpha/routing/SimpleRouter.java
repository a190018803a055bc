package org.arpha.routing;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.arpha.exception.DuplicateRouteNameException;
import org.arpha.exception.PlaceholderException;
import org.arpha.routing.action.ActionHandler;
import org.arpha.routing.dto.RouterProperties;
import org.arpha.routing.target.ClassTargetLocator;
import org.arpha.routing.target.TargetLocator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates routes, fills their {@code {placeholder}} tokens and keeps track of named routes.
 * <p>
 * Placeholders are filled in order of appearance. The built-in names {@code {num}}, {@code {alpha}},
 * {@code {alphanum}}, {@code {segment}} and {@code {any}} only accept matching values; any other
 * name accepts a single path segment.
 */
@Slf4j
public class SimpleRouter implements Router {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^/{}]+?)\\}");
    private static final Pattern DEFAULT_VALUE = Pattern.compile("[^/]+");
    private static final Map<String, Pattern> TYPED_VALUES = Map.of(
            "num", Pattern.compile("[0-9]+"),
            "alpha", Pattern.compile("[a-zA-Z]+"),
            "alphanum", Pattern.compile("[a-zA-Z0-9]+"),
            "segment", DEFAULT_VALUE,
            "any", Pattern.compile(".*")
    );

    @Getter
    private final String defaultRouteActionMethod;
    @Getter
    private final TargetLocator targetLocator;
    private final Map<String, Route> namedRoutes = new LinkedHashMap<>();

    public SimpleRouter() {
        this(RouterProperties.DEFAULT_ACTION_METHOD, ClassTargetLocator.INSTANCE);
    }

    public SimpleRouter(String defaultRouteActionMethod, TargetLocator targetLocator) {
        this.defaultRouteActionMethod = defaultRouteActionMethod;
        this.targetLocator = targetLocator;
    }

    public SimpleRouter(RouterProperties properties, TargetLocator targetLocator) {
        this(properties.getDefaultActionMethod(), targetLocator);
    }

    @Override
    public String fillPlaceholders(String template, Object... params) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder filled = new StringBuilder();
        int index = 0;
        while (matcher.find()) {
            if (index >= params.length) {
                throw new PlaceholderException("Missing value for placeholder " + matcher.group() + " of '" + template + "'");
            }
            String value = String.valueOf(params[index]);
            Pattern accepted = TYPED_VALUES.getOrDefault(matcher.group(1), DEFAULT_VALUE);
            if (!accepted.matcher(value).matches()) {
                throw new PlaceholderException("Value '" + value + "' does not match placeholder " + matcher.group());
            }
            matcher.appendReplacement(filled, Matcher.quoteReplacement(value));
            index++;
        }
        if (index < params.length) {
            throw new PlaceholderException("Template '" + template + "' has " + index + " placeholder(s), got "
                    + params.length + " value(s)");
        }
        matcher.appendTail(filled);
        return filled.toString();
    }

    public Route createRoute(String origin, String path, String action) {
        return new Route(this, origin, path, action);
    }

    public Route createRoute(String origin, String path, ActionHandler action) {
        return new Route(this, origin, path, action);
    }

    /**
     * Registers a route under its name. Names are unique per router.
     */
    public synchronized SimpleRouter addNamedRoute(Route route) {
        String name = route.getName();
        if (name == null) {
            throw new IllegalArgumentException("Route " + route.getURL() + " has no name");
        }
        if (namedRoutes.containsKey(name)) {
            throw new DuplicateRouteNameException(name);
        }
        namedRoutes.put(name, route);
        log.debug("Registered route '{}' -> {} ({})", name, route.getURL(), route.getAction());
        return this;
    }

    public synchronized Optional<Route> getNamedRoute(String name) {
        return Optional.ofNullable(namedRoutes.get(name));
    }

    public synchronized Collection<Route> getNamedRoutes() {
        return Collections.unmodifiableCollection(namedRoutes.values());
    }

}
