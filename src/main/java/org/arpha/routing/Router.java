package org.arpha.routing;

import org.arpha.routing.target.ClassTargetLocator;
import org.arpha.routing.target.TargetLocator;

/**
 * The collaborator a {@link Route} relies on for everything outside its own dispatch.
 */
public interface Router {

    /**
     * Replaces the placeholder tokens of a URL fragment with the given values, in order.
     */
    String fillPlaceholders(String template, Object... params);

    /**
     * Method name used when an action descriptor has no {@code ::method} part.
     */
    String getDefaultRouteActionMethod();

    default TargetLocator getTargetLocator() {
        return ClassTargetLocator.INSTANCE;
    }

}
