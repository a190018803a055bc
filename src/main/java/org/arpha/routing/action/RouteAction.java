package org.arpha.routing.action;

/**
 * What a route runs: either a {@link ClosureAction} or a {@link DescriptorAction}.
 * The variant is fixed when the action is set on the route.
 */
public interface RouteAction {
}
