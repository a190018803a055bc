package org.arpha.routing.action;

import java.util.SortedMap;

/**
 * An inline route action. Receives the route's action parameters, the output sink bound to this
 * call and the construct parameters passed to {@code Route.run}.
 */
@FunctionalInterface
public interface ActionHandler {

    Object handle(SortedMap<Integer, Object> actionParams, ActionOutput output, Object... constructParams) throws Exception;

}
