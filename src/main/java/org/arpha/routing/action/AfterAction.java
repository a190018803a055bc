package org.arpha.routing.action;

import java.util.List;

/**
 * Produces the result when the routed method returned {@code null}.
 */
public interface AfterAction {

    String afterAction(String method, List<Object> params);

}
