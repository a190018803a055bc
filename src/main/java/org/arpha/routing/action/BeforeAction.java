package org.arpha.routing.action;

import java.util.List;

/**
 * Runs before the routed method. A non-empty response (written output plus return value)
 * is sent as the result and the routed method is skipped.
 */
public interface BeforeAction {

    String beforeAction(String method, List<Object> params);

}
