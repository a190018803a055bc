package org.arpha.routing.action;

import java.util.Objects;

public record ClosureAction(ActionHandler handler) implements RouteAction {

    public ClosureAction {
        Objects.requireNonNull(handler, "handler");
    }

}
