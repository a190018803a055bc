package org.arpha.exception;

import lombok.Getter;

@Getter
public class DuplicateRouteNameException extends RoutingException {

    private final String routeName;

    public DuplicateRouteNameException(String routeName) {
        super("Route name already in use: " + routeName);
        this.routeName = routeName;
    }

}
