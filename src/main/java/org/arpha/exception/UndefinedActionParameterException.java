package org.arpha.exception;

import lombok.Getter;

/**
 * Thrown when an action descriptor references a parameter key the route does not hold.
 */
@Getter
public class UndefinedActionParameterException extends RoutingException {

    private final String key;

    public UndefinedActionParameterException(String key) {
        super("Undefined action parameter: " + key);
        this.key = key;
    }

}
