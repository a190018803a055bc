package org.arpha.exception;

import lombok.Getter;

/**
 * Thrown when an action returns something that has no plain string form, such as an array or a collection.
 */
@Getter
public class InvalidActionResultException extends RoutingException {

    private final Class<?> resultType;

    public InvalidActionResultException(Class<?> resultType) {
        super("Action return type must be scalar, got " + resultType.getName());
        this.resultType = resultType;
    }

}
