package org.arpha.exception;

/**
 * Wraps a checked exception raised by an action or one of its hooks.
 */
public class ActionInvocationException extends RoutingException {

    public ActionInvocationException(String message, Throwable cause) {
        super(message, cause);
    }

}
