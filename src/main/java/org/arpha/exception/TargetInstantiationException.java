package org.arpha.exception;

public class TargetInstantiationException extends RoutingException {

    public TargetInstantiationException(String message) {
        super(message);
    }

    public TargetInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }

}
