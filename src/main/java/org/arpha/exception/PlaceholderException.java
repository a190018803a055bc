package org.arpha.exception;

public class PlaceholderException extends RoutingException {

    public PlaceholderException(String message) {
        super(message);
    }

}
