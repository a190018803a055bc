package org.arpha.exception;

import lombok.Getter;

@Getter
public class MethodNotFoundException extends RoutingException {

    private final String targetName;
    private final String methodName;

    public MethodNotFoundException(String targetName, String methodName, int arity) {
        super("Class method not exists: " + targetName + "::" + methodName + " (" + arity + " parameter(s))");
        this.targetName = targetName;
        this.methodName = methodName;
    }

}
