package org.arpha.exception;

import lombok.Getter;

@Getter
public class TargetNotFoundException extends RoutingException {

    private final String targetName;

    public TargetNotFoundException(String targetName) {
        super("Class not exists: " + targetName);
        this.targetName = targetName;
    }

    public TargetNotFoundException(String targetName, Throwable cause) {
        super("Class not exists: " + targetName, cause);
        this.targetName = targetName;
    }

}
