package org.arpha.routing.target;

/**
 * Builds the target of one dispatch. Every call returns a new instance.
 */
@FunctionalInterface
public interface TargetFactory {

    Object newInstance(Object... constructParams);

}
