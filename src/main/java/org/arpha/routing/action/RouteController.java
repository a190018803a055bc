package org.arpha.routing.action;

/**
 * Convenience base for action targets that write incidental output.
 */
public abstract class RouteController implements OutputAware {

    private ActionOutput output;

    @Override
    public void setActionOutput(ActionOutput output) {
        this.output = output;
    }

    protected void echo(Object value) {
        if (output == null) {
            throw new IllegalStateException("No action output bound to " + getClass().getName());
        }
        output.write(value);
    }

}
