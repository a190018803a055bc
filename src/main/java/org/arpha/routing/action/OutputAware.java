package org.arpha.routing.action;

/**
 * Implemented by action targets that write incidental output. The route binds an open
 * {@link ActionOutput} before each call on the target and unbinds it ({@code null}) afterwards.
 */
public interface OutputAware {

    void setActionOutput(ActionOutput output);

}
