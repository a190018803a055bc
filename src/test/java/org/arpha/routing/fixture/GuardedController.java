package org.arpha.routing.fixture;

import org.arpha.routing.action.AfterAction;
import org.arpha.routing.action.BeforeAction;
import org.arpha.routing.action.RouteController;

import java.util.List;

/**
 * Records every call in a {@link CallLog}. The mode decides what {@code beforeAction} answers:
 * {@code deny} writes and returns a response, {@code echo} only writes, {@code pass} returns null.
 */
public class GuardedController extends RouteController implements BeforeAction, AfterAction {

    private final CallLog log;
    private final String mode;

    public GuardedController(CallLog log, String mode) {
        this.log = log;
        this.mode = mode;
    }

    @Override
    public String beforeAction(String method, List<Object> params) {
        log.add("before:" + method + params);
        switch (mode) {
            case "deny":
                echo("[guard]");
                return "denied";
            case "echo":
                echo("[guard]");
                return "";
            default:
                return null;
        }
    }

    public String show(Integer id) {
        log.add("show:" + id);
        echo("<main>");
        return null;
    }

    public String edit(Integer id) {
        log.add("edit:" + id);
        return "editing " + id;
    }

    public String explode() {
        log.add("explode");
        throw new IllegalStateException("boom");
    }

    @Override
    public String afterAction(String method, List<Object> params) {
        log.add("after:" + method + params);
        echo("<after>");
        return "done";
    }

}
