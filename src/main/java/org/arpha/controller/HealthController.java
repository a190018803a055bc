package org.arpha.controller;

import org.arpha.routing.action.RouteController;

public class HealthController extends RouteController {

    public String index() {
        return "OK";
    }

    public String ping(String reply) {
        echo(reply);
        return "";
    }

}
