package org.arpha.routing.dto;

import lombok.Builder;
import lombok.Data;
import org.arpha.configuration.ConfigurationManager;

@Data
@Builder
public class RouterProperties {

    public static final String DEFAULT_ACTION_METHOD = "index";

    private String defaultActionMethod;
    private String routesFile;

    public static RouterProperties initialize() {
        ConfigurationManager config = ConfigurationManager.getINSTANCE();

        return RouterProperties.builder()
                .defaultActionMethod(config.getProperty("router.default.action.method", DEFAULT_ACTION_METHOD))
                .routesFile(config.getProperty("router.routes.file", "routes.json"))
                .build();
    }

}
