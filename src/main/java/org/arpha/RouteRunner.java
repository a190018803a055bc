package org.arpha;

import lombok.extern.slf4j.Slf4j;
import org.arpha.configuration.ConfigurationManager;
import org.arpha.routing.SimpleRouter;
import org.arpha.routing.definition.RouteDefinitionLoader;
import org.arpha.routing.dto.RouterProperties;
import org.arpha.routing.target.ClassTargetLocator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

@Slf4j
public class RouteRunner {

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: java -jar your-jar.jar <path-to-properties> <route-name> [construct-args...]");
            System.exit(1);
        }

        ConfigurationManager.overrideProperties(args[0]);
        SimpleRouter router = createRouter(RouterProperties.initialize());

        Optional<String> result = runRoute(router, args[1], Arrays.copyOfRange(args, 2, args.length));
        if (result.isEmpty()) {
            System.err.println("Unknown route: " + args[1]);
            System.exit(2);
            return;
        }
        System.out.println(result.get());
    }

    /**
     * Builds a router holding the routes of the configured routes file, read from the file system
     * when such a file exists and from the classpath otherwise.
     */
    static SimpleRouter createRouter(RouterProperties routerProperties) {
        SimpleRouter router = new SimpleRouter(routerProperties, ClassTargetLocator.INSTANCE);
        RouteDefinitionLoader loader = new RouteDefinitionLoader(router);

        Path file = Path.of(routerProperties.getRoutesFile());
        if (Files.isRegularFile(file)) {
            loader.loadFile(file);
        } else {
            loader.loadResource(routerProperties.getRoutesFile());
        }
        return router;
    }

    /**
     * Runs the named route, or returns empty when the router has no route of that name.
     */
    static Optional<String> runRoute(SimpleRouter router, String routeName, String... constructArgs) {
        return router.getNamedRoute(routeName).map(route -> {
            log.info("Running route '{}' ({})", route.getName(), route.getURL());
            return route.run((Object[]) constructArgs);
        });
    }

}
