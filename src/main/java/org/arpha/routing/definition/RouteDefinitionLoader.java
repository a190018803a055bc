package org.arpha.routing.definition;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.arpha.exception.ConfigurationException;
import org.arpha.routing.Route;
import org.arpha.routing.SimpleRouter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads route definitions from a JSON array and creates the routes on a router:
 * <pre>
 * [{"name": "post", "origin": "https://{alpha}.example.com", "path": "/posts/{num}",
 *   "action": "App\\Blog::show/0", "params": {"0": 42}, "options": {"cache": true}}]
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class RouteDefinitionLoader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<RouteDefinition>> DEFINITIONS = new TypeReference<>() {
    };

    private final SimpleRouter router;

    public List<Route> load(InputStream input) {
        List<RouteDefinition> definitions;
        try {
            definitions = OBJECT_MAPPER.readValue(input, DEFINITIONS);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid route definitions: " + e.getMessage(), e);
        }

        List<Route> routes = new ArrayList<>(definitions.size());
        for (RouteDefinition definition : definitions) {
            routes.add(register(definition));
        }
        log.info("Loaded {} route definition(s)", routes.size());
        return routes;
    }

    public List<Route> loadFile(Path file) {
        try (InputStream input = Files.newInputStream(file)) {
            return load(input);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Route definitions file not found: " + file, e);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading route definitions file: " + file, e);
        }
    }

    public List<Route> loadResource(String resource) {
        try (InputStream input = RouteDefinitionLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new ConfigurationException("Route definitions resource not found: " + resource);
            }
            return load(input);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading route definitions resource: " + resource, e);
        }
    }

    private Route register(RouteDefinition definition) {
        if (definition.getPath() == null || definition.getAction() == null) {
            throw new ConfigurationException("Route definition needs a path and an action: " + definition);
        }

        Route route = router.createRoute(
                definition.getOrigin() != null ? definition.getOrigin() : "",
                definition.getPath(),
                definition.getAction()
        );
        if (definition.getParams() != null) {
            route.setActionParams(definition.getParams());
        }
        if (definition.getOptions() != null) {
            route.setOptions(definition.getOptions());
        }
        if (definition.getName() != null) {
            route.setName(definition.getName());
            router.addNamedRoute(route);
        }
        return route;
    }

}
