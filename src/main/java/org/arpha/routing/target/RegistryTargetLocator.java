package org.arpha.routing.target;

import lombok.extern.slf4j.Slf4j;
import org.arpha.util.StringUtils;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps target names to explicitly registered factories, so descriptors can use short aliases
 * such as {@code App\Blog} instead of fully qualified class names. Unregistered names go to the delegate.
 */
@Slf4j
public class RegistryTargetLocator implements TargetLocator {

    private final Map<String, TargetFactory> factories = new ConcurrentHashMap<>();
    private final TargetLocator delegate;

    public RegistryTargetLocator() {
        this(ClassTargetLocator.INSTANCE);
    }

    public RegistryTargetLocator(TargetLocator delegate) {
        this.delegate = delegate;
    }

    /**
     * Registers {@code factory} under {@code targetName}. The factory must build a new target on every
     * call: a route binds its output to the target for the length of a dispatch, so a shared instance
     * would mix the output of concurrent dispatches.
     */
    public RegistryTargetLocator register(String targetName, TargetFactory factory) {
        factories.put(normalize(targetName), factory);
        log.debug("Registered target alias '{}'", targetName);
        return this;
    }

    public RegistryTargetLocator register(String targetName, Class<?> type) {
        return register(targetName, ClassTargetLocator.factoryFor(type));
    }

    @Override
    public Optional<TargetFactory> locate(String targetName) {
        TargetFactory factory = factories.get(normalize(targetName));
        if (factory != null) {
            return Optional.of(factory);
        }
        return delegate.locate(targetName);
    }

    private static String normalize(String targetName) {
        return StringUtils.stripLeading(targetName, '\\');
    }

}
