package org.arpha.routing.target;

import lombok.extern.slf4j.Slf4j;
import org.arpha.exception.TargetInstantiationException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Optional;

/**
 * Looks targets up as Java classes. A {@code \} in the target name is read as a package separator,
 * so {@code org\shop\CartController} and {@code org.shop.CartController} name the same class.
 */
@Slf4j
public class ClassTargetLocator implements TargetLocator {

    public static final ClassTargetLocator INSTANCE = new ClassTargetLocator();

    private final ClassLoader classLoader;

    public ClassTargetLocator() {
        this(ClassTargetLocator.class.getClassLoader());
    }

    public ClassTargetLocator(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Optional<TargetFactory> locate(String targetName) {
        String className = targetName.replace('\\', '.');
        try {
            Class<?> type = Class.forName(className, false, classLoader);
            return Optional.of(factoryFor(type));
        } catch (ClassNotFoundException e) {
            log.debug("No class found for target '{}'", targetName);
            return Optional.empty();
        }
    }

    public static TargetFactory factoryFor(Class<?> type) {
        return constructParams -> instantiate(type, constructParams);
    }

    private static Object instantiate(Class<?> type, Object[] constructParams) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new TargetInstantiationException("Cannot instantiate abstract type: " + type.getName());
        }

        Constructor<?> constructor = Arrays.stream(type.getConstructors())
                .filter(candidate -> Reflections.accepts(candidate.getParameterTypes(), constructParams))
                .findFirst()
                .orElseThrow(() -> new TargetInstantiationException("No public constructor of " + type.getName()
                        + " accepts " + constructParams.length + " construct parameter(s)"));

        try {
            return constructor.newInstance(constructParams);
        } catch (InvocationTargetException e) {
            throw Reflections.unwrap("Constructor of " + type.getName() + " failed", e);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new TargetInstantiationException("Cannot instantiate " + type.getName(), e);
        }
    }

}
