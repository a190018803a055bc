package org.arpha.routing;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.arpha.exception.ActionInvocationException;
import org.arpha.exception.MethodNotFoundException;
import org.arpha.exception.RoutingException;
import org.arpha.exception.TargetNotFoundException;
import org.arpha.exception.UndefinedActionParameterException;
import org.arpha.routing.action.ActionHandler;
import org.arpha.routing.action.ActionOutput;
import org.arpha.routing.action.ActionResults;
import org.arpha.routing.action.AfterAction;
import org.arpha.routing.action.BeforeAction;
import org.arpha.routing.action.ClosureAction;
import org.arpha.routing.action.DescriptorAction;
import org.arpha.routing.action.OutputAware;
import org.arpha.routing.action.RouteAction;
import org.arpha.routing.target.Reflections;
import org.arpha.routing.target.TargetFactory;
import org.arpha.util.StringUtils;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * A URL template (origin and path) bound to an action.
 * <p>
 * The action is either inline code ({@link ActionHandler}) or a descriptor in the form
 * {@code App\Blog::show/0/2/1}, where the trailing keys pick action parameters, in call order,
 * for the target method. {@link #run(Object...)} returns everything the action wrote to its
 * {@link ActionOutput} followed by the string form of its result.
 */
@Slf4j
public class Route {

    private final Router router;
    private String origin;
    private String path;
    @Getter
    private RouteAction action;
    private SortedMap<Integer, Object> actionParams = new TreeMap<>();
    @Getter
    private String name;
    private Map<String, Object> options = new LinkedHashMap<>();

    /**
     * @param origin URL origin, {@code {scheme}://{hostname}[:{port}]}
     * @param path   URL path
     * @param action an action descriptor such as {@code App\Blog::show/0}
     */
    public Route(Router router, String origin, String path, String action) {
        this.router = router;
        setOrigin(origin);
        setPath(path);
        setAction(action);
    }

    public Route(Router router, String origin, String path, ActionHandler action) {
        this.router = router;
        setOrigin(origin);
        setPath(path);
        setAction(action);
    }

    /**
     * Returns the origin, with its placeholders filled by the router when params are given.
     */
    public String getOrigin(Object... params) {
        if (params.length > 0) {
            return router.fillPlaceholders(origin, params);
        }
        return origin;
    }

    public Route setOrigin(String origin) {
        this.origin = StringUtils.stripLeading(origin, '/');
        return this;
    }

    public String getPath(Object... params) {
        if (params.length > 0) {
            return router.fillPlaceholders(path, params);
        }
        return path;
    }

    public Route setPath(String path) {
        this.path = "/" + StringUtils.stripTrailing(StringUtils.stripLeading(path, '/'), '/');
        return this;
    }

    public String getURL() {
        return getOrigin() + getPath();
    }

    public String getURL(List<?> originParams, List<?> pathParams) {
        return getOrigin(originParams.toArray()) + getPath(pathParams.toArray());
    }

    public Route setAction(String descriptor) {
        this.action = DescriptorAction.parse(descriptor, router.getDefaultRouteActionMethod());
        return this;
    }

    public Route setAction(ActionHandler handler) {
        this.action = new ClosureAction(handler);
        return this;
    }

    public SortedMap<Integer, Object> getActionParams() {
        return Collections.unmodifiableSortedMap(actionParams);
    }

    /**
     * Sets the action parameters. The keys are what a descriptor's {@code /0/2/1} suffix refers to.
     */
    public Route setActionParams(Map<Integer, ?> params) {
        this.actionParams = new TreeMap<>(params);
        return this;
    }

    public Route setName(String name) {
        this.name = name;
        return this;
    }

    public Map<String, Object> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    public Route setOptions(Map<String, ?> options) {
        this.options = new LinkedHashMap<>(options);
        return this;
    }

    /**
     * Runs the action.
     *
     * @param constructParams constructor arguments for a descriptor target, or trailing
     *                        arguments for an inline action
     * @return the action output followed by the action result
     */
    public String run(Object... constructParams) {
        try {
            if (action instanceof ClosureAction) {
                return runClosure(((ClosureAction) action).handler(), constructParams);
            }
            return runDescriptor((DescriptorAction) action, constructParams);
        } catch (RoutingException e) {
            log.warn("Action {} of route {} failed: {}", action, describe(), e.getMessage());
            throw e;
        }
    }

    private String runClosure(ActionHandler handler, Object[] constructParams) {
        log.debug("Running inline action of route {}", describe());
        try (ActionOutput output = ActionOutput.open()) {
            Object result = handler.handle(getActionParams(), output, constructParams);
            ActionResults.check(result);
            return output.drain() + ActionResults.stringify(result);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ActionInvocationException("Inline action of route " + describe() + " failed", e);
        }
    }

    private String runDescriptor(DescriptorAction descriptor, Object[] constructParams) {
        log.debug("Running action {} of route {}", descriptor, describe());
        Object[] args = resolveParams(descriptor).toArray();
        List<Object> params = Collections.unmodifiableList(Arrays.asList(args));

        TargetFactory factory = router.getTargetLocator().locate(descriptor.target())
                .orElseThrow(() -> new TargetNotFoundException(descriptor.target()));
        Object target = factory.newInstance(constructParams);
        Method method = Reflections.findMethod(target.getClass(), descriptor.method(), args)
                .orElseThrow(() -> new MethodNotFoundException(descriptor.target(), descriptor.method(), args.length));

        if (target instanceof BeforeAction) {
            BeforeAction hook = (BeforeAction) target;
            String response;
            try (ActionOutput output = ActionOutput.open()) {
                String returned = bound(target, output, () -> hook.beforeAction(method.getName(), params));
                response = output.drain() + ActionResults.stringify(returned);
            }
            if (!response.isEmpty()) {
                log.debug("beforeAction of {} answered, skipping {}", descriptor.target(), method.getName());
                return response;
            }
        }

        Object result;
        String captured;
        try (ActionOutput output = ActionOutput.open()) {
            result = bound(target, output, () -> Reflections.invoke(method, target, args));
            ActionResults.check(result);
            captured = output.drain();
        }

        if (result == null && target instanceof AfterAction) {
            AfterAction hook = (AfterAction) target;
            try (ActionOutput output = ActionOutput.open()) {
                result = bound(target, output, () -> hook.afterAction(method.getName(), params));
                captured += output.drain();
            }
        }

        return captured + ActionResults.stringify(result);
    }

    private List<Object> resolveParams(DescriptorAction descriptor) {
        List<Object> params = new ArrayList<>(descriptor.paramKeys().size());
        for (String key : descriptor.paramKeys()) {
            Integer index = parseKey(key);
            if (index == null || !actionParams.containsKey(index)) {
                throw new UndefinedActionParameterException(key);
            }
            params.add(actionParams.get(index));
        }
        return params;
    }

    private static Integer parseKey(String key) {
        try {
            Integer index = Integer.valueOf(key);
            // only the canonical decimal form names a key, so "01" or "+1" do not
            return index.toString().equals(key) ? index : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static <T> T bound(Object target, ActionOutput output, Supplier<T> call) {
        if (!(target instanceof OutputAware)) {
            return call.get();
        }
        OutputAware outputAware = (OutputAware) target;
        outputAware.setActionOutput(output);
        try {
            return call.get();
        } finally {
            outputAware.setActionOutput(null);
        }
    }

    private String describe() {
        return name != null ? name : getURL();
    }

}
