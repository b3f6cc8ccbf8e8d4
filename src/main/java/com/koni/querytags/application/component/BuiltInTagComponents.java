package com.koni.querytags.application.component;

import com.koni.querytags.application.port.CallSiteLocator;
import com.koni.querytags.application.port.ConnectionDescriptor;
import com.koni.querytags.domain.model.QueryTagsContext;
import com.koni.querytags.domain.model.TagComponent;
import org.springframework.util.ClassUtils;

import java.util.Optional;

/**
 * Components available to every application.
 *
 * <ul>
 *   <li>{@code application}: context key {@code application_name}, else the configured name</li>
 *   <li>{@code pid}: id of the running JVM process</li>
 *   <li>{@code db_host}, {@code database}, {@code socket}: the connection descriptor</li>
 *   <li>{@code line}: first application frame of the executing thread</li>
 *   <li>{@code controller}, {@code controller_with_namespace}, {@code action}: set by the request hook</li>
 *   <li>{@code job}: fully qualified job class, set by the job hook</li>
 * </ul>
 */
public final class BuiltInTagComponents {

    public static final String APPLICATION = "application";
    public static final String PID = "pid";
    public static final String DB_HOST = "db_host";
    public static final String DATABASE = "database";
    public static final String SOCKET = "socket";
    public static final String LINE = "line";
    public static final String CONTROLLER = "controller";
    public static final String CONTROLLER_WITH_NAMESPACE = "controller_with_namespace";
    public static final String ACTION = "action";
    public static final String JOB = "job";

    /** Context key overriding the configured application name. */
    public static final String APPLICATION_NAME_KEY = "application_name";

    private static final String CONTROLLER_SUFFIX = "Controller";

    private BuiltInTagComponents() {
    }

    public static void registerAll(TagComponentRegistry registry,
                                   String applicationName,
                                   ConnectionDescriptor connectionDescriptor,
                                   CallSiteLocator callSiteLocator) {
        registry.register(APPLICATION, application(applicationName))
                .register(PID, context -> Optional.of(String.valueOf(ProcessHandle.current().pid())))
                .register(DB_HOST, context -> connectionDescriptor.host())
                .register(DATABASE, context -> connectionDescriptor.database())
                .register(SOCKET, context -> connectionDescriptor.socket())
                .register(LINE, TagComponent.volatileComponent(
                        context -> callSiteLocator.locate().map(StackTraceElement::toString)))
                .register(CONTROLLER, context -> context.get(CONTROLLER).map(BuiltInTagComponents::controllerName))
                .register(CONTROLLER_WITH_NAMESPACE,
                        context -> context.get(CONTROLLER).map(BuiltInTagComponents::qualifiedName))
                .register(ACTION, context -> context.get(ACTION).map(String::valueOf))
                .register(JOB, context -> context.get(JOB).map(BuiltInTagComponents::qualifiedName));
    }

    static TagComponent application(String applicationName) {
        return (QueryTagsContext context) -> context.get(APPLICATION_NAME_KEY)
                .map(String::valueOf)
                .or(() -> Optional.ofNullable(applicationName));
    }

    /**
     * Underscored controller name without the {@code Controller} suffix,
     * so {@code DashboardApiController} becomes {@code dashboard_api}.
     */
    static String controllerName(Object controller) {
        if (controller instanceof CharSequence) {
            return controller.toString();
        }
        String name = simpleName(controller);
        if (name.endsWith(CONTROLLER_SUFFIX) && name.length() > CONTROLLER_SUFFIX.length()) {
            name = name.substring(0, name.length() - CONTROLLER_SUFFIX.length());
        }
        return underscore(name);
    }

    static String underscore(String camelCase) {
        return camelCase
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
                .replaceAll("([a-z\\d])([A-Z])", "$1_$2")
                .toLowerCase();
    }

    private static String simpleName(Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        return typeOf(value).getSimpleName();
    }

    private static String qualifiedName(Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        return typeOf(value).getName();
    }

    private static Class<?> typeOf(Object value) {
        Class<?> type = value instanceof Class<?> ? (Class<?>) value : value.getClass();
        return ClassUtils.getUserClass(type);
    }
}
