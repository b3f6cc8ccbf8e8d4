package com.koni.querytags.infrastructure.web;

import com.koni.querytags.application.component.BuiltInTagComponents;
import com.koni.querytags.application.context.QueryTagsContextHolder;
import com.koni.querytags.application.context.QueryTagsScope;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.AsyncHandlerInterceptor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Records the controller and action serving a request in a query tags scope that lives
 * as long as one dispatch of the request.
 *
 * Scopes are kept in a per-request stack so that forwards and includes nest inside the
 * dispatch that started them. An async handler ends its first dispatch through
 * {@link #afterConcurrentHandlingStarted}; the async re-dispatch opens a scope of its own.
 */
@Slf4j
public class QueryTagsHandlerInterceptor implements AsyncHandlerInterceptor {

    static final String SCOPES_ATTRIBUTE = QueryTagsHandlerInterceptor.class.getName() + ".SCOPES";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        HandlerMethod handlerMethod = (HandlerMethod) handler;
        QueryTagsScope scope = QueryTagsContextHolder.openScope();
        scopes(request, true).push(scope);

        Map<String, Object> entries = new HashMap<>();
        entries.put(BuiltInTagComponents.CONTROLLER, handlerMethod.getBeanType());
        entries.put(BuiltInTagComponents.ACTION, handlerMethod.getMethod().getName());
        scope.getContext().update(entries);

        log.debug("Recorded query tags for request: controller={}, action={}, dispatch={}",
                handlerMethod.getBeanType().getSimpleName(), handlerMethod.getMethod().getName(),
                request.getDispatcherType());
        return true;
    }

    @Override
    public void afterConcurrentHandlingStarted(HttpServletRequest request, HttpServletResponse response,
                                               Object handler) {
        if (handler instanceof HandlerMethod) {
            closeInnermostScope(request);
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        if (handler instanceof HandlerMethod) {
            closeInnermostScope(request);
        }
    }

    private void closeInnermostScope(HttpServletRequest request) {
        Deque<QueryTagsScope> scopes = scopes(request, false);
        if (scopes == null || scopes.isEmpty()) {
            return;
        }
        QueryTagsScope scope = scopes.pop();
        if (scopes.isEmpty()) {
            request.removeAttribute(SCOPES_ATTRIBUTE);
        }

        Map<String, Object> cleared = new HashMap<>();
        cleared.put(BuiltInTagComponents.CONTROLLER, null);
        cleared.put(BuiltInTagComponents.ACTION, null);
        scope.getContext().update(cleared);
        scope.close();
    }

    @SuppressWarnings("unchecked")
    private static Deque<QueryTagsScope> scopes(HttpServletRequest request, boolean create) {
        Object attribute = request.getAttribute(SCOPES_ATTRIBUTE);
        if (attribute instanceof Deque) {
            return (Deque<QueryTagsScope>) attribute;
        }
        if (!create) {
            return null;
        }
        Deque<QueryTagsScope> scopes = new ArrayDeque<>();
        request.setAttribute(SCOPES_ATTRIBUTE, scopes);
        return scopes;
    }
}
