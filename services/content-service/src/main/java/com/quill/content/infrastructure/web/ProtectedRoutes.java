package com.quill.content.infrastructure.web;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.springframework.http.HttpMethod;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

/**
 * The routes that require a bearer token. Everything else is public.
 */
public final class ProtectedRoutes {

    private record Route(HttpMethod method, String pattern) {}

    private static final List<Route> ROUTES = List.of(
            new Route(HttpMethod.GET, "/api/v1/auth/profile"),
            new Route(HttpMethod.PUT, "/api/v1/auth/profile"),
            new Route(HttpMethod.POST, "/api/v1/posts"),
            new Route(HttpMethod.GET, "/api/v1/posts/mine"),
            new Route(HttpMethod.PUT, "/api/v1/posts/*"),
            new Route(HttpMethod.DELETE, "/api/v1/posts/*"));

    private static final PathMatcher MATCHER = new AntPathMatcher();

    private ProtectedRoutes() {
        // utility class
    }

    public static boolean isProtected(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return isProtected(request.getMethod(), path);
    }

    public static boolean isProtected(String method, String path) {
        String normalized = path.length() > 1 && path.endsWith("/")
                ? path.substring(0, path.length() - 1)
                : path;
        return ROUTES.stream().anyMatch(route ->
                route.method().matches(method) && MATCHER.match(route.pattern(), normalized));
    }
}
