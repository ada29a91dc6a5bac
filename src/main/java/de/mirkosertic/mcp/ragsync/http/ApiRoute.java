package de.mirkosertic.mcp.ragsync.http;

import org.jspecify.annotations.Nullable;

/**
 * The REST endpoints, each bound to one HTTP method and path.
 */
public enum ApiRoute {

    STATUS("GET", "/status"),
    DOCUMENTS("GET", "/documents"),
    QUERY("POST", "/query"),
    INSERT("POST", "/insert"),
    DELETE("POST", "/delete"),
    CLEAR("POST", "/clear");

    private final String method;
    private final String path;

    ApiRoute(final String method, final String path) {
        this.method = method;
        this.path = path;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public boolean hasBody() {
        return "POST".equals(method);
    }

    /**
     * Route for the given method and path, null if there is none. A trailing slash is ignored.
     */
    public static @Nullable ApiRoute resolve(final String method, final @Nullable String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        final String normalized = path.length() > 1 && path.endsWith("/")
                ? path.substring(0, path.length() - 1)
                : path;
        for (final ApiRoute route : values()) {
            if (route.method.equalsIgnoreCase(method) && route.path.equals(normalized)) {
                return route;
            }
        }
        return null;
    }
}
