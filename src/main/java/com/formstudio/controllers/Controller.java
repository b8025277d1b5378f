package com.formstudio.controllers;

import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * A group of API routes registered on the shared Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * The workspace-relative form path from the {@code path} query parameter.
     *
     * @throws IllegalArgumentException when the parameter is missing or blank
     */
    static String requirePath(Context ctx) {
        String path = ctx.queryParam("path");
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path parameter required");
        }
        return path;
    }

    /**
     * {@code {"error": message}}, using the exception's class name when it has no message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String message = e.getMessage();
        return Map.of("error", message == null || message.isBlank() ? e.getClass().getSimpleName() : message);
    }
}
