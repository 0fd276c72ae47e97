package com.gateway.model;

/**
 * A parameter needed to rebuild the HTTP request of a tool: its name and its location
 * ({@code path}, {@code query}, {@code header} or {@code cookie}).
 *
 * @param name The parameter name as declared by the backend description.
 * @param in   The parameter location.
 */
public record ToolParameter(String name, String in) {

    public static final String PATH = "path";
    public static final String QUERY = "query";

    public boolean isPath() {
        return PATH.equals(in);
    }

    public boolean isQuery() {
        return QUERY.equals(in);
    }
}
