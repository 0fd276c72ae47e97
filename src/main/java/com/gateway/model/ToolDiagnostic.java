package com.gateway.model;

/**
 * A non-fatal remark recorded while extracting a tool from its backend description.
 *
 * @param severity How much the remark affects the externally visible tool.
 * @param message  Human-readable detail.
 */
public record ToolDiagnostic(Severity severity, String message) {

    public enum Severity {
        INFO,
        WARN,
        ERR
    }

    public static ToolDiagnostic info(String message) {
        return new ToolDiagnostic(Severity.INFO, message);
    }

    public static ToolDiagnostic warn(String message) {
        return new ToolDiagnostic(Severity.WARN, message);
    }
}
