package com.gateway.service.api;

import com.gateway.model.InvocationResult;
import com.gateway.model.ToolDefinition;
import java.util.Map;

public interface Dispatcher {

    /**
     * Rebuilds the HTTP request of a tool from caller arguments and executes it.
     *
     * @param tool       The tool to invoke.
     * @param args       Caller arguments keyed by parameter name, plus {@code requestBody}.
     * @param credential Bearer token sent in the {@code Authorization} header.
     * @param userAgent  The caller's user agent, reported to the audit sink only.
     * @return The classified result of a successful call.
     * @throws com.gateway.exception.ToolExecutionException on a non-success status or a
     *         network failure.
     */
    InvocationResult dispatch(ToolDefinition tool, Map<String, Object> args, String credential, String userAgent);
}
