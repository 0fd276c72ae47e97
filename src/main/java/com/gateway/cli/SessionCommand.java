package com.gateway.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.dto.response.CommandResponse;
import com.gateway.dto.response.ToolCallResponse;
import com.gateway.dto.response.ToolDescriptor;
import com.gateway.service.api.ToolGatewayService;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Drives the caller-facing gateway operations from the console, which is handy for checking a
 * token or a tier configuration without a transport client.
 */
@ShellComponent
public class SessionCommand {

    private static final String USER_AGENT = "tool-gateway-shell";

    private final ToolGatewayService gatewayService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SessionCommand(ToolGatewayService gatewayService) {
        this.gatewayService = gatewayService;
    }

    @ShellMethod(key = "connect", value = "Open a session with a bearer token.")
    public String connect(
            @ShellOption(value = {"--token"}, help = "Bearer token; an anonymous session when omitted.", defaultValue = ShellOption.NULL) String token,
            @ShellOption(value = {"--tier"}, help = "Access tier override.", defaultValue = ShellOption.NULL) String tier
    ) {
        try {
            String sessionId = gatewayService.initializeSession(token != null ? "Bearer " + token : null, tier, USER_AGENT);
            return new CommandResponse(true, "Session opened: " + sessionId).toAnsiString();
        } catch (Exception e) {
            return new CommandResponse(false, "Could not open a session: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "session-tools", value = "List the tools a session can see.")
    public String sessionTools(@ShellOption(value = {"--session", "-s"}, help = "The session id.") String sessionId) {
        List<ToolDescriptor> tools = gatewayService.listTools(sessionId);
        StringJoiner out = new StringJoiner("\n");
        out.add(tools.size() + " tools visible");
        tools.forEach(tool -> out.add("  " + tool.name()));
        return out.toString();
    }

    @ShellMethod(key = "call", value = "Invoke a tool within a session.")
    public String call(
            @ShellOption(value = {"--session", "-s"}, help = "The session id.", defaultValue = ShellOption.NULL) String sessionId,
            @ShellOption(value = {"--name", "-n"}, help = "The tool name.") String name,
            @ShellOption(value = {"--args", "-a"}, help = "Arguments as a JSON object.", defaultValue = "{}") String args
    ) {
        try {
            Map<String, Object> arguments = objectMapper.readValue(args, new TypeReference<>() {});
            ToolCallResponse response = gatewayService.callTool(sessionId, name, arguments);
            return response.isError()
                    ? new CommandResponse(false, response.text()).toAnsiString()
                    : response.text();
        } catch (Exception e) {
            return new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "disconnect", value = "Close a session.")
    public String disconnect(@ShellOption(value = {"--session", "-s"}, help = "The session id.") String sessionId) {
        gatewayService.terminateSession(sessionId);
        return new CommandResponse(true, "Session closed: " + sessionId).toAnsiString();
    }
}
