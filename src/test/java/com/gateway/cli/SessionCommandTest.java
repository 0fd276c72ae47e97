package com.gateway.cli;

import com.gateway.dto.response.ToolCallResponse;
import com.gateway.dto.response.ToolDescriptor;
import com.gateway.exception.IdentityValidationException;
import com.gateway.exception.UnknownToolException;
import com.gateway.service.api.ToolGatewayService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionCommandTest {

    @Mock
    private ToolGatewayService gatewayService;

    private SessionCommand command;

    @BeforeEach
    void setUp() {
        command = new SessionCommand(gatewayService);
    }

    @Test
    void connect_shouldPassTokenAsBearerHeader() {
        when(gatewayService.initializeSession("Bearer abc", "admin", "tool-gateway-shell")).thenReturn("s-1");

        assertThat(command.connect("abc", "admin")).contains("Session opened: s-1");
    }

    @Test
    void connect_shouldReportIdentityFailure() {
        when(gatewayService.initializeSession(anyString(), any(), anyString()))
                .thenThrow(new IdentityValidationException("Authentication failed: 401 Unauthorized"));

        assertThat(command.connect("bad", null)).contains("Could not open a session: Authentication failed: 401 Unauthorized");
    }

    @Test
    void call_shouldParseArgumentsAndPrintPayload() {
        when(gatewayService.callTool("s-1", "controller.jobs_list", Map.of("page", 2)))
                .thenReturn(ToolCallResponse.success("{\n  \"count\" : 0\n}"));

        assertThat(command.call("s-1", "controller.jobs_list", "{\"page\":2}")).isEqualTo("{\n  \"count\" : 0\n}");
    }

    @Test
    void call_shouldHighlightBackendFailure() {
        when(gatewayService.callTool("s-1", "controller.jobs_list", Map.of()))
                .thenReturn(ToolCallResponse.failure("Tool execution failed: HTTP 403: denied"));

        assertThat(command.call("s-1", "controller.jobs_list", "{}"))
                .startsWith("\u001B[31m")
                .contains("Tool execution failed: HTTP 403: denied");
    }

    @Test
    void call_shouldReportUnknownTool() {
        when(gatewayService.callTool("s-1", "nope", Map.of())).thenThrow(new UnknownToolException("nope"));

        assertThat(command.call("s-1", "nope", "{}")).contains("An error occurred: Unknown tool: nope");
    }

    @Test
    void call_withInvalidJson_shouldNotInvokeTool() {
        assertThat(command.call("s-1", "controller.jobs_list", "{not json")).contains("An error occurred");
        verify(gatewayService, never()).callTool(any(), any(), any());
    }

    @Test
    void sessionTools_shouldListNames() {
        when(gatewayService.listTools("s-1")).thenReturn(List.of(new ToolDescriptor("gateway.me_list", "Me.", null)));

        assertThat(command.sessionTools("s-1")).isEqualTo("1 tools visible\n  gateway.me_list");
    }

    @Test
    void disconnect_shouldTerminateSession() {
        assertThat(command.disconnect("s-1")).contains("Session closed: s-1");
        verify(gatewayService).terminateSession("s-1");
    }
}
