package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.TestUtils;
import com.mcpgate.mcp.security.ClientSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolRegistryTest {
    @Mock
    private ToolProvider mockProvider;

    private ToolRegistry toolRegistry;
    private ClientSession session;

    @BeforeEach
    void setUp() {
        toolRegistry = new ToolRegistry();
        session = new ClientSession("127.0.0.1", Instant.now());
    }

    private static ToolDefinition definition(String name) {
        return new ToolDefinition(name, name + " tool", SchemaBuilder.object().build());
    }

    @Test
    void testRegisterProvider() throws Exception {
        ToolHandler handler = (args, s) -> ToolResult.text("pong");
        when(mockProvider.getToolDefinitions()).thenReturn(List.of(definition("ping_tool")));
        when(mockProvider.getHandler("ping_tool")).thenReturn(handler);

        toolRegistry.register(mockProvider);

        assertTrue(toolRegistry.hasTool("ping_tool"));
        assertEquals(1, toolRegistry.size());
        assertEquals("pong", toolRegistry.callTool("ping_tool", null, session).text());
    }

    @Test
    void testDefinitionWithoutHandlerIsSkipped() {
        when(mockProvider.getToolDefinitions()).thenReturn(List.of(definition("orphan")));
        when(mockProvider.getHandler("orphan")).thenReturn(null);

        toolRegistry.register(mockProvider);

        assertFalse(toolRegistry.hasTool("orphan"));
    }

    @Test
    @DisplayName("Unknown tools come back as an error result, not an exception")
    void testUnknownTool() throws Exception {
        ToolResult toolResult = toolRegistry.callTool("nope", null, session);
        assertTrue(toolResult.isError());
        assertEquals("Unknown tool: nope", toolResult.text());
    }

    @Test
    void testMissingArgumentsBecomeEmptyObject() throws Exception {
        ToolHandler handler = mock(ToolHandler.class);
        when(handler.handle(any(), any())).thenReturn(ToolResult.text("ok"));
        toolRegistry.register(definition("t"), handler);

        toolRegistry.callTool("t", TestUtils.MAPPER.missingNode(), session);

        verify(handler).handle(argThat(JsonNode::isObject), eq(session));
    }

    @Test
    void testNullResultIsError() throws Exception {
        toolRegistry.register(definition("t"), (args, s) -> null);
        assertTrue(toolRegistry.callTool("t", null, session).isError());
    }

    @Test
    void testHandlerExceptionPropagates() {
        toolRegistry.register(definition("t"), (args, s) -> {
            throw new IllegalStateException("boom");
        });
        assertThrows(IllegalStateException.class, () -> toolRegistry.callTool("t", null, session));
    }

    @Test
    void testListToolsKeepsRegistrationOrder() {
        toolRegistry.register(definition("b"), (args, s) -> ToolResult.text(""));
        toolRegistry.register(definition("a"), (args, s) -> ToolResult.text(""));

        ObjectNode listed = toolRegistry.listTools();

        assertThat(listed.get("tools")).extracting(tool -> tool.get("name").asText()).containsExactly("b", "a");
        JsonNode first = listed.get("tools").get(0);
        assertEquals("b tool", first.get("description").asText());
        assertEquals("object", first.get("inputSchema").get("type").asText());
    }

    @Test
    void testToolResultJson() {
        ObjectNode ok = ToolResult.text("fine").toJson();
        assertEquals("text", ok.get("content").get(0).get("type").asText());
        assertEquals("fine", ok.get("content").get(0).get("text").asText());
        assertFalse(ok.has("isError"));

        assertTrue(ToolResult.error("bad").toJson().get("isError").asBoolean());
    }
}
