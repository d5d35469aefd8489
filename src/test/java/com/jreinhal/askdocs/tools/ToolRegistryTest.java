package com.jreinhal.askdocs.tools;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.jreinhal.askdocs.generation.CompletionClient;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    @Test
    void ordersByPriorityThenName() {
        CompletionClient client = mock(CompletionClient.class);
        ToolsConfig config = new ToolsConfig();
        ToolRegistry registry = new ToolRegistry(List.of(config.summarizeTool(client), new ListDefinitionsTool(),
                config.compareTool(client), new FindTablesTool()));

        assertEquals(List.of("find_tables", "list_definitions", "compare", "summarize"),
                registry.all().stream().map(AnswerTool::name).toList());
        assertEquals(List.of("compare", "summarize"), registry.available(false).stream().map(AnswerTool::name).toList());
        assertTrue(registry.find("compare").isPresent());
        assertTrue(registry.find("nope").isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        assertThrows(IllegalStateException.class, () -> new ToolRegistry(List.of(new FindTablesTool(), new FindTablesTool())));
    }
}
