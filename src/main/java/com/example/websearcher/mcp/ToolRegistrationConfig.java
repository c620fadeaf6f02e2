package com.example.websearcher.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the {@code @Tool} methods to the MCP server.
 */
@Configuration
public class ToolRegistrationConfig {

    @Bean
    public ToolCallbackProvider webSearcherTools(SessionTools sessionTools, CapabilitiesTools capabilitiesTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(sessionTools, capabilitiesTools)
                .build();
    }
}
