package com.example.websearcher.mcp;

import com.example.websearcher.browser.BrowserProvider;
import com.example.websearcher.service.SessionRegistry;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    static final List<String> SESSION_TOOLS =
            List.of("session_create", "session_get", "session_close", "session_query", "session_list");

    private final SessionRegistry registry;
    private final BrowserProvider browserProvider;

    @Value("${app.sessions.default-timeout-minutes:30}")
    private int defaultTimeoutMinutes;

    @Value("${app.query.default-max-steps:150}")
    private int defaultMaxSteps;

    public CapabilitiesTools(SessionRegistry registry, BrowserProvider browserProvider) {
        this.registry = registry;
        this.browserProvider = browserProvider;
    }

    @Tool(description = "Describe the web searcher: tools, session defaults and current load")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "web-searcher", "version", "1.0.0"),
                "tools", SESSION_TOOLS,
                "defaults", Map.of(
                    "timeoutMinutes", defaultTimeoutMinutes,
                    "maxSteps", defaultMaxSteps
                ),
                "activeSessions", registry.count(),
                "browserRunning", browserProvider.isRunning()
        );
    }
}
