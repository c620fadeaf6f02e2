package com.example.websearcher.service;

import com.example.websearcher.agent.BrowserTools;
import com.example.websearcher.agent.PageAnnotator;
import com.example.websearcher.agent.SpringAiOracle;
import com.example.websearcher.agent.WebVoyagerGraph;
import com.example.websearcher.browser.BrowserProvider;
import com.example.websearcher.browser.BrowsingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Opens a Playwright page on the start URL and builds a web navigation agent for it.
 */
@Component
public class AgentSessionResourceFactory implements SessionResourceFactory {

    private static final Logger logger = LoggerFactory.getLogger(AgentSessionResourceFactory.class);

    private final BrowserProvider browserProvider;
    private final ObjectProvider<ChatModel> chatModel;
    private final String startUrl;
    private final String searchUrl;
    private final String systemPrompt;
    private final PageAnnotator annotator;

    public AgentSessionResourceFactory(BrowserProvider browserProvider,
                                       ObjectProvider<ChatModel> chatModel,
                                       @Value("${app.browser.start-url:https://www.duckduckgo.com}") String startUrl,
                                       @Value("${app.browser.search-url:https://www.google.com/}") String searchUrl,
                                       @Value("${app.agent.prompt-resource:prompts/web-voyager.txt}") String promptResource,
                                       @Value("${app.agent.mark-script-resource:scripts/mark_page.js}") String markScriptResource,
                                       @Value("${app.agent.mark-attempts:10}") int markAttempts,
                                       @Value("${app.agent.mark-retry-delay-ms:3000}") long markRetryDelayMs) {
        this.browserProvider = browserProvider;
        this.chatModel = chatModel;
        this.startUrl = startUrl;
        this.searchUrl = searchUrl;
        this.systemPrompt = load(promptResource);
        this.annotator = new PageAnnotator(load(markScriptResource), markAttempts, Duration.ofMillis(markRetryDelayMs));
    }

    @Override
    public SessionResources create() {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new ResourceUnavailableException("No chat model configured");
        }

        BrowsingContext page;
        try {
            page = browserProvider.openPage(startUrl);
        } catch (RuntimeException e) {
            logger.error("Failed to open page on {}: {}", startUrl, e.getMessage());
            throw new ResourceUnavailableException("Failed to create session: " + e.getMessage(), e);
        }

        WebVoyagerGraph graph = new WebVoyagerGraph(page,
                new SpringAiOracle(model, systemPrompt),
                annotator,
                BrowserTools.defaults(searchUrl, Duration.ofSeconds(5)));
        return new SessionResources(page, graph);
    }

    private static String load(String resource) {
        try {
            return StreamUtils.copyToString(new ClassPathResource(resource).getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read classpath resource " + resource, e);
        }
    }
}
