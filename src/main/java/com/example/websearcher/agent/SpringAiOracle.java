package com.example.websearcher.agent;

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.MimeTypeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link Oracle} backed by a Spring AI chat model. The screenshot is attached to the
 * user message as a PNG image.
 */
public class SpringAiOracle implements Oracle {

    private final ChatModel chatModel;
    private final String systemPrompt;

    public SpringAiOracle(ChatModel chatModel, String systemPrompt) {
        this.chatModel = chatModel;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public String predict(AgentPrompt prompt) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(systemPrompt));
        if (prompt.getScratchpad() != null) {
            messages.add(new SystemMessage(prompt.getScratchpad()));
        }
        UserMessage.Builder user = UserMessage.builder()
                .text(prompt.getBboxDescriptions() + "\n\nQuestion: " + prompt.getInput());
        if (prompt.getScreenshot() != null) {
            user.media(new Media(MimeTypeUtils.IMAGE_PNG, new ByteArrayResource(prompt.getScreenshot())));
        }
        messages.add(user.build());

        ChatResponse response = chatModel.call(new Prompt(messages));
        if (response == null || response.getResult() == null) {
            throw new IllegalStateException("Chat model returned no result");
        }
        String text = response.getResult().getOutput().getText();
        return text == null ? "" : text;
    }
}
