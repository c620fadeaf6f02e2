package com.example.websearcher.agent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.util.MimeTypeUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiOracleTest {

    @Mock
    private ChatModel chatModel;

    @Test
    void testPredict_BuildsPromptWithScreenshotAndScratchpad() {
        // Given
        when(chatModel.call(any(Prompt.class))).thenReturn(
                new ChatResponse(List.of(new Generation(new AssistantMessage("Action: Wait")))));
        SpringAiOracle oracle = new SpringAiOracle(chatModel, "You are a web robot.");
        AgentPrompt prompt = AgentPrompt.builder()
                .input("Who won?")
                .bboxDescriptions("\nValid Bounding Boxes:\n0 (<a/>): \"News\"")
                .scratchpad("Previous action observations:\n1. Clicked 0")
                .screenshot(new byte[]{9, 9})
                .build();

        // When
        String output = oracle.predict(prompt);

        // Then
        assertEquals("Action: Wait", output);
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        List<Message> messages = captor.getValue().getInstructions();
        assertEquals(3, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("You are a web robot.", messages.get(0).getText());
        assertEquals("Previous action observations:\n1. Clicked 0", messages.get(1).getText());
        UserMessage user = (UserMessage) messages.get(2);
        assertTrue(user.getText().endsWith("\n\nQuestion: Who won?"));
        assertEquals(1, user.getMedia().size());
        assertEquals(MimeTypeUtils.IMAGE_PNG, user.getMedia().get(0).getMimeType());
    }

    @Test
    void testPredict_FirstStepHasNoScratchpadMessage() {
        // Given
        when(chatModel.call(any(Prompt.class))).thenReturn(
                new ChatResponse(List.of(new Generation(new AssistantMessage("Action: Google")))));
        SpringAiOracle oracle = new SpringAiOracle(chatModel, "system");

        // When
        oracle.predict(AgentPrompt.builder().input("q").bboxDescriptions("").build());

        // Then
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        List<Message> messages = captor.getValue().getInstructions();
        assertEquals(2, messages.size());
        assertTrue(((UserMessage) messages.get(1)).getMedia().isEmpty());
    }

    @Test
    void testPredict_EmptyResponseFails() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));
        SpringAiOracle oracle = new SpringAiOracle(chatModel, "system");

        assertThrows(IllegalStateException.class,
                () -> oracle.predict(AgentPrompt.builder().input("q").bboxDescriptions("").build()));
    }
}
