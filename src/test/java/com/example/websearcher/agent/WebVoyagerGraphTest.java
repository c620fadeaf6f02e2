package com.example.websearcher.agent;

import com.example.websearcher.browser.BrowsingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebVoyagerGraphTest {

    private static final String MARK_SCRIPT = "/* mark */";

    @Mock
    private BrowsingContext page;

    @Mock
    private Oracle oracle;

    private WebVoyagerGraph graph;

    @BeforeEach
    void setUp() {
        PageAnnotator annotator = new PageAnnotator(MARK_SCRIPT, 3, Duration.ZERO);
        graph = new WebVoyagerGraph(page, oracle, annotator,
                BrowserTools.defaults("https://www.google.com/", Duration.ZERO));

        lenient().when(page.evaluate(anyString())).thenReturn(null);
        lenient().when(page.evaluate("markPage()")).thenReturn(List.of(
                Map.of("x", 10, "y", 20.5, "type", "input", "text", "", "ariaLabel", "Search"),
                Map.of("x", 100, "y", 50, "type", "a", "text", "Weather", "ariaLabel", "")));
        lenient().when(page.screenshot()).thenReturn(new byte[]{1, 2, 3});
    }

    @Test
    void testStream_ToolStepThenAnswer() throws Exception {
        // Given
        when(oracle.predict(any(AgentPrompt.class)))
                .thenReturn("Thought: search\nAction: Type [0]; [weather paris]")
                .thenReturn("Thought: done\nAction: ANSWER; [21 degrees]");

        // When
        DecisionStream stream = graph.stream("What's the weather in Paris?");
        StepEvent first = stream.next();
        StepEvent tool = stream.next();
        StepEvent bookkeeping = stream.next();
        StepEvent answer = stream.next();
        StepEvent end = stream.next();

        // Then
        assertEquals(StepEvent.AGENT_NODE, first.getNode());
        assertEquals("Type", first.getPrediction().getName());
        assertEquals("Type", tool.getNode());
        assertFalse(tool.hasPrediction());
        assertEquals("Typed weather paris and submitted", tool.getObservation());
        assertEquals(StepEvent.SCRATCHPAD_NODE, bookkeeping.getNode());
        assertFalse(bookkeeping.hasPrediction());
        assertInstanceOf(AgentAction.Answer.class, answer.getPrediction());
        assertTrue(end.isEnd());

        verify(page).click(10.0, 20.5);
        verify(page).type("weather paris");
        verify(page).press("Enter");
    }

    @Test
    void testStream_ScratchpadFedBackToOracle() throws Exception {
        // Given
        when(oracle.predict(any(AgentPrompt.class)))
                .thenReturn("Action: Click 1")
                .thenReturn("Action: ANSWER; ok");

        // When
        DecisionStream stream = graph.stream("q");
        for (int i = 0; i < 4; i++) {
            stream.next();
        }

        // Then
        ArgumentCaptor<AgentPrompt> prompts = ArgumentCaptor.forClass(AgentPrompt.class);
        verify(oracle, times(2)).predict(prompts.capture());
        AgentPrompt firstPrompt = prompts.getAllValues().get(0);
        AgentPrompt secondPrompt = prompts.getAllValues().get(1);
        assertNull(firstPrompt.getScratchpad());
        assertEquals("q", firstPrompt.getInput());
        assertTrue(firstPrompt.getBboxDescriptions().contains("0 (<input/>): \"Search\""));
        assertTrue(firstPrompt.getBboxDescriptions().contains("1 (<a/>): \"Weather\""));
        assertArrayEquals(new byte[]{1, 2, 3}, firstPrompt.getScreenshot());
        assertTrue(secondPrompt.getScratchpad().endsWith("1. Clicked 1"));
        verify(page).click(100.0, 50.0);
    }

    @Test
    void testStream_UnparsableOutputRoutesBackToAgent() throws Exception {
        // Given
        when(oracle.predict(any(AgentPrompt.class)))
                .thenReturn("I am not sure what to do")
                .thenReturn("Action: ANSWER; fine");

        // When
        DecisionStream stream = graph.stream("q");
        StepEvent retry = stream.next();
        StepEvent answer = stream.next();

        // Then
        assertInstanceOf(AgentAction.RetryRequested.class, retry.getPrediction());
        assertInstanceOf(AgentAction.Answer.class, answer.getPrediction());
        verify(page, never()).click(anyDouble(), anyDouble());
    }

    @Test
    void testStream_UnknownToolFails() throws Exception {
        // Given
        when(oracle.predict(any(AgentPrompt.class))).thenReturn("Action: Teleport 3");

        // When
        DecisionStream stream = graph.stream("q");
        stream.next();

        // Then
        IllegalStateException e = assertThrows(IllegalStateException.class, stream::next);
        assertTrue(e.getMessage().contains("Teleport"));
    }

    @Test
    void testStream_MarkPageRetriedUntilItSucceeds() throws Exception {
        // Given
        when(page.evaluate("markPage()"))
                .thenThrow(new RuntimeException("Execution context was destroyed"))
                .thenReturn(List.of());
        when(oracle.predict(any(AgentPrompt.class))).thenReturn("Action: Wait");

        // When
        StepEvent event = graph.stream("q").next();

        // Then
        assertEquals("Wait", event.getPrediction().getName());
        verify(page, times(2)).evaluate("markPage()");
        verify(page).evaluate("unmarkPage()");
    }

    @Test
    void testStream_MarkPageGivesUpAfterConfiguredAttempts() {
        // Given
        when(page.evaluate("markPage()")).thenThrow(new RuntimeException("page crashed"));

        // When
        RuntimeException e = assertThrows(RuntimeException.class, () -> graph.stream("q").next());

        // Then
        assertEquals("page crashed", e.getMessage());
        verify(page, times(3)).evaluate("markPage()");
        verifyNoInteractions(oracle);
    }

    @Test
    void testStream_FailsAfterRelease() {
        DecisionStream stream = graph.stream("q");
        graph.release();

        assertThrows(IllegalStateException.class, stream::next);
    }
}
