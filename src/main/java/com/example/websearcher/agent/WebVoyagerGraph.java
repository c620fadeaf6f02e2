package com.example.websearcher.agent;

import com.example.websearcher.browser.BrowsingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Web navigation agent: annotate the page, ask the model, run the chosen tool,
 * record the observation and start over until the model answers.
 *
 * <pre>
 *   agent --(tool)--> Click|Type|... --> update_scratchpad --> agent
 *   agent --(retry)--> agent
 *   agent --(ANSWER)--> end
 * </pre>
 */
public class WebVoyagerGraph implements DecisionGraph {

    private static final Logger logger = LoggerFactory.getLogger(WebVoyagerGraph.class);

    private final BrowsingContext page;
    private final Oracle oracle;
    private final PageAnnotator annotator;
    private final Map<String, BrowserTool> tools;
    private volatile boolean released;

    public WebVoyagerGraph(BrowsingContext page, Oracle oracle, PageAnnotator annotator, Map<String, BrowserTool> tools) {
        this.page = page;
        this.oracle = oracle;
        this.annotator = annotator;
        this.tools = Map.copyOf(tools);
    }

    @Override
    public DecisionStream stream(String question) {
        return new Run(question);
    }

    @Override
    public void release() {
        released = true;
    }

    private enum Node { AGENT, TOOL, SCRATCHPAD, END }

    private final class Run implements DecisionStream {

        private final String input;
        private Node next = Node.AGENT;
        private String scratchpad;
        private List<BoundingBox> boxes = List.of();
        private AgentAction.ToolCall pendingCall;
        private String observation;

        Run(String input) {
            this.input = input;
        }

        @Override
        public StepEvent next() throws InterruptedException {
            if (released) {
                throw new IllegalStateException("Decision graph has been released");
            }
            switch (next) {
                case AGENT:
                    return agent();
                case TOOL:
                    return tool();
                case SCRATCHPAD:
                    scratchpad = Scratchpad.append(scratchpad, observation);
                    next = Node.AGENT;
                    return StepEvent.bookkeeping(StepEvent.SCRATCHPAD_NODE);
                default:
                    return StepEvent.end();
            }
        }

        private StepEvent agent() throws InterruptedException {
            PageAnnotation annotation = annotator.annotate(page);
            boxes = annotation.getBoxes();
            String output = oracle.predict(AgentPrompt.builder()
                    .input(input)
                    .bboxDescriptions(annotation.describe())
                    .scratchpad(scratchpad)
                    .screenshot(annotation.getScreenshot())
                    .build());
            AgentAction prediction = ActionParser.parse(output);
            next = route(prediction);
            return StepEvent.agent(prediction);
        }

        private Node route(AgentAction prediction) {
            if (prediction instanceof AgentAction.Answer) {
                return Node.END;
            }
            if (prediction instanceof AgentAction.RetryRequested) {
                logger.debug("Model output not understood, asking again");
                return Node.AGENT;
            }
            pendingCall = (AgentAction.ToolCall) prediction;
            return Node.TOOL;
        }

        private StepEvent tool() throws InterruptedException {
            BrowserTool tool = tools.get(pendingCall.getName());
            if (tool == null) {
                throw new IllegalStateException("Unknown action: " + pendingCall.getName());
            }
            observation = tool.execute(page, boxes, pendingCall.getArgs());
            next = Node.SCRATCHPAD;
            return StepEvent.observation(pendingCall.getName(), observation);
        }
    }
}
