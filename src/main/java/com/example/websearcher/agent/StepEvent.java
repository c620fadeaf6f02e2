package com.example.websearcher.agent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One item of a {@link DecisionStream}. Only events produced by the agent node carry a
 * prediction; tool and bookkeeping nodes emit events without one.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StepEvent {

    public static final String AGENT_NODE = "agent";
    public static final String SCRATCHPAD_NODE = "update_scratchpad";

    String node;
    AgentAction prediction;
    String observation;
    boolean end;

    public static StepEvent agent(AgentAction prediction) {
        return new StepEvent(AGENT_NODE, prediction, null, false);
    }

    public static StepEvent observation(String node, String observation) {
        return new StepEvent(node, null, observation, false);
    }

    public static StepEvent bookkeeping(String node) {
        return new StepEvent(node, null, null, false);
    }

    public static StepEvent end() {
        return new StepEvent(null, null, null, true);
    }

    public boolean hasPrediction() {
        return prediction != null;
    }
}
