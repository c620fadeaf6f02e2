package com.example.websearcher.agent;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AgentPrompt {
    String input;
    String bboxDescriptions;
    String scratchpad;
    byte[] screenshot;
}
