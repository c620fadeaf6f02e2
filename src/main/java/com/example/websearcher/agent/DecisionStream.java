package com.example.websearcher.agent;

@FunctionalInterface
public interface DecisionStream {

    /**
     * Runs the graph up to its next node and reports what happened. Once the graph
     * has finished, every call returns {@link StepEvent#end()}.
     *
     * @throws Exception when the model or the browser fails; the stream is not usable afterwards
     */
    StepEvent next() throws Exception;
}
