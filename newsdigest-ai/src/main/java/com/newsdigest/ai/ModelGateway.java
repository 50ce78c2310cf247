package com.newsdigest.ai;

/**
 * Single entry point for talking to a language model.
 * Callers never see which wire format the configured provider speaks.
 */
public interface ModelGateway {

    /**
     * Send one system prompt plus one user message and return the reply text.
     */
    String chat(String systemPrompt, String userContent) throws ModelException;

    /**
     * Ask the model whether the content is worth reading. The reply is raw model text.
     */
    default String classify(String filterPrompt, String content) throws ModelException {
        return chat(filterPrompt, content);
    }

    /**
     * Ask the model for a summary of the content.
     */
    default String summarize(String summaryPrompt, String content) throws ModelException {
        return chat(summaryPrompt, content);
    }
}
