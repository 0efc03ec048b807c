package dev.dimitra.reviewbot.llm;

import java.io.IOException;

/**
 * Uniform entry point to a remote text-generation backend.
 * Implementations are thread-safe; one instance is shared by every reviewer holding the same cache key.
 */
public interface LlmClient {
    record Usage(int inputTokens, int outputTokens) {}
    record Result(String text, Usage usage) {}

    Result complete(String systemPrompt, String userPrompt, double temperature, int maxTokens)
            throws IOException, InterruptedException;
}
