package dev.dimitra.reviewbot.llm;

@FunctionalInterface
public interface LlmClientFactory {
    LlmClient create(BackendKind kind, double temperature);
}
