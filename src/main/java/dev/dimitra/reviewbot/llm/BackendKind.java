package dev.dimitra.reviewbot.llm;

import java.util.Locale;

public enum BackendKind {
    /** Locally hosted, unauthenticated Ollama server. */
    LOCAL,
    /** Azure OpenAI deployment authenticated with a client-credentials bearer token. */
    HOSTED;

    public static BackendKind fromValue(String value) {
        if (value == null || value.isBlank()) return HOSTED;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "local":
            case "ollama":
                return LOCAL;
            case "hosted":
            case "azure":
                return HOSTED;
            default:
                throw new LlmConfigurationException("Unknown LLM_BACKEND: " + value);
        }
    }
}
