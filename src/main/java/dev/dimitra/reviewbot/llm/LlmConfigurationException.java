package dev.dimitra.reviewbot.llm;

/**
 * Required backend settings (credentials, endpoint) are missing. Raised while building a client and never absorbed.
 */
public class LlmConfigurationException extends IllegalArgumentException {
    public LlmConfigurationException(String message) {
        super(message);
    }
}
