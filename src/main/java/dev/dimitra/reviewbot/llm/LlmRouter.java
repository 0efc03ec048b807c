package dev.dimitra.reviewbot.llm;

import dev.dimitra.reviewbot.config.LlmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the client for a backend kind. Used as the construction step of {@link LlmClientCache}.
 */
public class LlmRouter implements LlmClientFactory {
    private static final Logger log = LoggerFactory.getLogger(LlmRouter.class);

    private final LlmSettings settings;

    public LlmRouter(LlmSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public LlmClient create(BackendKind kind, double temperature) {
        switch (kind) {
            case LOCAL:
                log.info("Creating local Ollama client ({} @ {})", settings.ollamaModel(), settings.ollamaUrl());
                return new OllamaClient(settings.ollamaUrl(), settings.ollamaModel(), settings.requestTimeout());
            case HOSTED:
            default:
                log.info("Creating Azure OpenAI client (deployment {})", settings.deploymentName());
                return new AzureOpenAiClient(settings);
        }
    }
}
