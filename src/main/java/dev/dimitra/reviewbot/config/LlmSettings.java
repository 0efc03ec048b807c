package dev.dimitra.reviewbot.config;

import java.time.Duration;

/**
 * Connection settings for both backends. Credentials are only validated when a hosted client is built.
 */
public record LlmSettings(
        String ollamaUrl,
        String ollamaModel,
        String azureTenantId,
        String azureClientId,
        String azureClientSecret,
        String azureEndpoint,
        String azureTokenUrl,
        String azureScope,
        String azureOpenAiUrl,
        String deploymentName,
        String apiVersion,
        Duration requestTimeout
) {
    public static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";
    public static final String DEFAULT_OLLAMA_MODEL = "llama3.2";
    public static final String DEFAULT_SCOPE = "https://cognitiveservices.azure.com/.default";

    public static LlmSettings fromEnv(EnvConfig env) {
        String tenant = env.optional("AZURE_TENANT_ID");
        String tokenUrl = env.env("AZURE_TOKEN_URL",
                tenant == null ? null : "https://login.microsoftonline.com/" + tenant + "/oauth2/v2.0/token");
        return new LlmSettings(
                env.env("OLLAMA_URL", DEFAULT_OLLAMA_URL),
                env.env("OLLAMA_MODEL", DEFAULT_OLLAMA_MODEL),
                tenant,
                env.optional("AZURE_CLIENT_ID"),
                env.optional("AZURE_CLIENT_SECRET"),
                env.optional("AZURE_ENDPOINT"),
                tokenUrl,
                env.env("AZURE_SCOPE", DEFAULT_SCOPE),
                env.optional("AZURE_OPENAI_URL"),
                env.env("AZURE_DEPLOYMENT_NAME", "gpt-4"),
                env.env("AZURE_API_VERSION", "2024-02-15-preview"),
                Duration.ofSeconds(Math.max(1, env.intEnv("LLM_REQUEST_TIMEOUT_SECONDS", 300)))
        );
    }

    /** Local-only settings, handy for tests and for the Ollama quick start. */
    public static LlmSettings local(String ollamaUrl, String ollamaModel) {
        return new LlmSettings(ollamaUrl, ollamaModel, null, null, null, null, null,
                DEFAULT_SCOPE, null, "gpt-4", "2024-02-15-preview", Duration.ofSeconds(300));
    }
}
