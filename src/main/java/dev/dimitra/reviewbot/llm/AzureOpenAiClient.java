package dev.dimitra.reviewbot.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.dimitra.reviewbot.config.LlmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AzureOpenAiClient – chat completions against an Azure OpenAI deployment.
 * Holds a bearer token from a client-credentials exchange; a 401 triggers one refresh and one retry.
 */
public class AzureOpenAiClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(AzureOpenAiClient.class);

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final String clientId;
    private final String clientSecret;
    private final String tokenUrl;
    private final String scope;
    private final String completionsUrl;
    private final Duration requestTimeout;

    private final Object tokenLock = new Object();
    private volatile String accessToken;

    public AzureOpenAiClient(LlmSettings settings) {
        this.clientId = require(settings.azureClientId(), "AZURE_CLIENT_ID");
        this.clientSecret = require(settings.azureClientSecret(), "AZURE_CLIENT_SECRET");
        this.tokenUrl = require(settings.azureTokenUrl(), "AZURE_TENANT_ID or AZURE_TOKEN_URL");
        this.scope = (settings.azureScope() == null || settings.azureScope().isBlank())
                ? LlmSettings.DEFAULT_SCOPE : settings.azureScope();
        if (settings.azureOpenAiUrl() != null && !settings.azureOpenAiUrl().isBlank()) {
            this.completionsUrl = settings.azureOpenAiUrl();
        } else {
            String endpoint = require(settings.azureEndpoint(), "AZURE_ENDPOINT");
            if (endpoint.endsWith("/")) endpoint = endpoint.substring(0, endpoint.length() - 1);
            this.completionsUrl = endpoint + "/openai/deployments/" + settings.deploymentName()
                    + "/chat/completions?api-version=" + settings.apiVersion();
        }
        this.requestTimeout = settings.requestTimeout() == null ? Duration.ofSeconds(300) : settings.requestTimeout();
    }

    @Override
    public Result complete(String systemPrompt, String userPrompt, double temperature, int maxTokens)
            throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode msgs = body.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            msgs.addObject().put("role", "system").put("content", systemPrompt);
        }
        msgs.addObject().put("role", "user").put("content", userPrompt == null ? "" : userPrompt);
        if (maxTokens > 0) body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("top_p", 0.9);
        String json = mapper.writeValueAsString(body);

        String token = currentToken();
        HttpResponse<String> resp = post(json, token);
        if (resp.statusCode() == 401) {
            log.info("Azure OpenAI token rejected, refreshing once");
            token = refreshToken(token);
            resp = post(json, token);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new BackendUnavailableException("Azure OpenAI error " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
        }

        JsonNode root = mapper.readTree(resp.body());
        String text = root.path("choices").path(0).path("message").path("content").asText("").trim();
        int promptT = root.path("usage").path("prompt_tokens").asInt(0);
        int completionT = root.path("usage").path("completion_tokens").asInt(0);
        return new Result(text, new Usage(promptT, completionT));
    }

    private HttpResponse<String> post(String json, String token) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(completionsUrl))
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (ConnectException e) {
            throw new BackendUnavailableException("Azure OpenAI unreachable at " + completionsUrl, e);
        }
    }

    private String currentToken() throws IOException, InterruptedException {
        String t = accessToken;
        return t != null ? t : refreshToken(null);
    }

    /**
     * Fetches a new token unless another caller already replaced {@code staleToken}.
     */
    String refreshToken(String staleToken) throws IOException, InterruptedException {
        synchronized (tokenLock) {
            if (accessToken != null && !accessToken.equals(staleToken)) {
                return accessToken;
            }
            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", "client_credentials");
            form.put("client_id", clientId);
            form.put("client_secret", clientSecret);
            form.put("scope", scope);
            String encoded = form.entrySet().stream()
                    .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                            + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                    .collect(Collectors.joining("&"));

            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(tokenUrl))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(encoded))
                    .build();
            HttpResponse<String> resp;
            try {
                resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            } catch (ConnectException e) {
                throw new BackendUnavailableException("Token endpoint unreachable at " + tokenUrl, e);
            }
            if (resp.statusCode() / 100 != 2) {
                throw new BackendUnavailableException("Token request failed " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
            }
            String token = mapper.readTree(resp.body()).path("access_token").asText("");
            if (token.isBlank()) {
                throw new BackendUnavailableException("No access token received from " + tokenUrl, resp.statusCode());
            }
            accessToken = token;
            log.debug("Azure access token refreshed");
            return token;
        }
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new LlmConfigurationException("Missing Azure credentials: " + name);
        }
        return value;
    }
}
