package dev.dimitra.reviewbot.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.*;
import java.time.Duration;
import java.util.Objects;

/**
 * OllamaClient – talks to a locally hosted Ollama server through /api/generate (non-streaming).
 * Ollama's generate endpoint takes a single prompt, so the system and user turns are flattened.
 */
public class OllamaClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String model;
    private final Duration requestTimeout;

    public OllamaClient(String baseUrl, String model, Duration requestTimeout) {
        this.baseUrl = stripTrailingSlash((baseUrl == null || baseUrl.isBlank()) ? "http://localhost:11434" : baseUrl);
        this.model = (model == null || model.isBlank()) ? "llama3.2" : model;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public Result complete(String systemPrompt, String userPrompt, double temperature, int maxTokens)
            throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("prompt", toPrompt(systemPrompt, userPrompt));
        body.put("stream", false);
        ObjectNode options = body.putObject("options");
        options.put("temperature", temperature);
        if (maxTokens > 0) options.put("num_predict", maxTokens);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (ConnectException e) {
            throw new BackendUnavailableException("Ollama unreachable at " + baseUrl, e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new BackendUnavailableException("Ollama error " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
        }

        JsonNode root = mapper.readTree(resp.body());
        String text = root.path("response").asText("").trim();
        int promptT = root.path("prompt_eval_count").asInt(0);
        int completionT = root.path("eval_count").asInt(0);
        log.debug("Ollama {} replied with {} chars", model, text.length());
        return new Result(text, new Usage(promptT, completionT));
    }

    static String toPrompt(String systemPrompt, String userPrompt) {
        StringBuilder sb = new StringBuilder();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            sb.append("System: ").append(systemPrompt).append("\n\n");
        }
        sb.append("User: ").append(userPrompt == null ? "" : userPrompt);
        return sb.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
