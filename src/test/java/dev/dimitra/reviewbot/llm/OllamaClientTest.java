package dev.dimitra.reviewbot.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private HttpServer server;
    private volatile int status = 200;
    private volatile String reply = "{\"response\":\"  Line 3: Issue: minor naming  \",\"prompt_eval_count\":12,\"eval_count\":7}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/generate", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OllamaClient client() {
        return new OllamaClient("http://127.0.0.1:" + server.getAddress().getPort() + "/", "llama3.2", Duration.ofSeconds(5));
    }

    @Test
    void postsFlattenedPromptAndReadsResponse() throws Exception {
        LlmClient.Result result = client().complete("be strict", "review this", 0.3, 2000);

        assertThat(result.text()).isEqualTo("Line 3: Issue: minor naming");
        assertThat(result.usage()).isEqualTo(new LlmClient.Usage(12, 7));

        JsonNode sent = mapper.readTree(lastBody.get());
        assertThat(sent.path("model").asText()).isEqualTo("llama3.2");
        assertThat(sent.path("stream").asBoolean(true)).isFalse();
        assertThat(sent.path("prompt").asText()).isEqualTo("System: be strict\n\nUser: review this");
        assertThat(sent.path("options").path("temperature").asDouble()).isEqualTo(0.3);
        assertThat(sent.path("options").path("num_predict").asInt()).isEqualTo(2000);
    }

    @Test
    void nonSuccessStatusIsBackendUnavailable() {
        status = 500;
        reply = "{\"error\":\"model not loaded\"}";

        assertThatThrownBy(() -> client().complete("s", "u", 0.2, 100))
                .isInstanceOfSatisfying(BackendUnavailableException.class,
                        e -> assertThat(e.statusCode()).isEqualTo(500));
    }

    @Test
    void unreachableServerIsBackendUnavailable() throws IOException {
        HttpServer gone = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = gone.getAddress().getPort();
        gone.stop(0);
        OllamaClient dead = new OllamaClient("http://127.0.0.1:" + port, "llama3.2", Duration.ofSeconds(2));

        assertThatThrownBy(() -> dead.complete("s", "u", 0.2, 100))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void promptWithoutSystemTurnHasOnlyUserPart() {
        assertThat(OllamaClient.toPrompt(null, "hello")).isEqualTo("User: hello");
    }
}
