package dev.dimitra.reviewbot.consolidation;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON array out of a model reply that may be wrapped in prose or markdown.
 * Strategies run in declaration order; each one is total and never throws.
 */
public final class JsonArrayExtractor {
    private static final Logger log = LoggerFactory.getLogger(JsonArrayExtractor.class);

    static final ObjectMapper LENIENT = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?[ \\t]*\\r?\\n(.*?)\\r?\\n?```", Pattern.DOTALL);
    private static final Pattern GREEDY_SPAN = Pattern.compile("\\[.*]", Pattern.DOTALL);
    private static final Pattern LAZY_SPAN = Pattern.compile("\\[.*?]", Pattern.DOTALL);

    public enum Strategy {
        /** The whole reply is the array. */
        DIRECT {
            @Override
            public Optional<ArrayNode> extract(String text) {
                return readArray(text);
            }
        },
        /** The first fenced code block that holds an array. */
        FENCED_BLOCK {
            @Override
            public Optional<ArrayNode> extract(String text) {
                Matcher m = FENCE.matcher(text);
                while (m.find()) {
                    Optional<ArrayNode> arr = readArray(m.group(1));
                    if (arr.isPresent()) return arr;
                }
                return Optional.empty();
            }
        },
        /** The widest {@code [...]} span, then the first shortest one. */
        BRACKET_SPAN {
            @Override
            public Optional<ArrayNode> extract(String text) {
                Matcher greedy = GREEDY_SPAN.matcher(text);
                if (greedy.find()) {
                    Optional<ArrayNode> arr = readArray(greedy.group());
                    if (arr.isPresent()) return arr;
                }
                Matcher lazy = LAZY_SPAN.matcher(text);
                while (lazy.find()) {
                    Optional<ArrayNode> arr = readArray(lazy.group());
                    if (arr.isPresent()) return arr;
                }
                return Optional.empty();
            }
        };

        public abstract Optional<ArrayNode> extract(String text);
    }

    private final List<Strategy> chain;

    public JsonArrayExtractor() {
        this(List.of(Strategy.values()));
    }

    public JsonArrayExtractor(List<Strategy> chain) {
        this.chain = List.copyOf(chain);
    }

    /** @return the first array any strategy finds, or empty when none does */
    public Optional<ArrayNode> extract(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (Strategy s : chain) {
            Optional<ArrayNode> arr = s.extract(text);
            if (arr.isPresent()) {
                log.debug("Extracted JSON array with {} strategy ({} items)", s, arr.get().size());
                return arr;
            }
        }
        log.warn("No JSON array found in reply ({} chars)", text.length());
        return Optional.empty();
    }

    private static Optional<ArrayNode> readArray(String candidate) {
        if (candidate == null || candidate.isBlank()) return Optional.empty();
        try {
            JsonNode node = LENIENT.readTree(candidate.strip());
            return node != null && node.isArray() ? Optional.of((ArrayNode) node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
