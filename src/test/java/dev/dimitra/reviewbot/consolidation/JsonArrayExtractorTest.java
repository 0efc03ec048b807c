package dev.dimitra.reviewbot.consolidation;

import com.fasterxml.jackson.databind.node.ArrayNode;
import dev.dimitra.reviewbot.consolidation.JsonArrayExtractor.Strategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonArrayExtractorTest {

    @Nested
    @DisplayName("direct")
    class Direct {

        @Test
        void readsPlainArray() {
            assertThat(Strategy.DIRECT.extract(" [1, 2, 3] ")).hasValueSatisfying(a -> assertThat(a).hasSize(3));
        }

        @Test
        void toleratesTrailingComma() {
            assertThat(Strategy.DIRECT.extract("[{\"a\":1},]")).hasValueSatisfying(a -> assertThat(a).hasSize(1));
        }

        @Test
        void rejectsObjectsAndProse() {
            assertThat(Strategy.DIRECT.extract("{\"a\":1}")).isEmpty();
            assertThat(Strategy.DIRECT.extract("here: [1]")).isEmpty();
        }
    }

    @Nested
    @DisplayName("fenced block")
    class Fenced {

        @Test
        void readsJsonFence() {
            String reply = "Sure!\n```json\n[{\"line_number\": 4}]\n```\n";

            assertThat(Strategy.FENCED_BLOCK.extract(reply)).hasValueSatisfying(a ->
                    assertThat(a.get(0).path("line_number").asInt()).isEqualTo(4));
        }

        @Test
        void skipsFencesWithoutArrays() {
            String reply = "```\nnot json\n```\nthen\n```\n[\"second\"]\n```";

            assertThat(Strategy.FENCED_BLOCK.extract(reply)).hasValueSatisfying(a ->
                    assertThat(a.get(0).asText()).isEqualTo("second"));
        }

        @Test
        void noFenceMeansNothing() {
            assertThat(Strategy.FENCED_BLOCK.extract("[1, 2]")).isEmpty();
        }
    }

    @Nested
    @DisplayName("bracket span")
    class BracketSpan {

        @Test
        void findsArrayInsideProse() {
            assertThat(Strategy.BRACKET_SPAN.extract("Result: [{\"x\": [1, 2]}] end")).hasValueSatisfying(a ->
                    assertThat(a.get(0).path("x")).hasSize(2));
        }

        @Test
        void fallsBackToFirstParsableShortSpan() {
            assertThat(Strategy.BRACKET_SPAN.extract("see [note] and [1, 2]")).hasValueSatisfying(a ->
                    assertThat(a).hasSize(2));
        }

        @Test
        void noBracketsMeansNothing() {
            assertThat(Strategy.BRACKET_SPAN.extract("nothing here")).isEmpty();
        }
    }

    @Test
    void chainStopsAtFirstHit() {
        JsonArrayExtractor onlyDirect = new JsonArrayExtractor(List.of(Strategy.DIRECT));
        String fenced = "```json\n[1]\n```";

        assertThat(onlyDirect.extract(fenced)).isEmpty();
        assertThat(new JsonArrayExtractor().extract(fenced)).isPresent();
    }

    @Test
    void blankInputIsEmpty() {
        Optional<ArrayNode> none = new JsonArrayExtractor().extract("  ");

        assertThat(none).isEmpty();
        assertThat(new JsonArrayExtractor().extract(null)).isEmpty();
    }
}
