package dev.dimitra.reviewbot.consolidation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import dev.dimitra.reviewbot.model.ReviewComment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code [{file_path, line_number, review_comment}]} out of a model reply.
 * Elements that are not objects, or carry no comment text, are skipped.
 */
public class ReviewCommentParser {

    private final JsonArrayExtractor extractor;

    public ReviewCommentParser() {
        this(new JsonArrayExtractor());
    }

    public ReviewCommentParser(JsonArrayExtractor extractor) {
        this.extractor = extractor;
    }

    /** @return the parsed comments, or empty when the reply holds no array */
    public Optional<List<ReviewComment>> tryParse(String reply) {
        return extractor.extract(reply).map(ReviewCommentParser::toComments);
    }

    private static List<ReviewComment> toComments(ArrayNode array) {
        List<ReviewComment> out = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isObject()) continue;
            String comment = text(item.get("review_comment"));
            if (comment == null) continue;
            out.add(new ReviewComment(text(item.get("file_path")), lineNumber(item.get("line_number")), comment));
        }
        return out;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) return null;
        String s = node.asText("");
        return s.isBlank() ? null : s;
    }

    private static Integer lineNumber(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isIntegralNumber()) return node.canConvertToInt() ? node.intValue() : null;
        if (node.isNumber()) return node.canConvertToInt() ? (int) node.doubleValue() : null;
        String s = node.asText("").trim();
        if (s.matches("\\d+")) {
            try {
                return Integer.valueOf(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
