package dev.dimitra.reviewbot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A line-anchored comment ready to post on a pull request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"file_path", "line_number", "review_comment"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ReviewComment(
        @JsonProperty("file_path") String filePath,
        @JsonProperty("line_number") Integer lineNumber,
        @JsonProperty("review_comment") String reviewComment
) {
    public ReviewComment withFilePath(String path) {
        return new ReviewComment(path, lineNumber, reviewComment);
    }
}
