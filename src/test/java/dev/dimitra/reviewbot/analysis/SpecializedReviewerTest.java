package dev.dimitra.reviewbot.analysis;

import dev.dimitra.reviewbot.llm.BackendKind;
import dev.dimitra.reviewbot.llm.BackendUnavailableException;
import dev.dimitra.reviewbot.llm.LlmClient;
import dev.dimitra.reviewbot.llm.LlmClientCache;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewerResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpecializedReviewerTest {

    @Mock
    private LlmClient llm;

    private SpecializedReviewer reviewer(double creativity) {
        return new SpecializedReviewer(ReviewCategory.PERFORMANCE, llm, new ResponseParser(), creativity);
    }

    private static LlmClient.Result reply(String text) {
        return new LlmClient.Result(text, new LlmClient.Usage(1, 1));
    }

    @Test
    void parsesReplyIntoResult() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(reply("Line 3: Issue: nested loop is O(n^2) (Medium)"));

        ReviewerResult result = reviewer(0.1).review("for a\n for b\n  x", false);

        assertThat(result).isNotNull();
        assertThat(result.reviewerName()).isEqualTo("PerformanceReviewer");
        assertThat(result.category()).isEqualTo(ReviewCategory.PERFORMANCE);
        assertThat(result.score()).isEqualTo(9);
    }

    @Test
    void temperatureNeverDropsBelowFloor() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt())).thenReturn(reply("fine"));

        reviewer(0.05).review("x", false);

        verify(llm).complete(anyString(), anyString(), eq(0.2), eq(2000));
    }

    @Test
    void diffOnlyPromptIsSentUnnumbered() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt())).thenReturn(reply("fine"));
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);

        reviewer(0.5).review("+int x = 1;", true);

        verify(llm).complete(anyString(), prompt.capture(), eq(0.5), anyInt());
        assertThat(prompt.getValue()).contains("CRITICAL RESTRICTION", "+int x = 1;");
    }

    @Test
    void backendFailureReturnsNull() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt()))
                .thenThrow(new BackendUnavailableException("down", 503));

        assertThat(reviewer(0.1).review("x", false)).isNull();
    }

    @Test
    void emptyReplyReturnsNull() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt())).thenReturn(reply("   "));

        assertThat(reviewer(0.1).review("x", false)).isNull();
    }

    @Test
    void interruptReturnsNullAndKeepsFlag() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt())).thenThrow(new InterruptedException());

        try {
            assertThat(reviewer(0.1).review("x", false)).isNull();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void cachedClientIsNamedAfterCategory() {
        LlmClientCache cache = new LlmClientCache((kind, t) -> llm);

        new SpecializedReviewer(ReviewCategory.SECURITY, cache, BackendKind.LOCAL, 0.1);

        assertThat(cache.keys()).extracting(LlmClientCache.Key::name).containsExactly("security_agent");
    }
}
