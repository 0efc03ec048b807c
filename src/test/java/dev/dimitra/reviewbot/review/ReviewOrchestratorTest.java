package dev.dimitra.reviewbot.review;

import dev.dimitra.reviewbot.analysis.ResponseParser;
import dev.dimitra.reviewbot.analysis.SpecializedReviewer;
import dev.dimitra.reviewbot.llm.BackendUnavailableException;
import dev.dimitra.reviewbot.llm.LlmClient;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewerResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewOrchestratorTest {

    private static LlmClient answering(String text) {
        return (system, user, temperature, maxTokens) -> new LlmClient.Result(text, new LlmClient.Usage(0, 0));
    }

    private static LlmClient sleeping(long millis, String text) {
        return (system, user, temperature, maxTokens) -> {
            Thread.sleep(millis);
            return new LlmClient.Result(text, new LlmClient.Usage(0, 0));
        };
    }

    private static LlmClient failing() {
        return (system, user, temperature, maxTokens) -> {
            throw new BackendUnavailableException("connection refused", -1);
        };
    }

    private static SpecializedReviewer reviewer(ReviewCategory category, LlmClient llm) {
        return new SpecializedReviewer(category, llm, new ResponseParser(), 0.1);
    }

    @Nested
    @DisplayName("parallel")
    class Parallel {

        @Test
        void collectsEveryEnabledReviewer() {
            ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                    reviewer(ReviewCategory.SECURITY, answering("Issue: critical secret in code")),
                    reviewer(ReviewCategory.PERFORMANCE, answering("All good")),
                    reviewer(ReviewCategory.READABILITY, answering("Issue: minor naming"))),
                    null, Duration.ofSeconds(10));

            List<ReviewerResult> results = orchestrator.run("code", false, true);

            assertThat(results).extracting(ReviewerResult::category)
                    .containsExactlyInAnyOrder(ReviewCategory.SECURITY, ReviewCategory.PERFORMANCE, ReviewCategory.READABILITY);
        }

        @Test
        void failingReviewerDoesNotStopOthers() {
            ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                    reviewer(ReviewCategory.SECURITY, failing()),
                    reviewer(ReviewCategory.ARCHITECTURE, answering("Issue: high coupling"))),
                    null, Duration.ofSeconds(10));

            List<ReviewerResult> results = orchestrator.run("code", false, true);

            assertThat(results).extracting(ReviewerResult::category).containsExactly(ReviewCategory.ARCHITECTURE);
        }

        @Test
        void slowReviewerIsLeftOutAfterTimeout() {
            ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                    reviewer(ReviewCategory.SECURITY, sleeping(10_000, "late")),
                    reviewer(ReviewCategory.TESTABILITY, answering("Issue: hard-coded clock"))),
                    null, Duration.ofMillis(500));

            long started = System.nanoTime();
            List<ReviewerResult> results = orchestrator.run("code", false, true);

            assertThat(results).extracting(ReviewerResult::category).containsExactly(ReviewCategory.TESTABILITY);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        void workersCarryNumberedReviewerNames() {
            List<String> threadNames = new ArrayList<>();
            LlmClient recording = (system, user, temperature, maxTokens) -> {
                synchronized (threadNames) {
                    threadNames.add(Thread.currentThread().getName());
                }
                return new LlmClient.Result("ok", new LlmClient.Usage(0, 0));
            };
            ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                    reviewer(ReviewCategory.SECURITY, recording),
                    reviewer(ReviewCategory.PERFORMANCE, recording)),
                    null, Duration.ofSeconds(10));

            orchestrator.run("code", false, true);

            assertThat(threadNames).hasSize(2).allMatch(name -> name.matches("reviewer-worker-\\d+"));
        }

        @Test
        void resultsArriveInCompletionOrder() {
            ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                    reviewer(ReviewCategory.SECURITY, sleeping(600, "slow")),
                    reviewer(ReviewCategory.PERFORMANCE, answering("fast"))),
                    null, Duration.ofSeconds(10));

            List<ReviewerResult> results = orchestrator.run("code", false, true);

            assertThat(results).extracting(ReviewerResult::category)
                    .containsExactly(ReviewCategory.PERFORMANCE, ReviewCategory.SECURITY);
        }
    }

    @Nested
    @DisplayName("sequential")
    class Sequential {

        @Test
        void keepsSubmissionOrder() {
            List<String> calls = new ArrayList<>();
            LlmClient recording = (system, user, temperature, maxTokens) -> {
                synchronized (calls) {
                    calls.add(system);
                }
                return new LlmClient.Result("ok", new LlmClient.Usage(0, 0));
            };
            ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                    reviewer(ReviewCategory.SECURITY, recording),
                    reviewer(ReviewCategory.PERFORMANCE, recording),
                    reviewer(ReviewCategory.READABILITY, recording)),
                    null, Duration.ofSeconds(10));

            List<ReviewerResult> results = orchestrator.run("code", false, false);

            assertThat(results).extracting(ReviewerResult::category)
                    .containsExactly(ReviewCategory.SECURITY, ReviewCategory.PERFORMANCE, ReviewCategory.READABILITY);
            assertThat(calls).hasSize(3);
        }

        @Test
        void timedOutReviewerIsSkippedAndNextStillRuns() {
            ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                    reviewer(ReviewCategory.SECURITY, sleeping(10_000, "late")),
                    reviewer(ReviewCategory.PERFORMANCE, answering("fine")),
                    reviewer(ReviewCategory.READABILITY, failing())),
                    null, Duration.ofMillis(400));

            List<ReviewerResult> results = orchestrator.run("code", false, false);

            assertThat(results).extracting(ReviewerResult::category).containsExactly(ReviewCategory.PERFORMANCE);
        }
    }

    @Test
    void nothingEnabledMeansNoResults() {
        ReviewOrchestrator orchestrator = new ReviewOrchestrator(
                List.of(reviewer(ReviewCategory.SECURITY, answering("ok"))), List.of(), Duration.ofSeconds(1));

        assertThat(orchestrator.run("code", false, true)).isEmpty();
    }

    @Test
    void everyReviewerFailingMeansNoResults() {
        ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                reviewer(ReviewCategory.SECURITY, failing()),
                reviewer(ReviewCategory.PERFORMANCE, answering(""))),
                null, Duration.ofSeconds(5));

        assertThat(orchestrator.run("code", false, true)).isEmpty();
    }

    @Test
    void enablingUnknownCategoriesIsIgnored() {
        ReviewOrchestrator orchestrator = new ReviewOrchestrator(List.of(
                reviewer(ReviewCategory.SECURITY, answering("ok")),
                reviewer(ReviewCategory.PERFORMANCE, answering("ok"))),
                null, null);

        orchestrator.setEnabledCategories(EnumSet.of(ReviewCategory.PERFORMANCE, ReviewCategory.ARCHITECTURE));

        ReviewOrchestrator.ReviewerStatistics stats = orchestrator.statistics();
        assertThat(stats.totalReviewers()).isEqualTo(2);
        assertThat(stats.enabledCategories()).containsExactly(ReviewCategory.PERFORMANCE);
        assertThat(stats.disabledCategories()).containsExactly(ReviewCategory.SECURITY);
        assertThat(orchestrator.run("code", false, true)).extracting(ReviewerResult::category)
                .containsExactly(ReviewCategory.PERFORMANCE);
    }
}
