package dev.dimitra.reviewbot.review;

import dev.dimitra.reviewbot.analysis.SpecializedReviewer;
import dev.dimitra.reviewbot.llm.BackendKind;
import dev.dimitra.reviewbot.llm.LlmClientCache;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs the enabled reviewers against one payload and collects whichever reviews succeed.
 * <p>
 * Parallel runs use a pool sized to the enabled reviewer count, created and shut down per call; results are
 * returned in completion order. Sequential runs keep submission order. A reviewer that fails, returns nothing
 * or outlives the timeout is logged and left out; it never stops the others.
 */
public class ReviewOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(6);

    private final Map<ReviewCategory, SpecializedReviewer> reviewers;
    private final Duration timeout;
    private volatile List<ReviewCategory> enabled;

    public ReviewOrchestrator(Collection<SpecializedReviewer> reviewers,
                              Collection<ReviewCategory> enabledCategories,
                              Duration timeout) {
        Map<ReviewCategory, SpecializedReviewer> byCategory = new EnumMap<>(ReviewCategory.class);
        for (SpecializedReviewer r : reviewers) {
            byCategory.put(r.category(), r);
        }
        this.reviewers = byCategory;
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        setEnabledCategories(enabledCategories);
    }

    /**
     * One reviewer per category, each with its own cached client named after the category.
     */
    public static ReviewOrchestrator create(LlmClientCache cache,
                                            BackendKind kind,
                                            double creativity,
                                            Collection<ReviewCategory> enabledCategories,
                                            Duration timeout) {
        List<SpecializedReviewer> all = new ArrayList<>();
        for (ReviewCategory c : ReviewCategory.values()) {
            all.add(new SpecializedReviewer(c, cache, kind, creativity));
        }
        return new ReviewOrchestrator(all, enabledCategories, timeout);
    }

    /** A null collection enables every available reviewer; unknown categories are ignored. */
    public void setEnabledCategories(Collection<ReviewCategory> categories) {
        Collection<ReviewCategory> requested = categories == null ? reviewers.keySet() : categories;
        LinkedHashSet<ReviewCategory> kept = new LinkedHashSet<>();
        for (ReviewCategory c : requested) {
            if (c != null && reviewers.containsKey(c)) kept.add(c);
        }
        this.enabled = List.copyOf(kept);
    }

    public List<ReviewCategory> enabledCategories() {
        return enabled;
    }

    public List<ReviewCategory> availableCategories() {
        return List.copyOf(reviewers.keySet());
    }

    public ReviewerStatistics statistics() {
        List<ReviewCategory> on = enabled;
        List<ReviewCategory> off = reviewers.keySet().stream()
                .filter(c -> !on.contains(c))
                .collect(Collectors.toList());
        return new ReviewerStatistics(reviewers.size(), on.size(), availableCategories(), on, off);
    }

    /**
     * @return successful reviews; empty when nothing is enabled or every reviewer failed
     */
    public List<ReviewerResult> run(String payload, boolean diffOnly, boolean parallel) {
        List<ReviewCategory> categories = enabled;
        if (categories.isEmpty()) {
            log.warn("No reviewers enabled; nothing to run");
            return List.of();
        }
        log.info("Starting multi-agent review with {} reviewer(s) ({}): {}",
                categories.size(), parallel ? "parallel" : "sequential", categories);

        List<ReviewerResult> results = parallel
                ? runParallel(categories, payload, diffOnly)
                : runSequential(categories, payload, diffOnly);

        if (results.isEmpty()) {
            log.error("No reviewer completed successfully");
        } else {
            log.info("Completed {} of {} reviewer(s)", results.size(), categories.size());
        }
        return List.copyOf(results);
    }

    private List<ReviewerResult> runParallel(List<ReviewCategory> categories, String payload, boolean diffOnly) {
        ExecutorService executor = Executors.newFixedThreadPool(categories.size(), reviewerThreads());
        CompletionService<ReviewerResult> completion = new ExecutorCompletionService<>(executor);
        Map<Future<ReviewerResult>, ReviewCategory> pending = new HashMap<>();
        List<ReviewerResult> results = new ArrayList<>();
        try {
            for (ReviewCategory c : categories) {
                SpecializedReviewer reviewer = reviewers.get(c);
                pending.put(completion.submit(() -> reviewer.review(payload, diffOnly)), c);
            }

            long deadline = System.nanoTime() + timeout.toNanos();
            while (!pending.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                Future<ReviewerResult> done = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (done == null) {
                    log.error("Reviewer(s) {} timed out after {}s", pending.values(), timeout.toSeconds());
                    break;
                }
                ReviewCategory c = pending.remove(done);
                collect(c, done, results);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Review interrupted; keeping {} completed review(s)", results.size());
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private List<ReviewerResult> runSequential(List<ReviewCategory> categories, String payload, boolean diffOnly) {
        ExecutorService executor = Executors.newSingleThreadExecutor(reviewerThreads());
        List<ReviewerResult> results = new ArrayList<>();
        try {
            for (ReviewCategory c : categories) {
                log.info("Running {} review...", c.displayName());
                SpecializedReviewer reviewer = reviewers.get(c);
                Future<ReviewerResult> future = executor.submit(() -> reviewer.review(payload, diffOnly));
                try {
                    ReviewerResult r = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                    accept(c, r, results);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.error("{} review timed out after {}s", c.displayName(), timeout.toSeconds());
                    // the stuck worker is abandoned; later reviewers get a fresh thread
                    executor.shutdownNow();
                    executor = Executors.newSingleThreadExecutor(reviewerThreads());
                } catch (ExecutionException e) {
                    log.error("{} review error: {}", c.displayName(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Review interrupted; keeping {} completed review(s)", results.size());
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private void collect(ReviewCategory c, Future<ReviewerResult> done, List<ReviewerResult> results)
            throws InterruptedException {
        try {
            accept(c, done.get(), results);
        } catch (ExecutionException e) {
            log.error("{} review error: {}", c.displayName(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        }
    }

    private static void accept(ReviewCategory c, ReviewerResult r, List<ReviewerResult> results) {
        if (r != null) {
            results.add(r);
            log.info("{} review completed (score {}/10)", c.displayName(), r.score());
        } else {
            log.warn("{} review failed", c.displayName());
        }
    }

    private static ThreadFactory reviewerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "reviewer-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record ReviewerStatistics(
            int totalReviewers,
            int enabledReviewers,
            List<ReviewCategory> availableCategories,
            List<ReviewCategory> enabledCategories,
            List<ReviewCategory> disabledCategories
    ) {}
}
