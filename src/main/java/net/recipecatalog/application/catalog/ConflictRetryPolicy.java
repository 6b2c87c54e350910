package net.recipecatalog.application.catalog;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntConsumer;
import net.recipecatalog.exception.RetryBudgetExhaustedException;

/**
 * Attempt budget and jittered exponential backoff for optimistic-concurrency loops.
 *
 * <p>The pause after the failed attempt with zero-based index {@code n} is drawn uniformly
 * from {@code [backoffMin, backoffMax] * 2^n}. Jitter keeps racing writers from retrying
 * in lock-step.</p>
 */
public final class ConflictRetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BACKOFF_MIN = Duration.ofMillis(100);
    public static final Duration DEFAULT_BACKOFF_MAX = Duration.ofMillis(500);
    private static final double BACKOFF_MULTIPLIER = 2.0;

    /**
     * Blocking pause between attempts; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * One reload-and-write attempt. An empty result means the conditional write lost its race.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        Optional<T> run(int attemptIndex);
    }

    private static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final Sleeper sleeper;

    public ConflictRetryPolicy(int maxAttempts, Duration backoffMin, Duration backoffMax, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Objects.requireNonNull(backoffMin, "backoffMin");
        Objects.requireNonNull(backoffMax, "backoffMax");
        // the backoff function works in whole milliseconds
        if (backoffMin.toMillis() < 1 || backoffMax.compareTo(backoffMin) < 0) {
            throw new IllegalArgumentException(
                "Backoff range must satisfy 1ms <= min <= max, got [" + backoffMin + ", " + backoffMax + "]");
        }
        this.maxAttempts = maxAttempts;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");

        // [min, max] expressed as a midpoint plus a symmetric randomization factor
        double min = backoffMin.toMillis();
        double max = backoffMax.toMillis();
        long midpoint = Math.round((min + max) / 2.0);
        double randomizationFactor = (max - min) / (max + min);
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(
            Duration.ofMillis(midpoint), BACKOFF_MULTIPLIER, randomizationFactor);
    }

    public ConflictRetryPolicy(int maxAttempts, Duration backoffMin, Duration backoffMax) {
        this(maxAttempts, backoffMin, backoffMax, THREAD_SLEEPER);
    }

    public static ConflictRetryPolicy defaults() {
        return new ConflictRetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_MIN, DEFAULT_BACKOFF_MAX);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Whether another attempt is allowed after the zero-based {@code attemptIndex}.
     */
    public boolean hasAttemptAfter(int attemptIndex) {
        return attemptIndex < maxAttempts - 1;
    }

    /**
     * Randomized pause to apply after the failed zero-based {@code attemptIndex}.
     */
    public Duration backoffAfter(int attemptIndex) {
        return Duration.ofMillis(backoff.apply(attemptIndex + 1));
    }

    /**
     * Blocks for {@link #backoffAfter(int)}.
     *
     * @throws IllegalStateException if the thread is interrupted; the interrupt flag is restored
     */
    public void pauseAfter(int attemptIndex) {
        Duration delay = backoffAfter(attemptIndex);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off after attempt " + (attemptIndex + 1), interrupted);
        }
    }

    /**
     * Runs {@code attempt} until it produces a result or the attempt budget is spent,
     * pausing between attempts. Exceptions thrown by an attempt propagate immediately.
     *
     * @param documentKey document the attempts write, named in the exhaustion error
     * @param onConflict called with the zero-based index of every attempt that lost its race
     * @throws RetryBudgetExhaustedException if every attempt came back empty
     */
    public <T> T execute(String documentKey, Attempt<T> attempt, IntConsumer onConflict) {
        for (int attemptIndex = 0; attemptIndex < maxAttempts; attemptIndex++) {
            Optional<T> result = attempt.run(attemptIndex);
            if (result.isPresent()) {
                return result.get();
            }
            onConflict.accept(attemptIndex);
            if (hasAttemptAfter(attemptIndex)) {
                pauseAfter(attemptIndex);
            }
        }
        throw new RetryBudgetExhaustedException(documentKey, maxAttempts);
    }
}
