package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.model.NutritionSource;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for a single provider.
 * <p>
 * Attempt {@code n} that fails is followed by a pause of {@code baseDelay * 2^(n-1)}, except after
 * the last attempt. {@link NoResultsException} ends the loop immediately.
 */
public class FetchRetryPolicy {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;

        static Sleeper threadSleep() {
            return d -> Thread.sleep(d.toMillis());
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T call(int attempt);
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;
    private final ProviderTelemetry telemetry;

    public FetchRetryPolicy(int maxAttempts, Duration baseDelay, Sleeper sleeper, ProviderTelemetry telemetry) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        this.sleeper = sleeper;
        this.telemetry = telemetry;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration delayFor(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(30, Math.max(0, attempt - 1)));
    }

    public <T> T execute(NutritionSource source, String term, Attempt<T> call) {
        ProviderException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long t0 = System.nanoTime();
            try {
                T out = call.call(attempt);
                telemetry.ok(source.name(), term, attempt, elapsedMs(t0));
                return out;
            } catch (NoResultsException e) {
                telemetry.noResults(source.name(), term, attempt, elapsedMs(t0));
                throw e;
            } catch (RuntimeException e) {
                last = ProviderErrorMapper.toProviderException(source, e);
                telemetry.fail(source.name(), term, attempt, elapsedMs(t0), last.getCode());
            }

            if (attempt < maxAttempts) {
                pause(source, attempt, last);
            }
        }
        throw last;
    }

    private void pause(NutritionSource source, int attempt, ProviderException last) {
        Duration d = delayFor(attempt);
        if (d.isZero()) return;
        try {
            sleeper.sleep(d);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ProviderException pe = new ProviderException(source, "PROVIDER_INTERRUPTED",
                    "interrupted while backing off", ie);
            pe.addSuppressed(last);
            throw pe;
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
