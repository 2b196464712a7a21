package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.model.NutritionSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchRetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final FetchRetryPolicy policy =
            new FetchRetryPolicy(3, Duration.ofSeconds(1), sleeps::add, new ProviderTelemetry());

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void backoff_doubles_per_attempt() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void gives_up_after_max_attempts_without_sleeping_after_the_last() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(NutritionSource.OPENFOODFACTS, "kiwi", attempt -> {
            calls.incrementAndGet();
            throw new ProviderException(NutritionSource.OPENFOODFACTS, "PROVIDER_UPSTREAM_5XX", 503,
                    "HTTP 503", null, null);
        }))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getCode())
                .isEqualTo("PROVIDER_UPSTREAM_5XX");

        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void success_on_second_attempt_sleeps_once() {
        String out = policy.execute(NutritionSource.USDA, "kiwi", attempt -> {
            if (attempt == 1) throw new ProviderException(NutritionSource.USDA, ProviderException.TIMEOUT, "slow", null);
            return "ok@" + attempt;
        });

        assertThat(out).isEqualTo("ok@2");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void no_results_is_not_retried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(NutritionSource.USDA, "zzz", attempt -> {
            calls.incrementAndGet();
            throw new NoResultsException(NutritionSource.USDA, "zzz");
        })).isInstanceOf(NoResultsException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void unexpected_runtime_errors_are_wrapped_with_a_code() {
        FetchRetryPolicy once = new FetchRetryPolicy(1, Duration.ZERO, sleeps::add, new ProviderTelemetry());

        assertThatThrownBy(() -> once.execute(NutritionSource.OPENFOODFACTS, "kiwi", attempt -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(ProviderException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting(e -> ((ProviderException) e).getCode())
                .isEqualTo("PROVIDER_FAILED");
    }

    @Test
    void interrupted_backoff_stops_retrying() {
        FetchRetryPolicy interrupting = new FetchRetryPolicy(3, Duration.ofSeconds(1),
                d -> { throw new InterruptedException(); }, new ProviderTelemetry());
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> interrupting.execute(NutritionSource.OPENFOODFACTS, "kiwi", attempt -> {
            calls.incrementAndGet();
            throw new ProviderException(NutritionSource.OPENFOODFACTS, "PROVIDER_NETWORK_ERROR", "down", null);
        }))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getCode())
                .isEqualTo("PROVIDER_INTERRUPTED");

        assertThat(calls.get()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void zero_base_delay_never_sleeps() {
        FetchRetryPolicy fast = new FetchRetryPolicy(3, Duration.ZERO, sleeps::add, new ProviderTelemetry());

        assertThatThrownBy(() -> fast.execute(NutritionSource.USDA, "kiwi", attempt -> {
            throw new ProviderException(NutritionSource.USDA, "PROVIDER_NETWORK_ERROR", "down", null);
        })).isInstanceOf(ProviderException.class);

        assertThat(sleeps).isEmpty();
    }
}
