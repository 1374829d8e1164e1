package com.redhat.ci.steps.build;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

import com.redhat.ci.steps.StepContext;

/**
 * Evaluates a condition until it holds, sleeping between attempts for a delay that grows by a constant
 * factor. The condition is evaluated at most {@code steps} times.
 */
public record ExponentialBackoff(Duration initialDelay, double factor, int steps) {

    public static final ExponentialBackoff DEFAULT = new ExponentialBackoff(Duration.ofMillis(10), 2.0, 10);

    static final String TIMED_OUT = "timed out waiting for the condition";

    public ExponentialBackoff {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1, got " + steps);
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be at least 1, got " + factor);
        }
    }

    /**
     * Runs the condition until it returns {@code true}. Exceptions thrown by the condition end the wait
     * immediately.
     *
     * @throws TimeoutException if the condition never held
     */
    public void waitFor(StepContext context, BooleanSupplier condition) throws TimeoutException {
        Duration delay = initialDelay;
        for (int i = 0; i < steps; ++i) {
            if (i > 0) {
                context.sleep(delay);
                delay = Duration.ofNanos((long) (delay.toNanos() * factor));
            }
            context.checkCancelled();
            if (condition.getAsBoolean()) {
                return;
            }
        }
        throw new TimeoutException(TIMED_OUT);
    }

    /**
     * The longest the wait can take when the condition never holds.
     */
    public Duration totalDelay() {
        Duration total = Duration.ZERO;
        Duration delay = initialDelay;
        for (int i = 1; i < steps; ++i) {
            total = total.plus(delay);
            delay = Duration.ofNanos((long) (delay.toNanos() * factor));
        }
        return total;
    }
}
