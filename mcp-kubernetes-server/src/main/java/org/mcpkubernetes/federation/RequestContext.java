package org.mcpkubernetes.federation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Deadline and cancellation signal for one tool invocation. Checked before every cluster call.
 */
public final class RequestContext {

    private final Clock clock;
    private final Instant deadline;
    private final BooleanSupplier cancellationSignal;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private RequestContext(Clock clock, Instant deadline, BooleanSupplier cancellationSignal) {
        this.clock = clock;
        this.deadline = deadline;
        this.cancellationSignal = cancellationSignal;
    }

    public static RequestContext withTimeout(Duration timeout) {
        return withTimeout(Clock.systemUTC(), timeout);
    }

    public static RequestContext withTimeout(Clock clock, Duration timeout) {
        return withTimeout(clock, timeout, () -> false);
    }

    /**
     * @param cancellationSignal polled on every check; once it reports {@code true} the request stays cancelled
     */
    public static RequestContext withTimeout(Clock clock, Duration timeout, BooleanSupplier cancellationSignal) {
        return new RequestContext(clock, clock.instant().plus(timeout), cancellationSignal);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (!cancelled.get() && cancellationSignal.getAsBoolean()) {
            cancelled.set(true);
        }
        return cancelled.get();
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isActive() {
        return !isCancelled() && !remaining().isZero();
    }

    public void checkActive() {
        if (isCancelled()) {
            throw new RequestAbortedException("request cancelled");
        }
        if (remaining().isZero()) {
            throw new RequestAbortedException("request deadline exceeded");
        }
    }
}
