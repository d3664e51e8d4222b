package dev.jobaggregator.ratelimit;

import dev.jobaggregator.error.NetworkException;
import dev.jobaggregator.error.RateBudgetExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Per-source request pacing and session budget.
 * <p>
 * Counters live in a {@link Session}; every search run opens its own, so concurrent runs never
 * share a request budget. Within a session each source has its own lock, held only while that
 * source waits, so callers for different sources never block each other while callers for the
 * same source are serialized. The first request of a session goes out immediately; later ones
 * wait until a randomly drawn delay has elapsed since the previous request. Requests past the
 * session cap fail fast with {@link RateBudgetExhaustedException}.
 */
@Slf4j
@Component
public class RateLimiter {

    /**
     * Blocking wait, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;
    private final Random random;
    private final LongSupplier nanoClock;

    public RateLimiter() {
        this(RateLimiter::sleepAtLeast, new Random(), System::nanoTime);
    }

    public RateLimiter(Sleeper sleeper, Random random) {
        this(sleeper, random, System::nanoTime);
    }

    RateLimiter(Sleeper sleeper, Random random, LongSupplier nanoClock) {
        this.sleeper = sleeper;
        this.random = random;
        this.nanoClock = nanoClock;
    }

    public Session openSession() {
        return new Session();
    }

    public Session openSession(Map<String, RatePolicy> policies) {
        Session session = new Session();
        policies.forEach(session::configure);
        return session;
    }

    /**
     * Request counters for one run.
     */
    public final class Session {

        private final Map<String, SourceState> states = new ConcurrentHashMap<>();

        private Session() {
        }

        /**
         * Register or replace the policy for a source. Replacing restarts its counters.
         */
        public void configure(String sourceId, RatePolicy policy) {
            states.put(sourceId, new SourceState(policy));
        }

        public boolean isConfigured(String sourceId) {
            return states.containsKey(sourceId);
        }

        /**
         * Wait until the next request to {@code sourceId} is permitted and count it.
         *
         * @throws IllegalArgumentException     if the source was never configured
         * @throws RateBudgetExhaustedException if the session cap is already reached
         */
        public void acquire(String sourceId) {
            SourceState state = states.get(sourceId);
            if (state == null) {
                throw new IllegalArgumentException("Unknown source: " + sourceId);
            }
            synchronized (state) {
                RatePolicy policy = state.policy;
                if (state.requests >= policy.maxRequests()) {
                    throw new RateBudgetExhaustedException(sourceId, policy.maxRequests());
                }
                if (state.lastRequestNanos != null) {
                    long required = drawDelay(policy).toNanos();
                    long elapsed = nanoClock.getAsLong() - state.lastRequestNanos;
                    long remaining = required - elapsed;
                    if (remaining > 0) {
                        log.debug("{} waiting {} ms before next request", sourceId, remaining / 1_000_000);
                        pause(sourceId, Duration.ofNanos(remaining));
                    }
                }
                state.requests++;
                state.lastRequestNanos = nanoClock.getAsLong();
            }
        }

        /**
         * Requests made to {@code sourceId} in this session.
         */
        public int requestCount(String sourceId) {
            SourceState state = states.get(sourceId);
            if (state == null) {
                return 0;
            }
            synchronized (state) {
                return state.requests;
            }
        }

        /**
         * Clear every source's counters. Policies stay registered.
         */
        public void reset() {
            states.values().forEach(state -> {
                synchronized (state) {
                    state.requests = 0;
                    state.lastRequestNanos = null;
                }
            });
        }
    }

    private Duration drawDelay(RatePolicy policy) {
        long min = policy.minDelay().toMillis();
        long max = policy.maxDelay().toMillis();
        if (max <= min) {
            return policy.minDelay();
        }
        synchronized (random) {
            return Duration.ofMillis(min + (long) (random.nextDouble() * (max - min)));
        }
    }

    // Thread.sleep(millis, nanos) rounds sub-millisecond parts down, so round up instead.
    static void sleepAtLeast(Duration duration) throws InterruptedException {
        long millis = duration.toMillis();
        if (duration.toNanosPart() % 1_000_000 != 0) {
            millis++;
        }
        Thread.sleep(millis);
    }

    private void pause(String sourceId, Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(sourceId, "Interrupted while waiting for rate limit", e);
        }
    }

    private static final class SourceState {
        private final RatePolicy policy;
        private int requests;
        private Long lastRequestNanos;

        private SourceState(RatePolicy policy) {
            this.policy = policy;
        }
    }
}
