package dev.jobaggregator.service;

import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.ratelimit.RateLimiter;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One orchestrator run. States only move forward:
 * IDLE, DISPATCHING, COLLECTING (every source task resolved or timed out), DONE.
 */
public class SearchRun {

    public enum State {
        IDLE, DISPATCHING, COLLECTING, DONE
    }

    @Getter
    private final SearchQuery query;
    @Getter
    private final Instant startedAt = Instant.now();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile RateLimiter.Session limiter;

    SearchRun(SearchQuery query) {
        this.query = query;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Rate-limiter session owned by this run, or {@code null} before dispatch.
     */
    public RateLimiter.Session getLimiter() {
        return limiter;
    }

    void attach(RateLimiter.Session session) {
        this.limiter = session;
    }

    void advance(State next) {
        State current = state.get();
        if (next.ordinal() != current.ordinal() + 1 || !state.compareAndSet(current, next)) {
            throw new IllegalStateException("Illegal run transition " + current + " -> " + next);
        }
    }
}
