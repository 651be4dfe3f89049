package admit.java.engine;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import admit.core.model.ReasonCode;
import admit.core.model.ValidationException;
import admit.core.ratelimit.FixedWindow;
import admit.core.ratelimit.RateLimitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe fixed-window rate limiter with multi-key support.
 *
 * Architecture:
 * - FixedWindow holds the pure counting rule
 * - RateLimitStore applies it atomically per key (no global lock)
 * - a sweep task, started and stopped explicitly, evicts records whose window ended
 * - Clock injection enables deterministic testing
 *
 * Memory management:
 * - records live at most one window plus one sweep interval after their last admit
 * - the sweep runs on its own daemon thread and never runs inside check()
 *
 * Failure handling:
 * - check() never throws for store failures; the configured FailurePolicy decides,
 *   and the result is flagged degraded
 *
 * Usage example:
 * <pre>
 * RateLimiterConfig config = RateLimiterConfig.fixedWindow(10, 60_000);
 * try (RateLimiterEngine engine = RateLimiterFactory.create("auth", SystemClock.instance(), config)) {
 *     engine.start();
 *     RateLimitResult result = engine.check("1.2.3.4");
 *     if (!result.admitted()) {
 *         // answer 429, retry after result.retryAfterMillis()
 *     }
 * }
 * </pre>
 */
public final class RateLimiterEngine implements RateLimiter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEngine.class);

    private final String name;
    private final Clock clock;
    private final RateLimiterConfig config;
    private final FixedWindow window;
    private final RateLimitStore store;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService sweeper;

    /**
     * Creates a new rate limiter engine. The sweep task is not started.
     *
     * @param name Policy name, used in logs and thread names
     * @param clock Clock instance for time control (injected for testability)
     * @param config Limit, window, sweep interval and failure policy
     * @param store Backing table for per-key records
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RateLimiterEngine(String name, Clock clock, RateLimiterConfig config, RateLimitStore store) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }

        this.name = name;
        this.clock = clock;
        this.config = config;
        this.window = new FixedWindow(config.windowMillis(), config.limit());
        this.store = store;
    }

    /**
     * Admits or rejects one request for a key.
     *
     * The read of the current record, the window reset and the increment happen in a
     * single store.compute() call, so two callers racing on the same key (also across
     * a window boundary) can neither both reset to 1 nor lose an increment.
     *
     * @param key Client identity (e.g. originating IP)
     * @return ADMIT with remaining permits, or REJECT with retry-after
     * @throws ValidationException if key is null or blank
     */
    @Override
    public RateLimitResult check(String key) {
        if (key == null || key.isBlank()) {
            throw new ValidationException(ReasonCode.KEY_REQUIRED, "key must not be empty");
        }

        AtomicReference<RateLimitResult> decided = new AtomicReference<>();
        try {
            store.compute(key, current -> {
                FixedWindow.Transition transition = window.apply(current, clock.nowMillis());
                decided.set(transition.result());
                return transition.next();
            });
        } catch (RuntimeException e) {
            log.warn("Rate-limit store failed for policy '{}', applying {}", name, config.failurePolicy(), e);
            return RateLimitResult.degraded(config.failurePolicy().decision());
        }
        return decided.get();
    }

    /**
     * Removes records whose window has ended. Runs on the sweep thread when started,
     * and may be called directly (tests, admin tooling).
     *
     * @return number of records removed
     */
    public int sweep() {
        try {
            int removed = store.sweepExpired(clock.nowMillis());
            if (removed > 0) {
                log.debug("Swept {} expired rate-limit records for policy '{}' ({} remain)",
                    removed, name, store.size());
            }
            return removed;
        } catch (RuntimeException e) {
            // a thrown exception would cancel the periodic task
            log.warn("Rate-limit sweep failed for policy '{}'", name, e);
            return 0;
        }
    }

    /**
     * Starts the periodic sweep. Idempotent.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (sweeper != null) {
                return;
            }
            sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "rate-limit-sweep-" + name);
                thread.setDaemon(true);
                return thread;
            });
            long interval = config.sweepIntervalMillis();
            sweeper.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
            log.debug("Started rate-limit sweep for policy '{}' every {} ms", name, interval);
        }
    }

    /**
     * Stops the periodic sweep. Idempotent; records are kept.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (sweeper == null) {
                return;
            }
            sweeper.shutdownNow();
            sweeper = null;
            log.debug("Stopped rate-limit sweep for policy '{}'", name);
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return sweeper != null;
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Returns the number of currently tracked keys.
     *
     * @return Number of keys in the store
     */
    public int size() {
        return store.size();
    }

    /**
     * Clears all records from the engine.
     * This is primarily useful for testing.
     */
    public void clear() {
        store.clear();
    }

    public String name() {
        return name;
    }

    public RateLimiterConfig config() {
        return config;
    }
}
