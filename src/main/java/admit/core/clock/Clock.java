package admit.core.clock;

/**
 * Time source for every admission decision.
 * Wall-clock milliseconds, so window ends and registration timestamps are comparable.
 */
public interface Clock {
    long nowMillis();
}
