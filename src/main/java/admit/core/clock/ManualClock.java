package admit.core.clock;

public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    public void advanceMillis(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceMinutes(long minutes) {
        advanceMillis(minutes * 60_000L);
    }

    public void setMillis(long value) {
        now = value;
    }
}
