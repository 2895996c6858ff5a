package blobnet.util;

/**
 * Tick-counting timeout. It counts only after {@link #start()} and reports
 * {@link #fired()} once the duration has elapsed.
 */
public class Timeout {

    private final String name;
    private final long durationTicks;
    private long ticks;
    private boolean ticking;

    public Timeout(String name, long durationTicks) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Timeout name cannot be null or blank");
        }
        if (durationTicks <= 0) {
            throw new IllegalArgumentException("Duration ticks must be positive");
        }
        this.name = name;
        this.durationTicks = durationTicks;
    }

    public void start() {
        ticks = 0;
        ticking = true;
    }

    public void stop() {
        ticking = false;
    }

    /**
     * Restarts counting from zero.
     */
    public void reset() {
        ticks = 0;
    }

    public void tick() {
        if (ticking) {
            ticks++;
        }
    }

    public boolean fired() {
        return ticking && ticks >= durationTicks;
    }

    public boolean isTicking() {
        return ticking;
    }

    public String getName() {
        return name;
    }

    public long getDurationTicks() {
        return durationTicks;
    }

    public long getTicks() {
        return ticks;
    }

    @Override
    public String toString() {
        return "Timeout{" + name + ", " + ticks + "/" + durationTicks + (ticking ? "" : ", stopped") + "}";
    }
}
