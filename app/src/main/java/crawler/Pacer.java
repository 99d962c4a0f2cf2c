package crawler;

import java.util.Objects;
import java.util.Random;

// Sleeps a random duration from the pacing level's range.
public class Pacer {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final PacingLevel level;
    private final Random random;
    private final Sleeper sleeper;

    public Pacer(PacingLevel level) {
        this(level, new Random(), Thread::sleep);
    }

    public Pacer(PacingLevel level, Random random, Sleeper sleeper) {
        this.level = Objects.requireNonNull(level, "level");
        this.random = Objects.requireNonNull(random, "random");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public PacingLevel level() {
        return level;
    }

    public long nextDelayMillis() {
        long span = level.maxMillis() - level.minMillis();
        if (span <= 0) return level.minMillis();
        return level.minMillis() + (long) (random.nextDouble() * (span + 1));
    }

    // Blocks for the next delay; OFF returns immediately.
    public void pause() throws InterruptedException {
        long delay = nextDelayMillis();
        if (delay > 0) sleeper.sleep(delay);
    }
}
