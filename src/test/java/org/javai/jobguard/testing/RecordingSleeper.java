package org.javai.jobguard.testing;

import org.javai.jobguard.retry.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records requested waits instead of sleeping. When given a clock, each wait advances it.
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public Duration totalSlept() {
        return sleeps().stream().reduce(Duration.ZERO, Duration::plus);
    }
}
