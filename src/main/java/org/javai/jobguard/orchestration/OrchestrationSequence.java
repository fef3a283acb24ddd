package org.javai.jobguard.orchestration;

import org.javai.jobguard.Failure;
import org.javai.jobguard.Outcome;
import org.javai.jobguard.ops.OpReporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs phases in order, feeding each phase's output to the next.
 *
 * <p>The first failing phase stops the sequence; later phases never run and nothing is rolled
 * back. The returned failure is the failing phase's own failure with its message prefixed by
 * {@code "<sequence> phase <k> (<phase>): "} and tagged with {@code sequence}, {@code phase},
 * {@code phaseIndex} and {@code completedPhases}, so the caller can clean up what was created.
 * Phase numbers are 1-based.
 *
 * <p>A sequence holds no mutable state; independent runs may proceed on separate threads.
 *
 * <pre>{@code
 * OrchestrationSequence<String, String> sequence = OrchestrationSequence.<String>begin("ebs backup")
 *     .then(Phases.retrying("start backup job", executor, retry, arn -> startBackup(arn)))
 *     .then(Phases.awaitArtifact("await backup", poller, poll))
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * Outcome<String> recoveryPoint = sequence.run(volumeArn);
 * }</pre>
 *
 * @param <I> what the first phase consumes
 * @param <O> what the last phase produces
 */
public final class OrchestrationSequence<I, O> {

    private final String name;
    private final List<String> phaseNames;
    private final Chain<I, O> chain;
    private final OpReporter reporter;
    private final Clock clock;

    private OrchestrationSequence(Builder<I, O> builder) {
        this.name = builder.name;
        this.phaseNames = List.copyOf(builder.phaseNames);
        this.chain = builder.chain;
        this.reporter = builder.reporter;
        this.clock = builder.clock;
    }

    /**
     * Starts a sequence whose first phase consumes {@code I}.
     */
    public static <I> Builder<I, I> begin(String name) {
        Chain<I, I> start = (input, run) -> Outcome.ok(input);
        return new Builder<>(name, List.of(), start, OpReporter.noOp(), Clock.systemUTC());
    }

    public String name() {
        return name;
    }

    public List<String> phaseNames() {
        return phaseNames;
    }

    /**
     * Runs every phase in order.
     *
     * @return Ok with the last phase's output, or Fail from the first failing phase
     */
    public Outcome<O> run(I input) {
        return chain.run(input, new Run(name, reporter, clock));
    }

    @Override
    public String toString() {
        return "OrchestrationSequence[" + name + ", phases=" + phaseNames + "]";
    }

    /**
     * The phases added so far, composed into one typed step.
     */
    @FunctionalInterface
    private interface Chain<I, C> {
        Outcome<C> run(I input, Run run);
    }

    /**
     * Bookkeeping for one run: phase numbering, completed phases, reporting and timing.
     */
    private static final class Run {
        private final String sequence;
        private final OpReporter reporter;
        private final Clock clock;
        private final List<String> completed = new ArrayList<>();

        private Run(String sequence, OpReporter reporter, Clock clock) {
            this.sequence = sequence;
            this.reporter = reporter;
            this.clock = clock;
        }

        <A, B> Outcome<B> execute(Phase<? super A, B> phase, A input) {
            int phaseNumber = completed.size() + 1;
            reporter.reportPhaseStarted(sequence, phaseNumber, phase.name());
            Instant started = clock.instant();
            Outcome<B> outcome = Objects.requireNonNull(phase.run(input),
                    () -> "phase " + phase.name() + " returned null");

            if (outcome instanceof Outcome.Fail<B> fail) {
                return Outcome.fail(phaseFailure(phaseNumber, phase.name(), fail.failure()));
            }

            reporter.reportPhaseCompleted(sequence, phaseNumber, phase.name(),
                    Duration.between(started, clock.instant()));
            completed.add(phase.name());
            return outcome;
        }

        private Failure phaseFailure(int phaseNumber, String phase, Failure failure) {
            Map<String, String> tags = new HashMap<>();
            tags.put("sequence", sequence);
            tags.put("phase", phase);
            tags.put("phaseIndex", String.valueOf(phaseNumber));
            tags.put("completedPhases", String.join(",", completed));
            return failure.withContext(
                    sequence + " phase " + phaseNumber + " (" + phase + "): " + failure.message(), tags);
        }
    }

    /**
     * Typed builder: each {@link #then(Phase)} fixes the type the next phase must consume.
     *
     * @param <I> what the sequence consumes
     * @param <C> what the phases added so far produce
     */
    public static final class Builder<I, C> {
        private final String name;
        private final List<String> phaseNames;
        private final Chain<I, C> chain;
        private OpReporter reporter;
        private Clock clock;

        private Builder(String name, List<String> phaseNames, Chain<I, C> chain, OpReporter reporter, Clock clock) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.phaseNames = phaseNames;
            this.chain = chain;
            this.reporter = reporter;
            this.clock = clock;
        }

        /**
         * Appends a phase consuming the previous phase's output.
         */
        public <N> Builder<I, N> then(Phase<? super C, N> phase) {
            Objects.requireNonNull(phase, "phase must not be null");
            List<String> names = new ArrayList<>(phaseNames);
            names.add(phase.name());
            Chain<I, C> previous = chain;
            Chain<I, N> next = (input, run) -> previous.run(input, run).flatMap(value -> run.execute(phase, value));
            return new Builder<>(name, names, next, reporter, clock);
        }

        public Builder<I, C> reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the clock used to time phases (package-private, for tests).
         */
        Builder<I, C> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public OrchestrationSequence<I, C> build() {
            if (phaseNames.isEmpty()) {
                throw new IllegalStateException("sequence " + name + " has no phases");
            }
            return new OrchestrationSequence<>(this);
        }
    }
}
