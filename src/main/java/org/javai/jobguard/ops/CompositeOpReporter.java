package org.javai.jobguard.ops;

import org.javai.jobguard.Cause;
import org.javai.jobguard.Failure;
import org.javai.jobguard.poll.JobHandle;
import org.javai.jobguard.poll.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every event. If a reporter throws, the exception is logged
 * and the remaining reporters still run; a broken reporter never aborts a retry loop or a poll.
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("backup"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger logger = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 */
	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		forEach("report", r -> r.report(failure));
	}

	@Override
	public void reportRetryAttempt(String operation, int attemptNumber, int maxAttempts, Duration delay, Cause cause) {
		forEach("reportRetryAttempt", r -> r.reportRetryAttempt(operation, attemptNumber, maxAttempts, delay, cause));
	}

	@Override
	public void reportJobState(JobHandle handle, JobStatus status, int pollNumber, Duration elapsed) {
		forEach("reportJobState", r -> r.reportJobState(handle, status, pollNumber, elapsed));
	}

	@Override
	public void reportPhaseStarted(String sequence, int phaseIndex, String phase) {
		forEach("reportPhaseStarted", r -> r.reportPhaseStarted(sequence, phaseIndex, phase));
	}

	@Override
	public void reportPhaseCompleted(String sequence, int phaseIndex, String phase, Duration elapsed) {
		forEach("reportPhaseCompleted", r -> r.reportPhaseCompleted(sequence, phaseIndex, phase, elapsed));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void forEach(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				logger.error("OpReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}. Null reporters are skipped.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends OpReporter> reporters) {
			for (OpReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Adds the reporter only when the condition holds, e.g. a metrics sink enabled by config.
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
