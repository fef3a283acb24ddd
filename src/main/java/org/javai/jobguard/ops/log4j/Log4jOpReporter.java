package org.javai.jobguard.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.jobguard.Cause;
import org.javai.jobguard.Failure;
import org.javai.jobguard.FailureType;
import org.javai.jobguard.ops.OpReporter;
import org.javai.jobguard.poll.JobHandle;
import org.javai.jobguard.poll.JobStatus;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reports retry, poll and sequence events using Log4j2.
 *
 * <p>Aborts are logged by {@link FailureType}:
 * <ul>
 *   <li>{@code FATAL}, {@code JOB_FAILED} → ERROR</li>
 *   <li>{@code EXHAUSTED}, {@code TIMED_OUT}, {@code CANCELLED} → WARN</li>
 * </ul>
 * Retry attempts and phase transitions are logged at INFO. Job states are logged at DEBUG while the
 * job is still pending or running, and at INFO once terminal.
 *
 * <p>Every entry carries a marker ({@code ABORT}, {@code RETRY}, {@code JOB_STATE}, {@code PHASE}) so
 * appenders can route or filter them.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker ABORT_MARKER = MarkerManager.getMarker("ABORT");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker JOB_STATE_MARKER = MarkerManager.getMarker("JOB_STATE");
	static final Marker PHASE_MARKER = MarkerManager.getMarker("PHASE");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.jobguard.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(ABORT_MARKER)
			.withThrowable(failure.exception())
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(String operation, int attemptNumber, int maxAttempts, Duration delay, Cause cause) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {}/{} of [{}] failed, retrying in {}: {}",
				attemptNumber,
				maxAttempts,
				operation,
				delay,
				cause);
	}

	@Override
	public void reportJobState(JobHandle handle, JobStatus status, int pollNumber, Duration elapsed) {
		Level level = status.state().isTerminal() ? Level.INFO : Level.DEBUG;
		logger.atLevel(level)
			.withMarker(JOB_STATE_MARKER)
			.log("Poll {} of {}: state={} after {}{}{}",
				pollNumber,
				handle,
				status.state(),
				elapsed,
				status.artifactReference().map(a -> ", artifact=" + a).orElse(""),
				status.statusMessage().map(m -> ", message=" + m).orElse(""));
	}

	@Override
	public void reportPhaseStarted(String sequence, int phaseIndex, String phase) {
		logger.atInfo()
			.withMarker(PHASE_MARKER)
			.log("[{}] phase {} ({}) started", sequence, phaseIndex, phase);
	}

	@Override
	public void reportPhaseCompleted(String sequence, int phaseIndex, String phase, Duration elapsed) {
		logger.atInfo()
			.withMarker(PHASE_MARKER)
			.log("[{}] phase {} ({}) completed in {}", sequence, phaseIndex, phase, elapsed);
	}

	private static String formatFailureMessage(Failure failure) {
		return """
			Aborted [%s]: %s \
			| code=%s, type=%s, attempts=%d, elapsed=%s%s%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.code(),
				failure.type(),
				failure.attempts(),
				failure.elapsed(),
				formatTags(failure.tags()),
				formatCause(failure.cause())
			).trim();
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags=" + new TreeMap<>(tags);
	}

	private static String formatCause(Cause cause) {
		return cause != null ? ", cause=" + cause.type() : "";
	}

	static Level levelFor(FailureType type) {
		return switch (type) {
			case FATAL, JOB_FAILED -> Level.ERROR;
			case EXHAUSTED, TIMED_OUT, CANCELLED -> Level.WARN;
		};
	}
}
