package org.javai.jobguard.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.jobguard.Cause;
import org.javai.jobguard.Failure;
import org.javai.jobguard.ops.OpReporter;
import org.javai.jobguard.poll.JobHandle;
import org.javai.jobguard.poll.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.TreeMap;

/**
 * Reports events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event becomes one JSON object with an {@code eventType} ({@code failure},
 * {@code retry_attempt}, {@code job_state}, {@code phase_started}, {@code phase_completed}), a
 * timestamp and a tracking key, optionally prefixed by a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"backup.start backup job for EBS","attemptNumber":1,"maxAttempts":3,"delayMs":5000,"cause":"ThrottlingException: Rate exceeded"}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.jobguard.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final ObjectMapper mapper;
	private final Clock clock;

	/**
	 * Creates a MetricsOpReporter with no namespace and the default logger.
	 */
	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this(namespace, logger, Clock.systemUTC());
	}

	MetricsOpReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.mapper = new ObjectMapper();
		this.clock = clock;
	}

	@Override
	public void report(Failure failure) {
		ObjectNode node = event("failure", failure.occurredAt(), failure.operation());
		node.put("code", failure.code().toString());
		node.put("type", failure.type().name());
		node.put("message", failure.message());
		node.put("attempts", failure.attempts());
		node.put("elapsedMs", failure.elapsed().toMillis());
		if (failure.cause() != null) {
			node.put("cause", failure.cause().toString());
		}
		if (!failure.tags().isEmpty()) {
			ObjectNode tags = node.putObject("tags");
			new TreeMap<>(failure.tags()).forEach(tags::put);
		}
		emit(node);
	}

	@Override
	public void reportRetryAttempt(String operation, int attemptNumber, int maxAttempts, Duration delay, Cause cause) {
		ObjectNode node = event("retry_attempt", clock.instant(), operation);
		node.put("attemptNumber", attemptNumber);
		node.put("maxAttempts", maxAttempts);
		node.put("delayMs", delay.toMillis());
		if (cause != null) {
			node.put("cause", cause.toString());
		}
		emit(node);
	}

	@Override
	public void reportJobState(JobHandle handle, JobStatus status, int pollNumber, Duration elapsed) {
		ObjectNode node = event("job_state", clock.instant(), "poll " + handle);
		node.put("jobId", handle.jobId());
		node.put("resourceType", handle.resourceType());
		node.put("state", status.state().name());
		node.put("terminal", status.state().isTerminal());
		node.put("pollNumber", pollNumber);
		node.put("elapsedMs", elapsed.toMillis());
		status.artifactReference().ifPresent(a -> node.put("artifactReference", a));
		emit(node);
	}

	@Override
	public void reportPhaseStarted(String sequence, int phaseIndex, String phase) {
		ObjectNode node = event("phase_started", clock.instant(), sequence);
		node.put("phaseIndex", phaseIndex);
		node.put("phase", phase);
		emit(node);
	}

	@Override
	public void reportPhaseCompleted(String sequence, int phaseIndex, String phase, Duration elapsed) {
		ObjectNode node = event("phase_completed", clock.instant(), sequence);
		node.put("phaseIndex", phaseIndex);
		node.put("phase", phase);
		node.put("elapsedMs", elapsed.toMillis());
		emit(node);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode event(String eventType, Instant timestamp, String operation) {
		ObjectNode node = mapper.createObjectNode();
		node.put("eventType", eventType);
		node.put("timestamp", ISO_FORMATTER.format(timestamp));
		node.put("trackingKey", buildTrackingKey(operation));
		return node;
	}

	private void emit(ObjectNode node) {
		try {
			logger.info(mapper.writeValueAsString(node));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize {} metrics event: {}", node.path("eventType").asText(), e.getMessage());
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
