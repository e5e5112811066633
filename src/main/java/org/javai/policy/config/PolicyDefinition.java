package org.javai.policy.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.policy.ActionPolicy;
import org.javai.policy.AsyncActionPolicy;
import org.javai.policy.ExceptionClassifier;
import org.javai.policy.ops.PolicyReporter;
import org.javai.policy.retry.Backoff;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * A policy declared as data, typically loaded from a JSON configuration file.
 *
 * <pre>{@code
 * {"type": "WAIT_AND_RETRY", "delays": ["PT0.1S", "PT0.5S"]}
 * {"type": "EXPONENTIAL_BACKOFF", "initialDelay": "PT0.1S", "maxDelay": "PT5S", "retryCount": 4}
 * {"type": "CIRCUIT_BREAKER", "duration": "PT30S", "countBeforeBreaking": 5}
 * }</pre>
 *
 * <p>Durations are ISO-8601 strings. A definition is only checked when it is turned into a
 * policy, where the usual builder validation applies.</p>
 *
 * @param type which policy shape to build
 * @param retryCount for {@code RETRY} and {@code EXPONENTIAL_BACKOFF}
 * @param delays for {@code WAIT_AND_RETRY}
 * @param initialDelay for {@code EXPONENTIAL_BACKOFF}
 * @param maxDelay for {@code EXPONENTIAL_BACKOFF}
 * @param duration for {@code CIRCUIT_BREAKER}
 * @param countBeforeBreaking for {@code CIRCUIT_BREAKER}
 */
public record PolicyDefinition(
        Type type,
        Integer retryCount,
        List<String> delays,
        String initialDelay,
        String maxDelay,
        String duration,
        Integer countBeforeBreaking
) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    /**
     * The policy shapes a definition can describe.
     */
    public enum Type {
        NONE,
        RETRY,
        RETRY_FOREVER,
        WAIT_AND_RETRY,
        EXPONENTIAL_BACKOFF,
        CIRCUIT_BREAKER
    }

    public PolicyDefinition {
        Objects.requireNonNull(type, "type must not be null");
        delays = delays == null ? null : List.copyOf(delays);
    }

    /**
     * Parses a single definition.
     *
     * @throws IllegalArgumentException if the JSON is malformed, has unknown properties or lacks a type
     */
    public static PolicyDefinition fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return MAPPER.readValue(json, PolicyDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid policy definition: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Builds the synchronous policy this definition describes. For {@code CIRCUIT_BREAKER} the
     * result is a {@link org.javai.policy.CircuitBreakerPolicy}.
     *
     * @param classifier which failures the policy handles
     * @param reporter receives retries, waits and breaks
     */
    public ActionPolicy toPolicy(ExceptionClassifier classifier, PolicyReporter reporter) {
        Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(reporter, "reporter must not be null");
        return switch (type) {
            case NONE -> ActionPolicy.none();
            case RETRY -> ActionPolicy.with(classifier).retry(require(retryCount, "retryCount"), reporter.onRetry());
            case RETRY_FOREVER -> ActionPolicy.with(classifier).retryForever(reporter.onRetryForever());
            case WAIT_AND_RETRY, EXPONENTIAL_BACKOFF -> ActionPolicy.with(classifier).waitAndRetry(waits(), reporter.onWait());
            case CIRCUIT_BREAKER -> ActionPolicy.with(classifier).circuitBreaker(
                    parse(require(duration, "duration"), "duration"),
                    require(countBeforeBreaking, "countBeforeBreaking"),
                    reporter.onBreak());
        };
    }

    /**
     * Builds the asynchronous policy this definition describes. Waits do not block a thread.
     */
    public AsyncActionPolicy toAsyncPolicy(ExceptionClassifier classifier, PolicyReporter reporter) {
        Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(reporter, "reporter must not be null");
        return switch (type) {
            case NONE -> AsyncActionPolicy.none();
            case RETRY -> AsyncActionPolicy.with(classifier).retry(require(retryCount, "retryCount"), reporter.onRetry());
            case RETRY_FOREVER -> AsyncActionPolicy.with(classifier).retryForever(reporter.onRetryForever());
            case WAIT_AND_RETRY, EXPONENTIAL_BACKOFF -> AsyncActionPolicy.with(classifier).waitAndRetry(waits(), reporter.onWait());
            case CIRCUIT_BREAKER -> AsyncActionPolicy.with(classifier).circuitBreaker(
                    parse(require(duration, "duration"), "duration"),
                    require(countBeforeBreaking, "countBeforeBreaking"),
                    reporter.onBreak());
        };
    }

    private Iterable<Duration> waits() {
        if (type == Type.EXPONENTIAL_BACKOFF) {
            return Backoff.exponential(
                    parse(require(initialDelay, "initialDelay"), "initialDelay"),
                    parse(require(maxDelay, "maxDelay"), "maxDelay"),
                    require(retryCount, "retryCount"));
        }
        List<String> configured = require(delays, "delays");
        Duration[] parsed = new Duration[configured.size()];
        for (int i = 0; i < parsed.length; i++) {
            parsed[i] = parse(configured.get(i), "delays[" + i + "]");
        }
        return Backoff.of(parsed);
    }

    private <V> V require(V value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required for " + type);
        }
        return value;
    }

    private static Duration parse(String value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " is not an ISO-8601 duration, was: " + value, e);
        }
    }
}
