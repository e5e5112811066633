package org.javai.policy.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.javai.policy.ActionPolicy;
import org.javai.policy.CircuitBreakerPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class Log4jPolicyReporterTest {

	private static final String LOGGER_NAME = "org.javai.policy.test.PolicyReporter";

	private CapturingAppender appender;
	private Log4jPolicyReporter reporter;

	@BeforeEach
	void setUp() {
		appender = new CapturingAppender();
		appender.start();

		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration config = context.getConfiguration();
		config.addAppender(appender);
		LoggerConfig loggerConfig = new LoggerConfig(LOGGER_NAME, Level.ALL, false);
		loggerConfig.addAppender(appender, Level.ALL, null);
		config.addLogger(LOGGER_NAME, loggerConfig);
		context.updateLoggers();

		reporter = new Log4jPolicyReporter(LOGGER_NAME);
	}

	@AfterEach
	void tearDown() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		context.getConfiguration().removeLogger(LOGGER_NAME);
		context.updateLoggers();
		appender.stop();
	}

	@Test
	void reportRetry_logsOneBasedAttemptAtInfo() {
		reporter.reportRetry(new IOException("connection reset"), 0);

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.INFO);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY");
		assertThat(event.getMessage().getFormattedMessage())
				.isEqualTo("Retry 1 after java.io.IOException: connection reset");
	}

	@Test
	void reportRetry_uncounted_omitsAttempt() {
		reporter.onRetryForever().accept(new IOException("again"));

		assertThat(appender.events.get(0).getMessage().getFormattedMessage())
				.isEqualTo("Retrying after java.io.IOException: again");
	}

	@Test
	void reportWait_includesDelay() {
		reporter.reportWait(new IOException("slow"), Duration.ofMillis(250));

		LogEvent event = appender.events.get(0);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY_WAIT");
		assertThat(event.getMessage().getFormattedMessage()).startsWith("Retrying in 250 ms");
	}

	@Test
	void reportBreak_logsWarnWithFailure() {
		IOException failure = new IOException("down");
		CircuitBreakerPolicy breaker = ActionPolicy.handle(IOException.class)
				.circuitBreaker(Duration.ofSeconds(30), 1, reporter.onBreak());

		assertThatThrownBy(() -> breaker.run(() -> {
			throw failure;
		})).isSameAs(failure);

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker().getName()).isEqualTo("CIRCUIT_BREAK");
		assertThat(event.getThrown()).isInstanceOf(IOException.class).hasMessage("down");
		assertThat(event.getMessage().getFormattedMessage()).contains("30000 ms");
	}

	private static final class CapturingAppender extends AbstractAppender {
		final List<LogEvent> events = new CopyOnWriteArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
