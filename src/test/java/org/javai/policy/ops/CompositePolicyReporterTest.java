package org.javai.policy.ops;

import org.javai.policy.ActionPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositePolicyReporterTest {

	/** Records every call as a readable line. */
	private static class RecordingReporter implements PolicyReporter {
		final List<String> calls = new ArrayList<>();

		@Override
		public void reportRetry(Throwable failure, int attempt) {
			calls.add("retry " + attempt + " " + failure.getMessage());
		}

		@Override
		public void reportWait(Throwable failure, Duration delay) {
			calls.add("wait " + delay.toMillis() + " " + failure.getMessage());
		}

		@Override
		public void reportBreak(Throwable failure, Duration openFor) {
			calls.add("break " + openFor.toSeconds() + " " + failure.getMessage());
		}
	}

	@Test
	void composite_fansOutToAllReporters() {
		RecordingReporter first = new RecordingReporter();
		RecordingReporter second = new RecordingReporter();
		PolicyReporter composite = PolicyReporter.composite(first, second);

		composite.reportRetry(new IOException("a"), 0);
		composite.reportWait(new IOException("b"), Duration.ofMillis(250));
		composite.reportBreak(new IOException("c"), Duration.ofSeconds(30));

		assertThat(first.calls).containsExactly("retry 0 a", "wait 250 b", "break 30 c");
		assertThat(second.calls).isEqualTo(first.calls);
	}

	@Test
	void composite_failingReporterDoesNotStopOthers() {
		RecordingReporter healthy = new RecordingReporter();
		PolicyReporter broken = (failure, attempt) -> {
			throw new IllegalStateException("reporter down");
		};
		PolicyReporter composite = PolicyReporter.composite(broken, healthy);

		assertThatCode(() -> composite.reportRetry(new IOException("x"), 1)).doesNotThrowAnyException();
		assertThat(healthy.calls).containsExactly("retry 1 x");
	}

	@Test
	void composite_failingReporterDoesNotChangePolicyOutcome() {
		RecordingReporter healthy = new RecordingReporter();
		PolicyReporter composite = CompositePolicyReporter.builder()
				.add((failure, attempt) -> {
					throw new IllegalStateException("reporter down");
				})
				.add(healthy)
				.build();
		ActionPolicy policy = ActionPolicy.handle(IOException.class).retry(2, composite.onRetry());

		assertThatThrownBy(() -> policy.run(() -> {
			throw new IOException("down");
		})).isInstanceOf(IOException.class);

		assertThat(healthy.calls).containsExactly("retry 0 down", "retry 1 down");
	}

	@Test
	void builder_skipsNullAndDisabledReporters() {
		CompositePolicyReporter composite = CompositePolicyReporter.builder()
				.add(null)
				.addIf(false, new RecordingReporter())
				.addIf(true, new RecordingReporter())
				.addAll(List.of(new RecordingReporter(), PolicyReporter.noOp()))
				.build();

		assertThat(composite.size()).isEqualTo(3);
	}

	@Test
	void adapters_routeCallbacksToReporter() {
		RecordingReporter reporter = new RecordingReporter();
		IOException failure = new IOException("f");

		reporter.onRetry().accept(failure, 2);
		reporter.onRetryForever().accept(failure);
		reporter.onWait().accept(failure, Duration.ofMillis(5));
		reporter.onBreak().accept(failure, Duration.ofSeconds(1));

		assertThat(reporter.calls).containsExactly("retry 2 f", "retry -1 f", "wait 5 f", "break 1 f");
	}

	@Test
	void noOp_acceptsEverything() {
		PolicyReporter noOp = PolicyReporter.noOp();

		assertThatCode(() -> {
			noOp.reportRetry(new IOException(), 0);
			noOp.reportWait(new IOException(), Duration.ZERO);
			noOp.reportBreak(new IOException(), Duration.ofSeconds(1));
		}).doesNotThrowAnyException();
	}
}
