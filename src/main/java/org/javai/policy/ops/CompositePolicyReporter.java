package org.javai.policy.ops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link PolicyReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is logged
 * and the remaining reporters still run, so a broken reporter never changes the outcome of a
 * policy call.</p>
 *
 * <pre>{@code
 * PolicyReporter reporter = CompositePolicyReporter.builder()
 *     .add(new Log4jPolicyReporter())
 *     .addIf(auditEnabled, auditReporter)
 *     .build();
 * }</pre>
 */
public final class CompositePolicyReporter implements PolicyReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositePolicyReporter.class);

	private final List<PolicyReporter> reporters;

	private CompositePolicyReporter(List<PolicyReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositePolicyReporter of(PolicyReporter... reporters) {
		return new CompositePolicyReporter(Arrays.asList(reporters));
	}

	public static CompositePolicyReporter of(Collection<? extends PolicyReporter> reporters) {
		return new CompositePolicyReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetry(Throwable failure, int attempt) {
		fanOut("reportRetry", reporter -> reporter.reportRetry(failure, attempt));
	}

	@Override
	public void reportWait(Throwable failure, Duration delay) {
		fanOut("reportWait", reporter -> reporter.reportWait(failure, delay));
	}

	@Override
	public void reportBreak(Throwable failure, Duration openFor) {
		fanOut("reportBreak", reporter -> reporter.reportBreak(failure, openFor));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<PolicyReporter> call) {
		for (PolicyReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				LOG.warn("PolicyReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositePolicyReporter}.
	 */
	public static final class Builder {
		private final List<PolicyReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter; null is ignored.
		 */
		public Builder add(PolicyReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends PolicyReporter> reporters) {
			for (PolicyReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Adds {@code reporter} only when {@code condition} holds.
		 */
		public Builder addIf(boolean condition, PolicyReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositePolicyReporter build() {
			return new CompositePolicyReporter(reporters);
		}
	}
}
