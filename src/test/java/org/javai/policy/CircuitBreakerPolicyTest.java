package org.javai.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerPolicyTest {

    private static final Duration OPEN_FOR = Duration.ofSeconds(30);

    record Break(Throwable failure, Duration openFor) {}

    private MutableClock clock;
    private List<Break> breaks;
    private CircuitBreakerPolicy breaker;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        breaks = new ArrayList<>();
        calls = new AtomicInteger();
        breaker = ActionPolicy.handle(IOException.class)
                .clock(clock)
                .circuitBreaker(OPEN_FOR, 2, (failure, openFor) -> breaks.add(new Break(failure, openFor)));
    }

    private void recordFailure(String message) {
        assertThatThrownBy(() -> breaker.run(() -> {
            calls.incrementAndGet();
            throw new IOException(message);
        })).isInstanceOf(IOException.class);
    }

    private String succeed() throws IOException {
        return breaker.get(() -> {
            calls.incrementAndGet();
            return "ok";
        });
    }

    @Test
    void belowThreshold_failuresPropagateAndCircuitStaysClosed() {
        recordFailure("first");

        assertThat(breaker.isBroken()).isFalse();
        assertThat(breaker.consecutiveFailures()).isEqualTo(1);
        assertThat(breaks).isEmpty();
    }

    @Test
    void thresholdReached_opensCircuitAndReportsBreak() {
        recordFailure("first");
        recordFailure("second");

        assertThat(breaker.isBroken()).isTrue();
        assertThat(breaks).hasSize(1);
        assertThat(breaks.get(0).failure()).hasMessage("second");
        assertThat(breaks.get(0).openFor()).isEqualTo(OPEN_FOR);
    }

    @Test
    void open_rejectsWithLastFailureWithoutInvokingOperation() {
        recordFailure("first");
        recordFailure("second");
        int callsBefore = calls.get();

        assertThatThrownBy(this::succeed)
                .isInstanceOf(IOException.class)
                .hasMessage("second");
        assertThat(calls.get()).isEqualTo(callsBefore);
    }

    @Test
    void open_rethrowsCheckedFailureEvenFromUndeclaringAction() {
        recordFailure("first");
        recordFailure("second");

        assertThatThrownBy(() -> breaker.run(() -> calls.incrementAndGet()))
                .isInstanceOf(IOException.class)
                .hasMessage("second");
    }

    @Test
    void afterDuration_successResetsBreaker() throws IOException {
        recordFailure("first");
        recordFailure("second");

        clock.advance(OPEN_FOR);

        assertThat(breaker.isBroken()).isFalse();
        assertThat(succeed()).isEqualTo("ok");
        assertThat(breaker.consecutiveFailures()).isZero();

        recordFailure("after reset");
        assertThat(breaker.isBroken()).isFalse();
    }

    @Test
    void afterDuration_singleFailureReopensForFullDuration() {
        recordFailure("first");
        recordFailure("second");
        clock.advance(OPEN_FOR.plusSeconds(1));

        recordFailure("trial");

        assertThat(breaker.isBroken()).isTrue();
        assertThat(breaks).hasSize(2);
        assertThat(breaks.get(1).failure()).hasMessage("trial");

        clock.advance(OPEN_FOR.minusSeconds(1));
        assertThat(breaker.isBroken()).isTrue();
        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.isBroken()).isFalse();
    }

    @Test
    void justBeforeDuration_stillOpen() {
        recordFailure("first");
        recordFailure("second");

        clock.advance(OPEN_FOR.minusMillis(1));

        assertThat(breaker.isBroken()).isTrue();
    }

    @Test
    void success_clearsFailureCount() throws IOException {
        recordFailure("first");
        succeed();
        recordFailure("second");

        assertThat(breaker.isBroken()).isFalse();
        assertThat(breaker.consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void unhandledFailure_propagatesAndLeavesBreakerUntouched() {
        recordFailure("first");

        assertThatThrownBy(() -> breaker.run(() -> {
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(breaker.consecutiveFailures()).isEqualTo(1);
        assertThat(breaker.isBroken()).isFalse();
    }

    @Test
    void onBreakFailure_propagatesButCircuitStillOpens() {
        CircuitBreakerPolicy noisy = ActionPolicy.handle(IOException.class)
                .clock(clock)
                .circuitBreaker(OPEN_FOR, 1, (failure, openFor) -> {
                    throw new IllegalStateException("reporter down");
                });

        assertThatThrownBy(() -> noisy.run(() -> {
            throw new IOException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(noisy.isBroken()).isTrue();
    }

    @Test
    void breakersBuiltSeparately_doNotShareState() {
        CircuitBreakerPolicy other = ActionPolicy.handle(IOException.class)
                .clock(clock)
                .circuitBreaker(OPEN_FOR, 2);

        recordFailure("first");
        recordFailure("second");

        assertThat(breaker.isBroken()).isTrue();
        assertThat(other.isBroken()).isFalse();
    }

    @Test
    void concurrentFailingCalls_countLikeSerialCalls() throws Exception {
        int threads = 8;
        int callsPerThread = 250;
        int total = threads * callsPerThread;
        AtomicInteger concurrentBreaks = new AtomicInteger();
        AtomicInteger serialBreaks = new AtomicInteger();
        CircuitBreakerPolicy concurrent = ActionPolicy.handle(IOException.class)
                .clock(clock)
                .circuitBreaker(OPEN_FOR, total, (failure, openFor) -> concurrentBreaks.incrementAndGet());
        CircuitBreakerPolicy serial = ActionPolicy.handle(IOException.class)
                .clock(clock)
                .circuitBreaker(OPEN_FOR, total, (failure, openFor) -> serialBreaks.incrementAndGet());
        AtomicInteger invocations = new AtomicInteger();

        runConcurrently(threads, callsPerThread, () -> failingCall(concurrent, invocations));
        for (int i = 0; i < total; i++) {
            failingCall(serial, new AtomicInteger());
        }

        assertThat(invocations.get()).isEqualTo(total);
        assertThat(concurrent.consecutiveFailures()).isEqualTo(serial.consecutiveFailures()).isEqualTo(total);
        assertThat(concurrent.isBroken()).isEqualTo(serial.isBroken()).isTrue();
        assertThat(concurrentBreaks.get()).isEqualTo(serialBreaks.get()).isEqualTo(1);
    }

    @Test
    void concurrentMixedCalls_neverRethrowPlaceholderAndStayClosedBelowThreshold() throws Exception {
        int threads = 8;
        int callsPerThread = 500;
        CircuitBreakerPolicy shared = ActionPolicy.handle(IOException.class)
                .clock(clock)
                .circuitBreaker(OPEN_FOR, threads * callsPerThread + 1);
        AtomicInteger ticket = new AtomicInteger();
        AtomicInteger unexpected = new AtomicInteger();

        runConcurrently(threads, callsPerThread, () -> {
            boolean fails = ticket.incrementAndGet() % 2 == 0;
            try {
                String value = shared.get(() -> {
                    if (fails) {
                        throw new IOException("boom");
                    }
                    return "ok";
                });
                if (!"ok".equals(value)) {
                    unexpected.incrementAndGet();
                }
            } catch (IOException e) {
                if (!fails) {
                    unexpected.incrementAndGet();
                }
            } catch (RuntimeException e) {
                unexpected.incrementAndGet();
            }
        });

        assertThat(unexpected.get()).isZero();
        assertThat(shared.isBroken()).isFalse();
        assertThat(shared.consecutiveFailures()).isBetween(0, threads * callsPerThread / 2);

        shared.get(() -> "ok");
        assertThat(shared.consecutiveFailures()).isZero();
    }

    private static void failingCall(CircuitBreakerPolicy policy, AtomicInteger invocations) {
        try {
            policy.run(() -> {
                invocations.incrementAndGet();
                throw new IOException("boom");
            });
        } catch (IOException expected) {
            // every call fails
        }
    }

    private static void runConcurrently(int threads, int callsPerThread, Runnable call) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        call.run();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
