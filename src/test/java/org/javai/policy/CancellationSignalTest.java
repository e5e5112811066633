package org.javai.policy;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void cancel_runsListenersOnce() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger runs = new AtomicInteger();
        signal.onCancel(runs::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void onCancel_afterCancellation_runsImmediately() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        AtomicInteger runs = new AtomicInteger();

        signal.onCancel(runs::incrementAndGet);

        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void removedListener_isNotRun() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger runs = new AtomicInteger();
        CancellationSignal.Registration registration = signal.onCancel(runs::incrementAndGet);

        registration.remove();
        signal.cancel();

        assertThat(runs.get()).isZero();
    }

    @Test
    void none_cannotBeCancelled() {
        CancellationSignal none = CancellationSignal.none();

        assertThatThrownBy(none::cancel).isInstanceOf(UnsupportedOperationException.class);
        assertThat(none.isCancelled()).isFalse();
    }
}
