package org.javai.policy;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class ExceptionClassifierTest {

    @Test
    void of_matchesTypeAndSubtypes() {
        ExceptionClassifier io = ExceptionClassifier.of(IOException.class);

        assertThat(io.canHandle(new IOException())).isTrue();
        assertThat(io.canHandle(new FileNotFoundException())).isTrue();
        assertThat(io.canHandle(new RuntimeException())).isFalse();
    }

    @Test
    void anyOf_matchesAnyListedType() {
        ExceptionClassifier classifier = ExceptionClassifier.anyOf(
                SocketTimeoutException.class, TimeoutException.class, IllegalStateException.class, ArithmeticException.class);

        assertThat(classifier.canHandle(new SocketTimeoutException())).isTrue();
        assertThat(classifier.canHandle(new ArithmeticException())).isTrue();
        assertThat(classifier.canHandle(new IOException())).isFalse();
    }

    @Test
    void anyOf_noTypes_isRejected() {
        assertThatThrownBy(() -> ExceptionClassifier.anyOf(new Class[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void or_and_negate_compose() {
        ExceptionClassifier timeouts = ExceptionClassifier.of(TimeoutException.class);
        ExceptionClassifier throttled = ExceptionClassifier.from(e -> "429".equals(e.getMessage()));

        ExceptionClassifier either = timeouts.or(throttled);

        assertThat(either.canHandle(new TimeoutException())).isTrue();
        assertThat(either.canHandle(new IllegalStateException("429"))).isTrue();
        assertThat(either.canHandle(new IllegalStateException("500"))).isFalse();
        assertThat(either.negate().canHandle(new IllegalStateException("500"))).isTrue();
    }

    @Test
    void all_matchesEverything() {
        assertThat(ExceptionClassifier.all().canHandle(new Error())).isTrue();
    }
}
