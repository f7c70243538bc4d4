package io.github.hongjungwan.muxlog.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CallerId 테스트")
class CallerIdTest {

    @Test
    @DisplayName("같은 스레드에서는 같은 식별자여야 한다")
    void shouldBeStableWithinThread() {
        assertThat(CallerId.current()).isEqualTo(CallerId.current());
        assertThat(CallerId.current()).isEqualTo(CallerId.forThread(Thread.currentThread()));
    }

    @Test
    @DisplayName("다른 스레드는 다른 식별자여야 한다")
    void shouldDifferAcrossThreads() throws InterruptedException {
        AtomicReference<CallerId> other = new AtomicReference<>();
        Thread thread = new Thread(() -> other.set(CallerId.current()));
        thread.start();
        thread.join();

        assertThat(other.get()).isNotEqualTo(CallerId.current());
    }

    @Test
    @DisplayName("빈 식별자는 거부되어야 한다")
    void shouldRejectBlank() {
        assertThatThrownBy(() -> CallerId.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CallerId.of(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString은 값을 그대로 반환해야 한다")
    void shouldPrintValue() {
        assertThat(CallerId.of("batch-job").toString()).isEqualTo("batch-job");
    }
}
