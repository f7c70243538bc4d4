package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.api.CallerId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CallerBufferTable 테스트")
class CallerBufferTableTest {

    private static final CallerId CALLER = CallerId.of("caller");

    private WriterMetrics metrics;
    private CallerBufferTable table;

    @BeforeEach
    void setUp() {
        metrics = new WriterMetrics();
        table = new CallerBufferTable(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC), metrics);
    }

    @Test
    @DisplayName("같은 호출자에 대한 동시 생성은 버퍼 하나만 만들어야 한다")
    void shouldCreateSingleBufferUnderRace() throws InterruptedException {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    CallerBuffer buffer = table.acquire(CALLER);
                    try {
                        buffer.append("x");
                    } finally {
                        table.release(buffer);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(table.size()).isEqualTo(1);
        assertThat(metrics.getSnapshot().buffersCreated()).isEqualTo(1);
        assertThat(table.pendingLength(CALLER)).isEqualTo(threads);
    }

    @Test
    @DisplayName("pendingLength는 버퍼를 생성하지 않아야 한다")
    void shouldNotCreateBufferOnPendingLength() {
        assertThat(table.pendingLength(CALLER)).isZero();
        assertThat(table.contains(CALLER)).isFalse();
    }

    @Test
    @DisplayName("제거된 버퍼를 다시 요청하면 새 버퍼를 받아야 한다")
    void shouldReplaceRetiredBuffer() {
        CallerBuffer first = table.acquire(CALLER);
        table.release(first);

        assertThat(table.evictWhere(buffer -> true)).isEqualTo(1);
        assertThat(first.isRetired()).isTrue();

        CallerBuffer second = table.acquire(CALLER);
        try {
            assertThat(second).isNotSameAs(first);
            assertThat(second.isRetired()).isFalse();
        } finally {
            table.release(second);
        }
        assertThat(table.contains(CALLER)).isTrue();
    }

    @Test
    @DisplayName("다른 스레드가 잡고 있는 버퍼는 제거 대상에서 건너뛰어야 한다")
    void shouldSkipBusyBuffer() throws InterruptedException {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch releaseSignal = new CountDownLatch(1);

        Thread holder = new Thread(() -> {
            CallerBuffer buffer = table.acquire(CALLER);
            try {
                held.countDown();
                releaseSignal.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                table.release(buffer);
            }
        });
        holder.start();
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(table.evictWhere(buffer -> true)).isZero();
        assertThat(table.contains(CALLER)).isTrue();

        releaseSignal.countDown();
        holder.join(5000);

        assertThat(table.evictWhere(buffer -> true)).isEqualTo(1);
    }

    @Test
    @DisplayName("clear는 모든 버퍼를 해제해야 한다")
    void shouldClearAllBuffers() {
        table.release(table.acquire(CallerId.of("a")));
        table.release(table.acquire(CallerId.of("b")));

        table.clear();

        assertThat(table.size()).isZero();
    }
}
