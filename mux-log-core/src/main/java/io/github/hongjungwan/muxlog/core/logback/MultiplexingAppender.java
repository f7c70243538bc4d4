package io.github.hongjungwan.muxlog.core.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Layout;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import io.github.hongjungwan.muxlog.api.CallerId;
import io.github.hongjungwan.muxlog.api.FlushResult;
import io.github.hongjungwan.muxlog.api.MultiplexedLogWriter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logback Appender. 이벤트 하나를 Layout으로 렌더링해 로깅 스레드의 메시지 하나로 전달.
 * 버퍼는 CallerId.current()가 아닌 스레드별 'logback-' 전용 호출자를 사용.
 *
 * 동기화는 멀티플렉서가 담당하므로 UnsynchronizedAppenderBase 사용.
 * Appender 내부 오류는 SLF4J가 아닌 Logback status(addWarn/addError)로만 보고.
 */
public class MultiplexingAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    private final MultiplexedLogWriter writer;
    private Layout<ILoggingEvent> layout;

    private final AtomicLong failedDeliveries = new AtomicLong(0);

    public MultiplexingAppender(MultiplexedLogWriter writer) {
        this(writer, null);
    }

    public MultiplexingAppender(MultiplexedLogWriter writer, Layout<ILoggingEvent> layout) {
        this.writer = writer;
        this.layout = layout;
    }

    public void setLayout(Layout<ILoggingEvent> layout) {
        this.layout = layout;
    }

    @Override
    public void start() {
        if (layout == null) {
            addError("No layout set for the appender named [" + name + "]");
            return;
        }
        if (writer == null) {
            addError("No multiplexed writer set for the appender named [" + name + "]");
            return;
        }
        super.start();
    }

    @Override
    protected void append(ILoggingEvent event) {
        CallerId caller = callerFor(Thread.currentThread());
        try {
            writer.write(caller, layout.doLayout(event));
            FlushResult result = writer.flush(caller);

            if (result.hasFailures()) {
                long failed = failedDeliveries.incrementAndGet();
                if (failed == 1 || failed % 1000 == 0) {
                    addWarn("Delivery failed for " + result.failures().size() + " sink(s). Failed deliveries so far: " + failed);
                }
            }
        } catch (IllegalStateException e) {
            failedDeliveries.incrementAndGet();
            addError("Multiplexed writer rejected log event", e);
        }
    }

    /** 로깅 스레드별 Appender 전용 호출자. 같은 스레드가 직접 write한 미전달 텍스트와 섞이지 않음 */
    static CallerId callerFor(Thread thread) {
        return CallerId.of("logback-" + thread.getId());
    }

    public long getFailedDeliveries() {
        return failedDeliveries.get();
    }
}
