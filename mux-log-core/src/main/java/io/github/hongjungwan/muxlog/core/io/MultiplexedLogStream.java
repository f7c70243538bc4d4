package io.github.hongjungwan.muxlog.core.io;

import io.github.hongjungwan.muxlog.api.CallerId;
import io.github.hongjungwan.muxlog.api.FlushResult;
import io.github.hongjungwan.muxlog.api.MultiplexedLogWriter;
import io.github.hongjungwan.muxlog.api.SinkFailure;

import java.io.IOException;
import java.io.Writer;
import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link Writer} 어댑터. 호출 스레드를 호출자로 삼아 멀티플렉서에 쓰기.
 *
 * autoFlushOnNewline이면 '\n'까지를 하나의 메시지로 보고 즉시 Flush.
 * 여러 스레드가 하나의 인스턴스를 공유해도 스레드별 버퍼로 분리되므로 줄이 섞이지 않음.
 * PrintWriter로 감쌀 때는 autoFlush 없이 사용 (줄 단위 Flush가 중복됨).
 * 한 줄의 Sink 실패로 이후 줄이 버려지지 않음. 모든 줄을 전달한 뒤 실패를 모아 SinkDeliveryException 하나로 보고.
 * close()는 현재 스레드의 남은 내용만 전달하고 멀티플렉서는 닫지 않음.
 */
public class MultiplexedLogStream extends Writer {

    private final MultiplexedLogWriter target;
    private final boolean autoFlushOnNewline;
    private volatile boolean closed = false;

    public MultiplexedLogStream(MultiplexedLogWriter target) {
        this(target, true);
    }

    public MultiplexedLogStream(MultiplexedLogWriter target, boolean autoFlushOnNewline) {
        this.target = Objects.requireNonNull(target, "target");
        this.autoFlushOnNewline = autoFlushOnNewline;
    }

    @Override
    public void write(char[] cbuf, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, cbuf.length);
        ensureOpen();

        CallerId caller = CallerId.current();
        if (!autoFlushOnNewline) {
            target.write(caller, CharBuffer.wrap(cbuf, off, len));
            return;
        }

        // 실패한 줄이 있어도 나머지 줄과 꼬리는 계속 처리하고, 실패는 끝에서 한 번만 보고
        List<FlushResult> failed = new ArrayList<>();
        int start = off;
        int end = off + len;
        for (int i = off; i < end; i++) {
            if (cbuf[i] == '\n') {
                target.write(caller, CharBuffer.wrap(cbuf, start, i + 1 - start));
                FlushResult result = target.flush(caller);
                if (result.hasFailures()) {
                    failed.add(result);
                }
                start = i + 1;
            }
        }
        if (start < end) {
            target.write(caller, CharBuffer.wrap(cbuf, start, end - start));
        }

        if (!failed.isEmpty()) {
            throw new SinkDeliveryException(merge(failed));
        }
    }

    /** 현재 스레드 버퍼를 모든 Sink에 전달 */
    @Override
    public void flush() throws IOException {
        ensureOpen();
        deliver(CallerId.current());
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        CallerId caller = CallerId.current();
        if (target.pendingLength(caller) > 0) {
            deliver(caller);
        }
    }

    private void deliver(CallerId caller) throws IOException {
        FlushResult result = target.flush(caller);
        if (result.hasFailures()) {
            throw new SinkDeliveryException(result);
        }
    }

    private static FlushResult merge(List<FlushResult> failed) {
        if (failed.size() == 1) {
            return failed.get(0);
        }
        int deliveredChars = 0;
        List<SinkFailure> failures = new ArrayList<>();
        for (FlushResult result : failed) {
            deliveredChars += result.deliveredChars();
            failures.addAll(result.failures());
        }
        return new FlushResult(failed.get(failed.size() - 1).sinkCount(), deliveredChars, failures);
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}
