package io.github.hongjungwan.muxlog.core.sink;

import io.github.hongjungwan.muxlog.spi.LogSink;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * 콘솔 출력 Sink. 프로세스 표준 스트림은 닫지 않음.
 *
 * PrintStream은 예외를 삼키므로 flush 후 checkError()로 실패를 확인.
 */
public class ConsoleLogSink implements LogSink {

    private final String name;
    private final PrintStream stream;

    public ConsoleLogSink(String name, PrintStream stream) {
        this.name = Objects.requireNonNull(name, "name");
        this.stream = Objects.requireNonNull(stream, "stream");
    }

    public static ConsoleLogSink stdout() {
        return new ConsoleLogSink("console:stdout", System.out);
    }

    public static ConsoleLogSink stderr() {
        return new ConsoleLogSink("console:stderr", System.err);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void write(String text) {
        stream.print(text);
    }

    @Override
    public void flush() throws IOException {
        stream.flush();
        if (stream.checkError()) {
            throw new IOException("Console stream '" + name + "' reported an error");
        }
    }

    @Override
    public void close() {
        stream.flush();
    }
}
