package io.github.hongjungwan.muxlog.core.sink;

import io.github.hongjungwan.muxlog.spi.LogSink;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * 임의의 {@link Writer}를 감싸는 Sink.
 */
public class WriterLogSink implements LogSink {

    private final String name;
    private final Writer writer;

    public WriterLogSink(String name, Writer writer) {
        this.name = Objects.requireNonNull(name, "name");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void write(String text) throws IOException {
        writer.write(text);
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
