package io.github.hongjungwan.muxlog.core.sink;

import io.github.hongjungwan.muxlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 파일 Sink (append 모드). 상위 디렉토리가 없으면 생성.
 */
@Slf4j
public class FileLogSink implements LogSink {

    private final Path path;
    private final BufferedWriter writer;

    public FileLogSink(Path path) throws IOException {
        this(path, StandardCharsets.UTF_8);
    }

    public FileLogSink(Path path, Charset charset) throws IOException {
        this.path = path.toAbsolutePath();

        Path parent = this.path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        this.writer = Files.newBufferedWriter(this.path, charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        log.debug("Opened log file: {}", this.path);
    }

    @Override
    public String getName() {
        return "file:" + path;
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
    public boolean isHealthy() {
        return Files.isWritable(path);
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    public Path getPath() {
        return path;
    }
}
