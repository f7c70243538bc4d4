package io.github.hongjungwan.muxlog.core.sink;

import io.github.hongjungwan.muxlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TCP 소켓 Sink. 첫 쓰기 시 연결하고, 쓰기 실패 시 연결을 버린 뒤 다음 쓰기에서 재연결.
 *
 * 재시도는 하지 않음. 실패는 그대로 Flush 결과로 보고됨.
 * 상태 확인은 전달 락 밖에서도 호출되므로 연결 상태는 자체 락으로 보호.
 */
@Slf4j
public class SocketLogSink implements LogSink {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    private final String host;
    private final int port;
    private final int connectTimeoutMs;
    private final ReentrantLock lock = new ReentrantLock();

    private Socket socket;
    private BufferedWriter writer;
    private boolean closed = false;

    public SocketLogSink(String host, int port) {
        this(host, port, DEFAULT_CONNECT_TIMEOUT);
    }

    public SocketLogSink(String host, int port, Duration connectTimeout) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = (int) connectTimeout.toMillis();
    }

    @Override
    public String getName() {
        return "socket:" + host + ":" + port;
    }

    @Override
    public void write(String text) throws IOException {
        lock.lock();
        try {
            ensureConnected().write(text);
        } catch (IOException e) {
            disconnect();
            throw e;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() throws IOException {
        lock.lock();
        try {
            if (writer != null) {
                writer.flush();
            }
        } catch (IOException e) {
            disconnect();
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /** 연결 가능 여부. 미연결 상태면 연결을 시도 */
    @Override
    public boolean isHealthy() {
        lock.lock();
        try {
            ensureConnected();
            return true;
        } catch (IOException e) {
            log.debug("Socket sink {} is not reachable: {}", getName(), e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            closed = true;
            if (writer != null) {
                writer.flush();
            }
        } finally {
            disconnect();
            lock.unlock();
        }
    }

    public boolean isConnected() {
        lock.lock();
        try {
            return socket != null && !socket.isClosed();
        } finally {
            lock.unlock();
        }
    }

    private BufferedWriter ensureConnected() throws IOException {
        if (closed) {
            throw new IOException("Socket sink " + getName() + " is closed");
        }
        if (writer != null) {
            return writer;
        }

        Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            writer = new BufferedWriter(new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8));
            socket = s;
            log.info("Connected log socket sink to {}:{}", host, port);
            return writer;
        } catch (IOException e) {
            s.close();
            throw e;
        }
    }

    private void disconnect() {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Failed to close socket {}", getName(), e);
            }
        }
        socket = null;
        writer = null;
    }
}
