package io.github.hongjungwan.muxlog.core.sink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConsoleLogSink 테스트")
class ConsoleLogSinkTest {

    @Test
    @DisplayName("스트림에 출력해야 한다")
    void shouldPrintToStream() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ConsoleLogSink sink = new ConsoleLogSink("test", new PrintStream(out, false, StandardCharsets.UTF_8));

        sink.write("console line\n");
        sink.flush();

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("console line\n");
    }

    @Test
    @DisplayName("스트림 오류는 flush에서 IOException으로 보고해야 한다")
    void shouldReportStreamErrors() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("broken pipe");
            }
        };
        ConsoleLogSink sink = new ConsoleLogSink("broken", new PrintStream(broken, true, StandardCharsets.UTF_8));

        sink.write("lost\n");

        assertThatThrownBy(sink::flush)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("broken");
    }

    @Test
    @DisplayName("표준 스트림 Sink 이름")
    void shouldNameStandardStreams() {
        assertThat(ConsoleLogSink.stdout().getName()).isEqualTo("console:stdout");
        assertThat(ConsoleLogSink.stderr().getName()).isEqualTo("console:stderr");
    }
}
