package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.api.MultiplexedLogWriter;
import io.github.hongjungwan.muxlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Writer 자가 진단. Sink 등록 여부와 각 Sink 상태 검사.
 */
@Slf4j
public class MuxLogDoctor {

    private final MultiplexedLogWriter writer;

    public MuxLogDoctor(MultiplexedLogWriter writer) {
        this.writer = writer;
    }

    /** 모든 진단 검사 실행 */
    public DiagnosticReport diagnose() {
        log.info("Running mux-log diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        List<LogSink> sinks = writer.getSinks();

        results.add(checkSinkRegistration(sinks));
        for (LogSink sink : sinks) {
            results.add(checkSinkHealth(sink));
        }

        DiagnosticReport report = new DiagnosticReport(results);

        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.getName(), result.getMessage())
            );
        } else {
            log.info("All diagnostic checks passed successfully");
        }

        return report;
    }

    /** 검사 1: Sink가 하나 이상 등록되었는지 (없으면 첫 Flush가 실패) */
    private DiagnosticResult checkSinkRegistration(List<LogSink> sinks) {
        if (sinks.isEmpty()) {
            return DiagnosticResult.failure("Sink Registration",
                    "No sinks registered - every flush will fail");
        }
        return DiagnosticResult.success("Sink Registration",
                sinks.size() + " sink(s) registered");
    }

    /** 검사 2: Sink별 상태 */
    private DiagnosticResult checkSinkHealth(LogSink sink) {
        String name = "Sink Health [" + sink.getName() + "]";
        try {
            if (sink.isHealthy()) {
                return DiagnosticResult.success(name, "Sink is healthy");
            }
            return DiagnosticResult.warning(name, "Sink reports unhealthy - deliveries may fail");
        } catch (Exception e) {
            return DiagnosticResult.failure(name, "Health check failed: " + e.getMessage());
        }
    }

    /** 진단 결과 */
    public static class DiagnosticResult {
        private final String name;
        private final Status status;
        private final String message;

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        private DiagnosticResult(String name, Status status, String message) {
            this.name = name;
            this.status = status;
            this.message = message;
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public String getName() {
            return name;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }

        public boolean isWarning() {
            return status == Status.WARNING;
        }
    }

    /** 진단 리포트 */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = new ArrayList<>(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public boolean hasWarnings() {
            return results.stream().anyMatch(DiagnosticResult::isWarning);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return new ArrayList<>(results);
        }
    }
}
