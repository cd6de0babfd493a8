package com.example.solarcast.audit;

import com.example.solarcast.exception.AuditWriteException;
import com.example.solarcast.ml.FeatureRecord;
import com.example.solarcast.ml.PredictionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Append-only CSV log of served predictions.
 *
 * <h2>Writer discipline</h2>
 * Request threads only hand rows to a single daemon thread named {@code audit-writer};
 * that thread is the only one touching the file, so rows are whole and in submission order.
 * The header is written first iff the file is absent or empty.
 *
 * <h2>Failure isolation</h2>
 * {@link #record(FeatureRecord, PredictionResult)} never throws. Write errors are logged,
 * counted in {@code forecast.audit.failures} and the row is dropped. The writer queue is
 * bounded; a row that finds it full is dropped and counted the same way.
 */
@Slf4j
public class AuditLogger {

    private final Path file;
    private final boolean enabled;
    private final Clock clock;
    private final Counter rows;
    private final Counter failures;

    private final ThreadPoolExecutor writer;

    public AuditLogger(Path file, boolean enabled, Clock clock, MeterRegistry meterRegistry, int queueCapacity) {
        this(file, enabled, clock, meterRegistry, newWriter(queueCapacity));
    }

    AuditLogger(Path file, boolean enabled, Clock clock, MeterRegistry meterRegistry, ThreadPoolExecutor writer) {
        this.file = file;
        this.writer = writer;
        this.enabled = enabled;
        this.clock = clock;
        this.rows = meterRegistry.counter("forecast.audit.rows");
        this.failures = meterRegistry.counter("forecast.audit.failures");
        log.info("Prediction audit log {} at {}", enabled ? "enabled" : "disabled", file.toAbsolutePath());
    }

    static ThreadPoolExecutor newWriter(int queueCapacity) {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), r -> {
                    Thread t = new Thread(r, "audit-writer");
                    t.setDaemon(true);
                    return t;
                });
    }

    /** Queues one row; returns immediately. Only call after a successful inference. */
    public void record(FeatureRecord request, PredictionResult result) {
        if (!enabled) return;
        try {
            AuditRecord row = AuditRecord.of(clock.instant(), request, result);
            writer.execute(() -> write(row));
        } catch (RuntimeException e) {
            failures.increment();
            log.warn("Audit row dropped before write: {}", e.toString());
        }
    }

    /** Blocks until every row queued before this call has been written or dropped. */
    public void flush() {
        try {
            writer.submit(() -> { }).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("Audit flush did not complete: {}", e.toString());
        }
    }

    @PreDestroy
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Audit writer still busy at shutdown; pending rows dropped");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public Path file() {
        return file;
    }

    private void write(AuditRecord row) {
        try {
            append(row.toCsvRow());
            rows.increment();
        } catch (AuditWriteException e) {
            failures.increment();
            log.warn("{}; row dropped: {}", e.getMessage(), e.getCause().toString());
        } catch (RuntimeException e) {
            failures.increment();
            log.warn("Unexpected audit failure; row dropped: {}", e.toString());
        }
    }

    private void append(String line) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean fresh = Files.notExists(file) || Files.size(file) == 0;
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (fresh) {
                    w.write(AuditRecord.HEADER);
                    w.write('\n');
                }
                w.write(line);
                w.write('\n');
            }
        } catch (IOException e) {
            throw new AuditWriteException(file, e);
        }
    }
}
