package io.github.hongjungwan.phiaudit.test;

import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.spi.LogSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 받은 레코드를 메모리에 보관하는 테스트용 sink.
 *
 * <pre>{@code
 * RecordingLogSink sink = new RecordingLogSink();
 * ComplianceLoggerFactory factory = new ComplianceLoggerFactory(config, new PhiFilter(), sink, metrics);
 * }</pre>
 */
public class RecordingLogSink implements LogSink {

    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    @Override
    public void accept(LogRecord record) {
        records.add(record);
    }

    public List<LogRecord> getRecords() {
        return List.copyOf(records);
    }

    public List<LogRecord> getRecords(LogLevel level) {
        return records.stream()
                .filter(r -> r.getLevel() == level)
                .toList();
    }

    /** 마지막 레코드. 없으면 IllegalStateException */
    public LogRecord last() {
        if (records.isEmpty()) {
            throw new IllegalStateException("No records captured");
        }
        return records.get(records.size() - 1);
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String getName() {
        return "recording";
    }
}
