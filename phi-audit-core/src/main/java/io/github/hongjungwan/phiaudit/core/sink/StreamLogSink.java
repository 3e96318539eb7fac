package io.github.hongjungwan.phiaudit.core.sink;

import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.core.internal.LogRecordSerializer;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import io.github.hongjungwan.phiaudit.spi.LogSinkException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON lines를 Writer로 출력하는 sink (콘솔 또는 파일).
 */
@Slf4j
public class StreamLogSink implements LogSink {

    private final Writer writer;
    private final LogRecordSerializer serializer;
    private final boolean ownsWriter;
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();

    public StreamLogSink(Writer writer, LogRecordSerializer serializer, boolean ownsWriter, String name) {
        this.writer = writer;
        this.serializer = serializer;
        this.ownsWriter = ownsWriter;
        this.name = name;
    }

    /** 표준 출력. close 시 System.out은 닫지 않음. */
    public static StreamLogSink console() {
        return forStream(System.out, "console");
    }

    /** 임의 OutputStream (UTF-8). 스트림 소유권은 호출자에게 있음. */
    public static StreamLogSink forStream(OutputStream out, String name) {
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        return new StreamLogSink(writer, new LogRecordSerializer(), false, name);
    }

    /** 파일 append. 상위 디렉토리가 없으면 생성. */
    public static StreamLogSink toFile(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return new StreamLogSink(writer, new LogRecordSerializer(), true, "file:" + file);
        } catch (IOException e) {
            throw new LogSinkException("Failed to open log file: " + file, e);
        }
    }

    @Override
    public void accept(LogRecord record) {
        String line = serializer.toJson(record);
        lock.lock();
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new LogSinkException("Failed to write log record to " + name, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            writer.flush();
        } catch (IOException e) {
            throw new LogSinkException("Failed to flush " + name, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            writer.flush();
            if (ownsWriter) {
                writer.close();
            }
        } catch (IOException e) {
            log.warn("Error closing log stream '{}': {}", name, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getName() {
        return name;
    }
}
