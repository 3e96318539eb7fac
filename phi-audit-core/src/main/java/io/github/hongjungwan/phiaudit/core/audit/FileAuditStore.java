package io.github.hongjungwan.phiaudit.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.spi.AuditStore;
import io.github.hongjungwan.phiaudit.spi.AuditStoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON lines 파일 감사 저장소. 재시작 시 파일을 다시 읽어 같은 체인을 이어감.
 *
 * <pre>
 * {"anchorHash":"000...000"}      // 헤더
 * {"entryId":...,"entryHash":...} // 엔트리 한 줄씩
 * </pre>
 *
 * 각 append는 FileChannel.force()로 디스크에 반영된 뒤에 성공으로 간주.
 * 실패한 append는 파일에 흔적을 남기지 않음.
 * 파일 내용 자체는 검증하지 않음 (변조 탐지는 AuditTrail.verifyIntegrity 몫).
 */
@Slf4j
public class FileAuditStore implements AuditStore {

    static final String ANCHOR_FIELD = "anchorHash";

    private final Path file;
    private final AuditJsonCodec codec;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile InMemoryAuditStore index;
    private FileChannel channel;

    public FileAuditStore(Path file) {
        this(file, new AuditJsonCodec());
    }

    public FileAuditStore(Path file, AuditJsonCodec codec) {
        this.file = file;
        this.codec = codec;

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(file) && Files.size(file) > 0) {
                this.index = load();
                log.info("Audit store loaded: {} ({} entries)", file, index.size());
            } else {
                Files.writeString(file, headerLine(AuditHasher.GENESIS_HASH), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                this.index = new InMemoryAuditStore(AuditHasher.GENESIS_HASH);
                log.info("Audit store created: {}", file);
            }
            this.channel = openForAppend();
        } catch (IOException e) {
            throw new AuditStoreException("Failed to open audit store: " + file, e);
        }
    }

    private InMemoryAuditStore load() throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

        String anchor = parseAnchor(lines.get(0));
        List<AuditEntry> entries = new ArrayList<>(lines.size());
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(codec.fromJsonLine(line));
            } catch (AuditJsonCodec.CodecException e) {
                throw new AuditStoreException("Corrupt audit store " + file + " at line " + (i + 1), e);
            }
        }
        return new InMemoryAuditStore(anchor, entries);
    }

    private String parseAnchor(String header) {
        try {
            Map<?, ?> parsed = codec.getObjectMapper().readValue(header, Map.class);
            Object anchor = parsed.get(ANCHOR_FIELD);
            if (anchor instanceof String hash && AuditHasher.isValidHash(hash)) {
                return hash;
            }
        } catch (JsonProcessingException e) {
            throw new AuditStoreException("Corrupt audit store header in " + file, e);
        }
        throw new AuditStoreException("Missing or invalid anchor hash in audit store header: " + file);
    }

    private String headerLine(String anchorHash) {
        return "{\"" + ANCHOR_FIELD + "\":\"" + anchorHash + "\"}\n";
    }

    private FileChannel openForAppend() throws IOException {
        return FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /**
     * 한 줄 기록 후 force. 실패하면 파일을 기록 전 길이로 되돌려 인덱스와 파일이 같은 체인을 유지.
     */
    @Override
    public void append(AuditEntry entry) {
        byte[] line = (codec.toJsonLine(entry) + "\n").getBytes(StandardCharsets.UTF_8);

        lock.lock();
        try {
            long committedSize = channel.size();
            try {
                write(channel, ByteBuffer.wrap(line));
                sync(channel);
            } catch (IOException e) {
                rollback(committedSize, e);
                throw e;
            }
            index.append(entry);
        } catch (IOException e) {
            throw new AuditStoreException("Failed to append audit entry " + entry.getEntryId() + " to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    void write(FileChannel target, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            target.write(buffer);
        }
    }

    void sync(FileChannel target) throws IOException {
        target.force(false);
    }

    private void rollback(long committedSize, IOException cause) {
        try {
            channel.truncate(committedSize);
            channel.force(false);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.error("Failed to roll back partial audit append in {} to {} bytes", file, committedSize, e);
        }
    }

    @Override
    public List<AuditEntry> snapshot() {
        return index.snapshot();
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public String anchorHash() {
        return index.anchorHash();
    }

    /** 헤더만 있는 임시 파일을 만든 뒤 원자적으로 교체 */
    @Override
    public void rotate(String newAnchorHash) {
        lock.lock();
        try {
            Path temp = file.resolveSibling(file.getFileName() + ".rotating");
            Files.writeString(temp, headerLine(newAnchorHash), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);

            channel.close();
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            channel = openForAppend();
            index = new InMemoryAuditStore(newAnchorHash);

            log.info("Audit store rotated: {} (anchor={})", file, newAnchorHash);
        } catch (IOException e) {
            throw new AuditStoreException("Failed to rotate audit store: " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException e) {
            log.warn("Error closing audit store '{}': {}", file, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    public Path getFile() {
        return file;
    }
}
