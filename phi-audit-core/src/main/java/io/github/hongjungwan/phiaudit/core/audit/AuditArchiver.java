package io.github.hongjungwan.phiaudit.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Stream;

/**
 * 감사 체인 아카이브 (JSON + Zstd 압축).
 *
 * 파일명: {@code audit-<UTC yyyyMMdd'T'HHmmssSSS>-<lastHash 앞 12자>.audit.zst}
 */
@Slf4j
public class AuditArchiver {

    public static final String FILE_PREFIX = "audit-";
    public static final String FILE_SUFFIX = ".audit.zst";
    public static final long MAX_DECOMPRESSED_SIZE = 256 * 1024 * 1024L;  // 256MB

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final int compressionLevel;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public AuditArchiver(Path directory, int compressionLevel) {
        this(directory, compressionLevel, Clock.systemUTC());
    }

    /** Zstd 압축 레벨 1-22 검증 */
    public AuditArchiver(Path directory, int compressionLevel, Clock clock) {
        if (compressionLevel < 1 || compressionLevel > 22) {
            throw new IllegalArgumentException(
                    "Zstd compression level must be between 1 and 22, got: " + compressionLevel);
        }
        this.directory = directory;
        this.compressionLevel = compressionLevel;
        this.clock = clock;
        this.objectMapper = AuditJsonCodec.createObjectMapper();
    }

    /** 아카이브 작성. 임시 파일에 쓴 뒤 원자적으로 이동. */
    public Path write(String anchorHash, String lastHash, List<AuditEntry> entries) {
        Instant archivedAt = clock.instant();
        AuditArchive archive = new AuditArchive(anchorHash, lastHash, archivedAt, entries);
        Path target = directory.resolve(FILE_PREFIX + FILE_TIMESTAMP.format(archivedAt)
                + "-" + lastHash.substring(0, 12) + FILE_SUFFIX);

        try {
            byte[] json = objectMapper.writeValueAsBytes(archive);
            byte[] compressed = Zstd.compress(json, compressionLevel);

            Files.createDirectories(directory);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.write(temp, compressed);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);

            log.info("Audit archive written: {} ({} entries, {} -> {} bytes)",
                    target, entries.size(), json.length, compressed.length);
            return target;

        } catch (IOException | ZstdException e) {
            throw new AuditArchiveException("Failed to write audit archive: " + target, e);
        }
    }

    /** 아카이브 읽기 (Zstd 압축 해제 + JSON 파싱). 체인 검증은 AuditChainVerifier로. */
    public AuditArchive read(Path file) {
        try {
            byte[] data = Files.readAllBytes(file);
            long originalSize = Zstd.decompressedSize(data);

            // 0 이하: 손상된 데이터 또는 알 수 없는 크기
            if (originalSize <= 0) {
                throw new AuditArchiveException("Invalid decompressed size in " + file + ": " + originalSize);
            }

            // 크기 제한 검증 (메모리 고갈 방지)
            if (originalSize > MAX_DECOMPRESSED_SIZE) {
                throw new AuditArchiveException(
                        String.format("Decompressed size exceeds limit in %s: %d bytes", file, originalSize));
            }

            byte[] decompressed = Zstd.decompress(data, (int) originalSize);
            if (decompressed.length != originalSize) {
                throw new AuditArchiveException(
                        String.format("Size mismatch in %s: expected %d, got %d", file, originalSize, decompressed.length));
            }

            return objectMapper.readValue(decompressed, AuditArchive.class);

        } catch (IOException | ZstdException e) {
            throw new AuditArchiveException("Failed to read audit archive: " + file, e);
        }
    }

    /** 디렉토리의 아카이브 파일 목록 (이름순 = 시간순) */
    public List<Path> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new AuditArchiveException("Failed to list audit archives in " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
