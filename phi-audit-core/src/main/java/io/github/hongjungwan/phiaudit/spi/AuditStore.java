package io.github.hongjungwan.phiaudit.spi;

import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;

import java.util.List;

/**
 * 감사 엔트리 저장소. 한 건씩 영속 append 하고 append 순서대로 조회 가능해야 함.
 *
 * <p>호출 측({@code AuditTrail})이 append를 직렬화하므로 구현체는 단일 writer를 가정해도 됨.
 * 단, snapshot()은 append와 동시에 호출될 수 있으며 일관된 prefix를 돌려줘야 함.</p>
 */
public interface AuditStore extends AutoCloseable {

    /**
     * 엔트리 영속 append.
     *
     * @throws AuditStoreException 저장 실패 시
     */
    void append(AuditEntry entry);

    /** append 순서의 읽기 전용 스냅샷 */
    List<AuditEntry> snapshot();

    int size();

    /** 첫 엔트리의 previousHash로 기대되는 값. rotate 전까지는 genesis. */
    String anchorHash();

    /**
     * 모든 엔트리를 비우고 anchor 교체. 아카이브 직후에만 호출.
     *
     * @throws AuditStoreException 저장 실패 시
     */
    void rotate(String newAnchorHash);

    @Override
    default void close() {
    }
}
