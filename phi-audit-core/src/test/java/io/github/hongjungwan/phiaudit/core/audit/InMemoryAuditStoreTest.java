package io.github.hongjungwan.phiaudit.core.audit;

import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.api.domain.AuditStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryAuditStore 테스트")
class InMemoryAuditStoreTest {

    private AuditEntry entry(int seq) {
        return AuditEntry.builder()
                .entryId("e-" + seq)
                .timestamp(Instant.EPOCH)
                .action("VIEW")
                .resourceType("PATIENT")
                .resourceId("p" + seq)
                .status(AuditStatus.SUCCESS)
                .previousHash(AuditHasher.GENESIS_HASH)
                .entryHash(AuditHasher.GENESIS_HASH)
                .build();
    }

    @Test
    @DisplayName("초기 용량을 넘겨도 추가 순서를 유지해야 한다")
    void shouldGrowAndKeepOrder() {
        InMemoryAuditStore store = new InMemoryAuditStore();

        for (int i = 0; i < 200; i++) {
            store.append(entry(i));
        }

        assertThat(store.size()).isEqualTo(200);
        assertThat(store.snapshot().get(0).getEntryId()).isEqualTo("e-0");
        assertThat(store.snapshot().get(199).getEntryId()).isEqualTo("e-199");
    }

    @Test
    @DisplayName("스냅샷은 이후 추가에 영향받지 않고 수정할 수 없어야 한다")
    void snapshotShouldBeStableAndReadOnly() {
        InMemoryAuditStore store = new InMemoryAuditStore();
        store.append(entry(0));

        List<AuditEntry> snapshot = store.snapshot();
        store.append(entry(1));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(entry(2))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("rotate는 엔트리를 비우고 anchor를 교체해야 한다")
    void shouldRotate() {
        InMemoryAuditStore store = new InMemoryAuditStore();
        store.append(entry(0));

        store.rotate("a".repeat(64));

        assertThat(store.size()).isZero();
        assertThat(store.anchorHash()).isEqualTo("a".repeat(64));
    }
}
