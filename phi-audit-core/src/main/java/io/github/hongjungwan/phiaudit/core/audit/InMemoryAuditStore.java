package io.github.hongjungwan.phiaudit.core.audit;

import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.spi.AuditStore;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 메모리 감사 저장소.
 *
 * <p>append는 배열에 쓴 뒤 volatile 상태 교체로 공개. 읽기는 락 없이 공개된 prefix만 봄.</p>
 */
public class InMemoryAuditStore implements AuditStore {

    private static final int INITIAL_CAPACITY = 64;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile State state;

    public InMemoryAuditStore() {
        this(AuditHasher.GENESIS_HASH);
    }

    public InMemoryAuditStore(String anchorHash) {
        this(anchorHash, List.of());
    }

    public InMemoryAuditStore(String anchorHash, List<AuditEntry> entries) {
        AuditEntry[] initial = entries.toArray(new AuditEntry[Math.max(INITIAL_CAPACITY, entries.size())]);
        this.state = new State(initial, entries.size(), anchorHash);
    }

    @Override
    public void append(AuditEntry entry) {
        writeLock.lock();
        try {
            State current = state;
            AuditEntry[] entries = current.entries();
            if (current.size() == entries.length) {
                entries = Arrays.copyOf(entries, entries.length * 2);
            }
            entries[current.size()] = entry;
            state = new State(entries, current.size() + 1, current.anchorHash());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<AuditEntry> snapshot() {
        State current = state;
        return Collections.unmodifiableList(Arrays.asList(current.entries()).subList(0, current.size()));
    }

    @Override
    public int size() {
        return state.size();
    }

    @Override
    public String anchorHash() {
        return state.anchorHash();
    }

    @Override
    public void rotate(String newAnchorHash) {
        writeLock.lock();
        try {
            state = new State(new AuditEntry[INITIAL_CAPACITY], 0, newAnchorHash);
        } finally {
            writeLock.unlock();
        }
    }

    private record State(AuditEntry[] entries, int size, String anchorHash) {
    }
}
