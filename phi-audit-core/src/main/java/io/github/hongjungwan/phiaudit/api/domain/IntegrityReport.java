package io.github.hongjungwan.phiaudit.api.domain;

/**
 * 해시 체인 검증 결과.
 *
 * @param valid            체인 전체가 유효하면 true
 * @param entriesChecked   검증을 시도한 엔트리 수
 * @param firstBrokenIndex 처음 어긋난 엔트리 인덱스, 유효하면 -1
 * @param failure          어긋난 종류, 유효하면 null
 * @param expectedHash     재계산/기대 해시
 * @param actualHash       저장되어 있던 해시
 */
public record IntegrityReport(
        boolean valid,
        int entriesChecked,
        int firstBrokenIndex,
        Failure failure,
        String expectedHash,
        String actualHash
) {

    /**
     * LINK_MISMATCH: previousHash가 직전 entryHash(또는 anchor)와 다름.
     * HASH_MISMATCH: 저장된 entryHash가 재계산 값과 다름.
     */
    public enum Failure {
        LINK_MISMATCH,
        HASH_MISMATCH
    }

    public static IntegrityReport intact(int entriesChecked) {
        return new IntegrityReport(true, entriesChecked, -1, null, null, null);
    }

    public static IntegrityReport broken(int index, Failure failure, String expectedHash, String actualHash) {
        return new IntegrityReport(false, index + 1, index, failure, expectedHash, actualHash);
    }
}
