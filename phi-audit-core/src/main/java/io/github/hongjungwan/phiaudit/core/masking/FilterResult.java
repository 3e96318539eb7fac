package io.github.hongjungwan.phiaudit.core.masking;

/**
 * 구조 마스킹 결과.
 *
 * @param value    마스킹된 값 (Map은 LinkedHashMap, 시퀀스는 List)
 * @param phiFound 어느 한 leaf라도 PHI가 있었으면 true
 */
public record FilterResult(Object value, boolean phiFound) {
}
