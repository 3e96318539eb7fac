package io.github.hongjungwan.phiaudit.core.masking;

import io.github.hongjungwan.phiaudit.api.domain.PhiCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * PHI/PII 탐지 및 비가역 마스킹. 상태와 I/O가 없는 순수 변환.
 *
 * <p>카테고리는 고정된 순서로 적용되며 매칭 구간은 {@code [REDACTED_<NAME>]} 토큰으로 치환됨.
 * 한 카테고리의 치환이 앞선 카테고리의 새 매칭을 드러낼 수 있으므로 변화가 없을 때까지
 * 전체 패스를 반복함. 그 결과 mask(mask(x)) == mask(x).</p>
 */
@Slf4j
public final class PhiFilter {

    /** 변화가 없을 때까지 반복하는 패스 수 상한 */
    private static final int MAX_MASK_PASSES = 16;

    /** 구조 재귀 상한. 넘으면 값 전체를 이 토큰으로 대체. */
    public static final int MAX_DEPTH = 64;
    static final String DEPTH_EXCEEDED_TOKEN = "[REDACTED_MAX_DEPTH]";

    private final List<PhiCategory> categories;

    /** 내장 카테고리만 사용 */
    public PhiFilter() {
        this(List.of());
    }

    /**
     * 내장 카테고리 뒤에 사용자 카테고리를 추가.
     *
     * @throws IllegalArgumentException 이름 중복 또는 토큰이 등록된 패턴에 매칭되는 경우
     */
    public PhiFilter(List<PhiCategory> customCategories) {
        List<PhiCategory> all = new ArrayList<>(PhiCategory.builtIns());
        if (customCategories != null) {
            all.addAll(customCategories);
        }
        validate(all);
        this.categories = List.copyOf(all);
    }

    private static void validate(List<PhiCategory> all) {
        Set<String> names = new HashSet<>();
        for (PhiCategory category : all) {
            if (!names.add(category.name().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate PHI category: " + category.name());
            }
        }
        // 토큰이 어떤 패턴에도 매칭되지 않아야 재마스킹이 no-op
        for (PhiCategory tokenOwner : all) {
            String token = tokenOwner.token();
            for (PhiCategory category : all) {
                if (category.pattern().matcher(token).find()) {
                    throw new IllegalArgumentException(String.format(
                            "Redaction token %s would be matched by PHI category '%s'", token, category.name()));
                }
            }
        }
    }

    /** 적용 순서대로의 카테고리 목록 */
    public List<PhiCategory> getCategories() {
        return categories;
    }

    /** PHI 포함 여부 */
    public boolean contains(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (PhiCategory category : categories) {
            if (category.pattern().matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /** 탐지된 카테고리 이름 (적용 순서) */
    public Set<String> detectCategories(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> found = new LinkedHashSet<>();
        for (PhiCategory category : categories) {
            if (category.pattern().matcher(text).find()) {
                found.add(category.name());
            }
        }
        return Collections.unmodifiableSet(found);
    }

    /** 모든 카테고리 매칭을 토큰으로 치환. null/빈 문자열은 그대로 반환. */
    public String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String current = text;
        for (int pass = 0; pass < MAX_MASK_PASSES; pass++) {
            String next = maskOnce(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        log.debug("PHI masking did not settle within {} passes", MAX_MASK_PASSES);
        return current;
    }

    private String maskOnce(String text) {
        String result = text;
        for (PhiCategory category : categories) {
            Matcher matcher = category.pattern().matcher(result);
            if (matcher.find()) {
                result = matcher.replaceAll(Matcher.quoteReplacement(category.token()));
            }
        }
        return result;
    }

    /**
     * 중첩 Map/Collection/배열을 재귀 마스킹. 문자열 leaf와 Map 키를 검사하며 숫자, 불리언, null은
     * 그대로 통과. 배열은 List로 반환됨.
     */
    public FilterResult filterStructured(Object value) {
        boolean[] found = new boolean[1];
        Object filtered = filterValue(value, found, 0);
        return new FilterResult(filtered, found[0]);
    }

    private Object filterValue(Object value, boolean[] found, int depth) {
        if (value == null) {
            return null;
        }
        if (depth > MAX_DEPTH) {
            found[0] = true;
            return DEPTH_EXCEEDED_TOKEN;
        }
        if (value instanceof String text) {
            String masked = mask(text);
            if (!masked.equals(text)) {
                found[0] = true;
            }
            return masked;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = filterKey(String.valueOf(entry.getKey()), result, found);
                result.put(key, filterValue(entry.getValue(), found, depth + 1));
            }
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            for (Object item : collection) {
                result.add(filterValue(item, found, depth + 1));
            }
            return result;
        }
        if (value instanceof Object[] array) {
            List<Object> result = new ArrayList<>(array.length);
            for (Object item : array) {
                result.add(filterValue(item, found, depth + 1));
            }
            return result;
        }
        return value;
    }

    /** 키도 마스킹. 마스킹된 키끼리 겹치면 #2, #3 ... 을 붙여 값이 덮어써지지 않게 함. */
    private String filterKey(String key, Map<String, Object> result, boolean[] found) {
        String masked = mask(key);
        if (masked.equals(key)) {
            return key;
        }
        found[0] = true;
        String candidate = masked;
        for (int suffix = 2; result.containsKey(candidate); suffix++) {
            candidate = masked + "#" + suffix;
        }
        return candidate;
    }
}
