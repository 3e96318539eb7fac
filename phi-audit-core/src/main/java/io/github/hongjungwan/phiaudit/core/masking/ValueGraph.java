package io.github.hongjungwan.phiaudit.core.masking;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 호출자가 넘긴 값 그래프의 모양 검사. Map, Collection, 배열만 따라감.
 *
 * <p>순환 판단은 현재 경로 기준이라 같은 객체를 여러 곳에서 공유하는 구조는 순환이 아님.
 * 검사 자체도 maxDepth에서 멈추므로 호출 스택을 소진하지 않음.</p>
 */
public final class ValueGraph {

    public enum Shape {
        ACYCLIC,
        CYCLIC,
        TOO_DEEP
    }

    private ValueGraph() {
    }

    public static Shape inspect(Object value, int maxDepth) {
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        return visit(value, path, 0, maxDepth);
    }

    private static Shape visit(Object value, Set<Object> path, int depth, int maxDepth) {
        Iterable<?> children = childrenOf(value);
        if (children == null) {
            return Shape.ACYCLIC;
        }
        if (depth >= maxDepth) {
            return Shape.TOO_DEEP;
        }
        if (!path.add(value)) {
            return Shape.CYCLIC;
        }
        try {
            for (Object child : children) {
                Shape shape = visit(child, path, depth + 1, maxDepth);
                if (shape != Shape.ACYCLIC) {
                    return shape;
                }
            }
            return Shape.ACYCLIC;
        } finally {
            path.remove(value);
        }
    }

    private static Iterable<?> childrenOf(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.values();
        }
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }
}
