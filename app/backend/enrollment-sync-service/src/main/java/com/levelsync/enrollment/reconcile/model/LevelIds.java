package com.levelsync.enrollment.reconcile.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 레벨 ID 집합 정규화 유틸
 * null, 0 이하 값은 "연결 없음"으로 보고 제거한다.
 */
public final class LevelIds {

    private LevelIds() {
    }

    public static boolean isValid(Long levelId) {
        return levelId != null && levelId > 0;
    }

    public static Set<Long> normalize(Collection<Long> levelIds) {
        if (levelIds == null || levelIds.isEmpty()) {
            return Collections.emptySet();
        }
        Set<Long> normalized = new LinkedHashSet<>();
        for (Long levelId : levelIds) {
            if (isValid(levelId)) {
                normalized.add(levelId);
            }
        }
        return Collections.unmodifiableSet(normalized);
    }

    public static Set<Long> of(Long levelId) {
        return isValid(levelId) ? Set.of(levelId) : Collections.emptySet();
    }
}
