package com.levelsync.enrollment.billing.model;

import java.util.List;

/**
 * 레벨 메타데이터 (접근 모델 + 카테고리 단위 레벨의 카테고리 목록)
 */
public record LevelDetails(Long levelId, String name, AccessModel accessModel, List<Long> categoryIds) {

    public LevelDetails {
        categoryIds = categoryIds == null ? List.of() : List.copyOf(categoryIds);
    }
}
