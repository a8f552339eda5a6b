package com.levelsync.enrollment.billing.model;

import java.util.Arrays;

/**
 * 레벨 접근 모델 (membership_level_meta.access_model)
 */
public enum AccessModel {

    /**
     * 사이트 전체 과목
     */
    FULL_WEBSITE("full_website"),

    /**
     * 레벨에 연결된 카테고리의 과목
     */
    CATEGORY_WISE("category_wise"),

    /**
     * 제한 페이지/역방향 속성으로 연결된 개별 과목 (meta 값 없음)
     */
    COURSE_SPECIFIC("");

    private final String metaValue;

    AccessModel(String metaValue) {
        this.metaValue = metaValue;
    }

    public String getMetaValue() {
        return metaValue;
    }

    /**
     * meta 값으로 변환. 알 수 없는 값이나 빈 값은 COURSE_SPECIFIC
     * ("full_website_membership" 처럼 접미사가 붙은 레거시 값도 허용)
     */
    public static AccessModel fromMetaValue(String value) {
        if (value == null || value.isBlank()) {
            return COURSE_SPECIFIC;
        }
        String normalized = value.trim().toLowerCase().replace("_membership", "");
        return Arrays.stream(values())
                .filter(model -> model != COURSE_SPECIFIC && model.metaValue.equals(normalized))
                .findFirst()
                .orElse(COURSE_SPECIFIC);
    }
}
