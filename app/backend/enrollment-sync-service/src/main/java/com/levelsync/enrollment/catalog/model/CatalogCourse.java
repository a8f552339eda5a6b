package com.levelsync.enrollment.catalog.model;

import java.util.List;

/**
 * Catalog 과목 정보 (읽기 전용)
 */
public record CatalogCourse(
        Long id,
        boolean published,
        boolean publicCourse,
        PriceType priceType,
        CoursePostType postType,
        List<Long> categoryIds
) {

    public CatalogCourse {
        categoryIds = categoryIds == null ? List.of() : List.copyOf(categoryIds);
    }

    public boolean isBundle() {
        return postType == CoursePostType.BUNDLE;
    }

    /**
     * 게시된 과목 또는 번들인지 (멤버십 연결 대상)
     */
    public boolean isPublishedCourseEntry() {
        return published && (postType == CoursePostType.COURSE || postType == CoursePostType.BUNDLE);
    }
}
