package com.levelsync.enrollment.catalog.dto;

import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.CoursePostType;
import com.levelsync.enrollment.catalog.model.PriceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Course Catalog 과목 조회 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogCourseResponse {

    public static final String STATUS_PUBLISHED = "publish";

    private Long id;

    /**
     * 게시 상태 (publish, draft, private ...)
     */
    private String status;

    private Boolean isPublic;

    /**
     * free / paid
     */
    private String priceType;

    /**
     * course / bundle
     */
    private String postType;

    private List<Long> categoryIds;

    public CatalogCourse toCourse() {
        return new CatalogCourse(
                id,
                STATUS_PUBLISHED.equalsIgnoreCase(status),
                Boolean.TRUE.equals(isPublic),
                PriceType.from(priceType),
                CoursePostType.from(postType),
                categoryIds
        );
    }
}
