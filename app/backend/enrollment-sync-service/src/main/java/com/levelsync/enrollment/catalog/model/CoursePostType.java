package com.levelsync.enrollment.catalog.model;

/**
 * Catalog 항목 종류
 */
public enum CoursePostType {
    COURSE,
    /**
     * 여러 과목을 묶은 항목 (내용이 과목 목록)
     */
    BUNDLE,
    OTHER;

    public static CoursePostType from(String value) {
        if ("course".equalsIgnoreCase(value) || "courses".equalsIgnoreCase(value)) {
            return COURSE;
        }
        if ("bundle".equalsIgnoreCase(value) || "course-bundle".equalsIgnoreCase(value)) {
            return BUNDLE;
        }
        return OTHER;
    }
}
