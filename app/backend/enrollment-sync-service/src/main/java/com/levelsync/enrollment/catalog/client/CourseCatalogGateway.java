package com.levelsync.enrollment.catalog.client;

import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.CourseEnrollment;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.catalog.model.EnrollmentStatus;

import java.util.List;
import java.util.Optional;

/**
 * Course Catalog 조회 및 수강 등록 인터페이스
 * 수강 등록 데이터는 반드시 이 인터페이스를 통해서만 변경한다.
 */
public interface CourseCatalogGateway {

    /**
     * 과목/번들 조회 (없으면 empty)
     */
    Optional<CatalogCourse> findCourse(Long courseId);

    /**
     * 사용자의 과목 수강 등록 조회 (취소된 등록 포함, 없으면 empty)
     */
    Optional<CourseEnrollment> findEnrollment(Long userId, Long courseId);

    /**
     * 사용자의 활성 수강 등록 목록
     */
    List<CourseEnrollment> findActiveEnrollments(Long userId);

    /**
     * 수강 등록 생성
     *
     * @return 생성된 수강 등록 ID
     */
    Long enroll(Long userId, Long courseId);

    void changeEnrollmentStatus(Long enrollmentId, EnrollmentStatus status);

    /**
     * 수강 등록 취소 (상태를 cancelled로 변경, 삭제하지 않음)
     */
    void cancelEnrollment(Long userId, Long courseId);

    void tagEnrollment(Long enrollmentId, EnrollmentAttribution attribution);

    /**
     * 번들에 포함된 과목 ID 목록
     */
    List<Long> findBundleCourseIds(Long bundleId);
}
