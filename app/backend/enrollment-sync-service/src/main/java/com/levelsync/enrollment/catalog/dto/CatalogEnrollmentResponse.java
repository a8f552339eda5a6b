package com.levelsync.enrollment.catalog.dto;

import com.levelsync.enrollment.catalog.model.AttributionSource;
import com.levelsync.enrollment.catalog.model.CourseEnrollment;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.catalog.model.EnrollmentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Course Catalog 수강 등록 조회 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEnrollmentResponse {

    private Long id;

    private Long userId;

    private Long courseId;

    /**
     * active / completed / cancelled
     */
    private String status;

    /**
     * membership / individual (기록 전이면 null)
     */
    private String attribution;

    private Long levelId;

    private Long orderId;

    private String orderCode;

    public CourseEnrollment toEnrollment() {
        AttributionSource source = AttributionSource.fromWireValue(attribution);
        EnrollmentAttribution enrollmentAttribution = source == null
                ? null
                : new EnrollmentAttribution(source, levelId, orderId, orderCode);

        return new CourseEnrollment(id, userId, courseId, EnrollmentStatus.from(status), enrollmentAttribution);
    }
}
