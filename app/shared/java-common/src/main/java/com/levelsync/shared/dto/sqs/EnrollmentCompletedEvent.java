package com.levelsync.shared.dto.sqs;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 수강 등록 완료 이벤트
 *
 * Queue: catalog-enrollment-completed
 * Publisher: Course-Catalog (개별 구매, 멤버십 등록 모두 포함)
 * Consumer: Enrollment-Sync-Service
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentCompletedEvent {

    private Long courseId;

    private Long userId;

    /**
     * Catalog의 수강 등록 ID
     */
    private Long enrollmentId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss[.SSSSSS][.SSS]")
    private LocalDateTime enrolledAt;
}
