package com.levelsync.enrollment.catalog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수강 등록 생성 응답
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnrollResponse {

    private Long enrollmentId;
}
