package com.levelsync.enrollment.catalog.client;

import com.levelsync.enrollment.catalog.dto.CatalogCourseResponse;
import com.levelsync.enrollment.catalog.dto.CatalogEnrollmentResponse;
import com.levelsync.enrollment.catalog.dto.EnrollRequest;
import com.levelsync.enrollment.catalog.dto.EnrollResponse;
import com.levelsync.enrollment.catalog.dto.EnrollmentAttributionRequest;
import com.levelsync.enrollment.catalog.dto.EnrollmentStatusRequest;
import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.CourseEnrollment;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.catalog.model.EnrollmentStatus;
import com.levelsync.enrollment.common.config.MembershipSyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Course Catalog Internal API 클라이언트
 *
 * 조회 결과 404는 empty로 처리하고, 그 외 호출 실패는 CatalogClientException으로 감싸서 던진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogServiceClient implements CourseCatalogGateway {

    private static final String INTERNAL_PATH = "/internal/v1";

    private final RestTemplate restTemplate;
    private final MembershipSyncProperties properties;

    @Override
    public Optional<CatalogCourse> findCourse(Long courseId) {
        String url = baseUrl() + "/courses/" + courseId;

        try {
            CatalogCourseResponse response = restTemplate.getForObject(url, CatalogCourseResponse.class);
            return Optional.ofNullable(response).map(CatalogCourseResponse::toCourse);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Catalog 과목 없음: courseId={}", courseId);
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Catalog 과목 조회 실패: courseId={}, error={}", courseId, e.getMessage());
            throw new CatalogClientException("Failed to fetch course " + courseId, e);
        }
    }

    @Override
    public Optional<CourseEnrollment> findEnrollment(Long userId, Long courseId) {
        String url = baseUrl() + "/users/" + userId + "/enrollments/" + courseId;

        try {
            CatalogEnrollmentResponse response = restTemplate.getForObject(url, CatalogEnrollmentResponse.class);
            return Optional.ofNullable(response).map(CatalogEnrollmentResponse::toEnrollment);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Catalog 수강 등록 조회 실패: userId={}, courseId={}, error={}",
                    userId, courseId, e.getMessage());
            throw new CatalogClientException("Failed to fetch enrollment of user " + userId, e);
        }
    }

    @Override
    public List<CourseEnrollment> findActiveEnrollments(Long userId) {
        String url = baseUrl() + "/users/" + userId + "/enrollments?active=true";

        try {
            ResponseEntity<List<CatalogEnrollmentResponse>> response = restTemplate.exchange(
                    url,
                    HttpMethod.GET,
                    null,
                    new ParameterizedTypeReference<List<CatalogEnrollmentResponse>>() {}
            );
            List<CatalogEnrollmentResponse> body = response.getBody();
            if (body == null) {
                return Collections.emptyList();
            }
            return body.stream()
                    .map(CatalogEnrollmentResponse::toEnrollment)
                    .filter(CourseEnrollment::isActive)
                    .toList();
        } catch (RestClientException e) {
            log.error("Catalog 활성 수강 목록 조회 실패: userId={}, error={}", userId, e.getMessage());
            throw new CatalogClientException("Failed to fetch active enrollments of user " + userId, e);
        }
    }

    @Override
    public Long enroll(Long userId, Long courseId) {
        String url = baseUrl() + "/users/" + userId + "/enrollments";

        EnrollResponse response;
        try {
            response = restTemplate.postForObject(url, new EnrollRequest(courseId), EnrollResponse.class);
        } catch (RestClientException e) {
            log.error("Catalog 수강 등록 생성 실패: userId={}, courseId={}, error={}",
                    userId, courseId, e.getMessage());
            throw new CatalogClientException("Failed to enroll user " + userId + " in course " + courseId, e);
        }

        if (response == null || response.getEnrollmentId() == null) {
            throw new CatalogClientException(
                    "Catalog returned no enrollment id: userId=" + userId + ", courseId=" + courseId, null);
        }
        log.debug("Catalog 수강 등록 생성: userId={}, courseId={}, enrollmentId={}",
                userId, courseId, response.getEnrollmentId());
        return response.getEnrollmentId();
    }

    @Override
    public void changeEnrollmentStatus(Long enrollmentId, EnrollmentStatus status) {
        String url = baseUrl() + "/enrollments/" + enrollmentId + "/status";

        try {
            restTemplate.put(url, new EnrollmentStatusRequest(status.toWireValue()));
        } catch (RestClientException e) {
            log.error("Catalog 수강 상태 변경 실패: enrollmentId={}, status={}, error={}",
                    enrollmentId, status, e.getMessage());
            throw new CatalogClientException("Failed to change status of enrollment " + enrollmentId, e);
        }
    }

    @Override
    public void cancelEnrollment(Long userId, Long courseId) {
        String url = baseUrl() + "/users/" + userId + "/enrollments/" + courseId;

        try {
            restTemplate.delete(url);
        } catch (RestClientException e) {
            log.error("Catalog 수강 취소 실패: userId={}, courseId={}, error={}",
                    userId, courseId, e.getMessage());
            throw new CatalogClientException("Failed to cancel enrollment of user " + userId, e);
        }
    }

    @Override
    public void tagEnrollment(Long enrollmentId, EnrollmentAttribution attribution) {
        String url = baseUrl() + "/enrollments/" + enrollmentId + "/attribution";

        try {
            restTemplate.put(url, EnrollmentAttributionRequest.from(attribution));
        } catch (RestClientException e) {
            log.error("Catalog 수강 출처 기록 실패: enrollmentId={}, error={}", enrollmentId, e.getMessage());
            throw new CatalogClientException("Failed to tag enrollment " + enrollmentId, e);
        }
    }

    @Override
    public List<Long> findBundleCourseIds(Long bundleId) {
        String url = baseUrl() + "/bundles/" + bundleId + "/courses";

        try {
            ResponseEntity<List<Long>> response = restTemplate.exchange(
                    url,
                    HttpMethod.GET,
                    null,
                    new ParameterizedTypeReference<List<Long>>() {}
            );
            List<Long> courseIds = response.getBody();
            return courseIds != null ? courseIds : Collections.emptyList();
        } catch (HttpClientErrorException.NotFound e) {
            return Collections.emptyList();
        } catch (RestClientException e) {
            log.error("Catalog 번들 구성 조회 실패: bundleId={}, error={}", bundleId, e.getMessage());
            throw new CatalogClientException("Failed to fetch courses of bundle " + bundleId, e);
        }
    }

    private String baseUrl() {
        String baseUrl = properties.getCatalog().getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + INTERNAL_PATH;
    }
}
