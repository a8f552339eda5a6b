package com.levelsync.enrollment.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * 멤버십-수강 동기화 설정 프로퍼티
 *
 * application.yml의 membership-sync 설정을 바인딩한다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "membership-sync")
public class MembershipSyncProperties {

    private Catalog catalog = new Catalog();

    private Bundle bundle = new Bundle();

    /**
     * 멤버십 전용 모드
     * 켜져 있으면 모든 수강 등록을 멤버십 등록으로 기록한다.
     * 환경 변수: MEMBERSHIP_ONLY_MODE
     */
    private boolean membershipOnlyMode = false;

    /**
     * 내부 API 호출 서비스 이름 → API Key
     * 환경 변수: BILLING_API_KEY, OPS_API_KEY
     */
    private Map<String, String> internalApiKeys = new HashMap<>();

    @Getter
    @Setter
    public static class Catalog {

        /**
         * Course Catalog 연동 여부
         * 환경 변수: CATALOG_ENABLED
         */
        private boolean enabled = true;

        /**
         * Course Catalog Internal API 주소 (예: http://course-catalog:8080)
         * 환경 변수: CATALOG_BASE_URL
         */
        private String baseUrl;
    }

    @Getter
    @Setter
    public static class Bundle {

        /**
         * 번들(과목 묶음) 애드온 사용 여부
         * 환경 변수: BUNDLE_ENABLED
         */
        private boolean enabled = false;
    }
}
