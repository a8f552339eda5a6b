package com.levelsync.enrollment.common.capability;

/**
 * 외부 연동 기능의 가용 여부
 * 모든 진입점은 처리 전에 확인하고, 사용할 수 없으면 아무 것도 하지 않는다.
 */
public interface Capabilities {

    /**
     * Course Catalog의 조회/수강 등록 API를 사용할 수 있는지
     */
    boolean courseCatalogAvailable();

    /**
     * 번들(과목 묶음) 애드온이 활성화되어 있는지
     */
    boolean bundleAddonAvailable();
}
