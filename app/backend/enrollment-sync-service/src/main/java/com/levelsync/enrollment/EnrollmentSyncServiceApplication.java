package com.levelsync.enrollment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Enrollment Sync Service Application
 * 멤버십 레벨 변경에 맞춰 과목 수강 등록을 동기화하는 서비스
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EnrollmentSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnrollmentSyncServiceApplication.class, args);
    }
}
