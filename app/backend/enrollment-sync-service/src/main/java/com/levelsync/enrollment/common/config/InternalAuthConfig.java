package com.levelsync.enrollment.common.config;

import com.levelsync.shared.security.ServiceAuthValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * 내부 API 인증 설정
 */
@Configuration
public class InternalAuthConfig {

    @Bean
    public ServiceAuthValidator serviceAuthValidator(MembershipSyncProperties properties) {
        Map<String, String> callersByApiKey = new HashMap<>();
        properties.getInternalApiKeys().forEach((caller, apiKey) -> {
            if (StringUtils.hasText(apiKey)) {
                callersByApiKey.put(apiKey, caller);
            }
        });
        return new ServiceAuthValidator(callersByApiKey);
    }
}
