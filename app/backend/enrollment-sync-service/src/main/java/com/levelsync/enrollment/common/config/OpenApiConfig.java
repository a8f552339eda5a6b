package com.levelsync.enrollment.common.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 설정
 * 운영자용 내부 API만 노출한다.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Enrollment Sync Service Internal API")
                        .version("1.0.0")
                        .description("멤버십 레벨 기반 수강 등록 재동기화 및 수동 해지 API\n\n"
                                + "**인증**: 서비스별로 발급된 API Key를 `X-Api-Key` 헤더로 전송합니다."))
                .addSecurityItem(new SecurityRequirement().addList("API Key"))
                .components(new Components()
                        .addSecuritySchemes("API Key",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name("X-Api-Key")));
    }
}
