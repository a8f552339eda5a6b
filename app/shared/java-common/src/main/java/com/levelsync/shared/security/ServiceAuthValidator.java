package com.levelsync.shared.security;

import com.levelsync.shared.security.exception.UnauthorizedException;

import java.util.Map;

/**
 * 내부 API(/internal/**) 호출의 X-Api-Key를 검증하고 호출 서비스를 식별한다.
 *
 * 현재 호출자:
 * - membership-billing: 관리자 해지 전달 (주로 POST .../cancellations)
 * - operations: 운영 복구 (주로 POST .../reconciliations)
 *
 * 호출자별 Key는 membership-sync.internal-api-keys 설정에서 읽는다.
 * 반환된 호출자 이름은 요청 로그에 남긴다.
 */
public class ServiceAuthValidator {

    private final Map<String, String> callersByApiKey;

    /**
     * @param callersByApiKey API Key → 호출 서비스 이름
     */
    public ServiceAuthValidator(Map<String, String> callersByApiKey) {
        this.callersByApiKey = Map.copyOf(callersByApiKey);
    }

    /**
     * API Key를 검증하고 호출 서비스 이름을 반환한다.
     *
     * @throws UnauthorizedException API Key가 비어 있거나 등록되지 않은 경우
     */
    public String validateAndGetCaller(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new UnauthorizedException("API Key is required");
        }

        String caller = callersByApiKey.get(apiKey);
        if (caller == null) {
            throw new UnauthorizedException("Invalid API Key");
        }
        return caller;
    }
}
