package com.levelsync.shared.security.exception;

/**
 * 내부 API 호출 시 API Key가 없거나 등록되지 않은 경우의 예외
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
