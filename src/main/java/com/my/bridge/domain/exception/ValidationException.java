package com.my.bridge.domain.exception;

/**
 * 왜: 호출자 입력이 규칙을 어겼을 때(자기 서버 연결, 중복, 한도 초과 등) 재시도 없이 호출자에게 원인을 알리기 위함.
 */
public class ValidationException extends RuntimeException {

    private final ValidationError error;

    public ValidationException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}
