package com.my.bridge.domain.exception;

/**
 * 왜: 브로커로 들어온 이벤트/명령이 계약을 위반했을 때 처리 전에 명확히 실패를 알리기 위함.
 */
public class InvalidPayloadException extends RuntimeException {
    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
