package com.my.bridge.domain.exception;

/**
 * 왜: 플랫폼 API/네트워크 실패를 도메인에서 한 종류로 다뤄 연결 단위로 포기하고 다음으로 넘어가기 위함.
 */
public class TransportException extends RuntimeException {

    private final int statusCode;

    public TransportException(String message) {
        this(message, -1, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
