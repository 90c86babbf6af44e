package com.my.bridge.domain.exception;

/**
 * 왜: 없는 연결이나 이미 끝난 확인 절차를 참조했을 때 검증 실패와 구분해 알리기 위함.
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }
}
