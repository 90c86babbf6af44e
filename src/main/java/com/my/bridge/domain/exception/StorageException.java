package com.my.bridge.domain.exception;

/**
 * 왜: 저장소 접근 실패를 SQL 세부사항 없이 상위로 올려, 중계를 중단(fail-closed)하게 하기 위함.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
