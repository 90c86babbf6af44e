package com.my.bridge.domain.port.in;

/**
 * 왜: 확인 절차에 대한 사용자 응답(승인/거절)을 도메인으로 전달하는 진입점.
 */
public interface ConfirmationUseCase {

    void respond(String confirmationId, long userId, boolean approved);
}
