package com.my.bridge.domain.model;

/**
 * 왜: 연결 점검 결과(채널 도달 가능성, 권한, 양쪽 서버 설정, 활성 여부)를 항목별로 돌려주기 위함.
 */
public record ConnectionDiagnostics(Connection connection,
                                    DiagnosticStatus channels,
                                    DiagnosticStatus permissions,
                                    DiagnosticStatus settings,
                                    DiagnosticStatus state) {

    public boolean healthy() {
        return channels == DiagnosticStatus.OK
                && permissions == DiagnosticStatus.OK
                && settings == DiagnosticStatus.OK
                && state == DiagnosticStatus.OK;
    }
}
