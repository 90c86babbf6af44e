package com.my.bridge.domain.port.in;

import com.my.bridge.domain.model.Actor;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.ConnectionDetails;
import com.my.bridge.domain.model.ConnectionDiagnostics;
import com.my.bridge.domain.model.ConnectionPage;
import com.my.bridge.domain.model.PendingConfirmation;
import com.my.bridge.domain.model.RemovalResult;

import java.util.concurrent.CompletionStage;

/**
 * 왜: 명령 계층이 연결 생성/조회/삭제/점검을 호출하는 계약을 한 곳에 모으기 위함.
 */
public interface ConnectionAdminUseCase {

    Connection create(Actor actor, long targetChannelId, String name);

    ConnectionPage list(Actor actor, int page);

    ConnectionDetails info(Actor actor, long connectionId);

    ConnectionDiagnostics test(Actor actor, long connectionId);

    Removal requestRemoval(Actor actor, long connectionId);

    record Removal(PendingConfirmation confirmation, CompletionStage<RemovalResult> result) {
    }
}
