package com.my.bridge.adapter.in.rabbitmq;

import com.my.bridge.domain.exception.NotFoundException;
import com.my.bridge.domain.exception.PermissionDeniedException;
import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.exception.TransportException;
import com.my.bridge.domain.exception.ValidationError;
import com.my.bridge.domain.exception.ValidationException;
import com.my.bridge.domain.model.Actor;
import com.my.bridge.domain.model.BridgeLimits;
import com.my.bridge.domain.model.CommandReply;
import com.my.bridge.domain.model.CommandReply.ReplyStatus;
import com.my.bridge.domain.model.ConfirmationState;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.PendingConfirmation;
import com.my.bridge.domain.port.in.ConfirmationUseCase;
import com.my.bridge.domain.port.in.ConnectionAdminUseCase;
import com.my.bridge.domain.port.in.RetentionUseCase;
import com.my.bridge.domain.port.in.ServerSettingsUseCase;
import com.my.bridge.domain.port.in.StatsUseCase;
import com.my.bridge.domain.port.out.ChatGatewayPort;
import com.my.bridge.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * 왜: 파싱된 관리 명령을 유스케이스로 보내고, 결과와 도메인 예외를 구조화된 응답 코드로 바꾸는 한 곳이 필요하기 때문.
 * 확인이 필요한 명령은 대기 응답을 먼저 보내고 최종 결과를 나중에 한 번 더 보낸다.
 */
@ApplicationScoped
public class CommandDispatcher {

    private static final Logger log = Logger.getLogger(CommandDispatcher.class);

    private final ConnectionAdminUseCase connectionAdmin;
    private final ServerSettingsUseCase serverSettings;
    private final StatsUseCase stats;
    private final RetentionUseCase retention;
    private final ConfirmationUseCase confirmations;
    private final ChatGatewayPort gateway;
    private final ReplyPort replyPort;
    private final BridgeLimits limits;

    @Inject
    public CommandDispatcher(ConnectionAdminUseCase connectionAdmin,
                             ServerSettingsUseCase serverSettings,
                             StatsUseCase stats,
                             RetentionUseCase retention,
                             ConfirmationUseCase confirmations,
                             ChatGatewayPort gateway,
                             ReplyPort replyPort,
                             BridgeLimits limits) {
        this.connectionAdmin = connectionAdmin;
        this.serverSettings = serverSettings;
        this.stats = stats;
        this.retention = retention;
        this.confirmations = confirmations;
        this.gateway = gateway;
        this.replyPort = replyPort;
        this.limits = limits;
    }

    public void dispatch(CommandRequest request) {
        try {
            CommandType type = CommandType.parse(request.command()).orElse(null);
            if (type == null) {
                reply(request, ReplyStatus.ERROR, "UNKNOWN_COMMAND", "알 수 없는 명령입니다: " + request.command(), Map.of());
                return;
            }
            Actor actor = request.actor();
            if (!type.permits(actor)) {
                throw new PermissionDeniedException("이 명령을 실행할 권한이 없습니다: " + type);
            }
            handle(type, request, actor);
        } catch (ValidationException e) {
            reply(request, ReplyStatus.ERROR, e.error().name(), e.getMessage(), Map.of());
        } catch (NotFoundException e) {
            reply(request, ReplyStatus.ERROR, "NOT_FOUND", e.getMessage(), Map.of());
        } catch (PermissionDeniedException e) {
            Map<String, Object> data = e.missing().isEmpty()
                    ? Map.of()
                    : Map.of("missing", e.missing().stream().map(Enum::name).sorted().toList());
            reply(request, ReplyStatus.ERROR, "PERMISSION_DENIED", e.getMessage(), data);
        } catch (TransportException e) {
            log.warnf("명령 처리 중 게이트웨이 오류: %s", e.getMessage());
            reply(request, ReplyStatus.ERROR, "TRANSPORT_ERROR", e.getMessage(), Map.of());
        } catch (StorageException e) {
            log.errorf(e, "명령 처리 중 저장소 오류: %s", request.requestId());
            reply(request, ReplyStatus.ERROR, "STORAGE_ERROR", "저장소 오류가 발생했습니다.", Map.of());
        } catch (RuntimeException e) {
            log.errorf(e, "명령 처리 중 예상치 못한 오류: %s", request.requestId());
            reply(request, ReplyStatus.ERROR, "INTERNAL_ERROR", "명령 처리 중 오류가 발생했습니다.", Map.of());
        } finally {
            autoDeleteCommand(request);
        }
    }

    private void handle(CommandType type, CommandRequest request, Actor actor) {
        switch (type) {
            case CONNECT_CREATE -> {
                Connection created = connectionAdmin.create(actor, request.longArg("targetChannelId"), request.requireArg("name"));
                ok(request, "CONNECTION_CREATED", "연결이 생성되었습니다: " + created.name(), ReplyViews.connection(created));
            }
            case CONNECT_LIST -> ok(request, "CONNECTION_LIST", "연결 목록",
                    ReplyViews.page(connectionAdmin.list(actor, request.intArg("page", 1))));
            case CONNECT_INFO -> ok(request, "CONNECTION_INFO", "연결 정보",
                    ReplyViews.details(connectionAdmin.info(actor, request.longArg("connectionId"))));
            case CONNECT_TEST -> ok(request, "CONNECTION_TEST", "연결 점검 결과",
                    ReplyViews.diagnostics(connectionAdmin.test(actor, request.longArg("connectionId"))));
            case CONNECT_REMOVE -> {
                ConnectionAdminUseCase.Removal removal = connectionAdmin.requestRemoval(actor, request.longArg("connectionId"));
                awaitConfirmation(request, removal.confirmation(), removal.result(),
                        result -> result.removed()
                                ? new Outcome("CONNECTION_REMOVED", "연결이 삭제되었습니다: " + result.connection().name(),
                                        Map.of("connectionId", result.connection().id()))
                                : new Outcome("CONNECTION_ALREADY_REMOVED", "이미 삭제된 연결입니다.",
                                        Map.of("connectionId", result.connection().id())),
                        result -> result.state());
            }
            case SETTINGS_SHOW -> ok(request, "SETTINGS", "서버 설정",
                    ReplyViews.settings(serverSettings.get(actor.guildId())));
            case SETTINGS_SET -> ok(request, "SETTINGS_UPDATED", "설정이 변경되었습니다.",
                    ReplyViews.settings(serverSettings.update(actor.guildId(), request.requireArg("setting"), request.requireArg("value"))));
            case STATS -> ok(request, "BOT_STATS", "봇 통계", ReplyViews.botStats(stats.botStats()));
            case SERVER_STATS -> ok(request, "SERVER_STATS", "서버 통계", ReplyViews.serverStats(stats.serverStats(actor.guildId())));
            case CLEANUP -> {
                RetentionUseCase.Cleanup cleanup = retention.requestCleanup(actor, request.intArg("days", 30));
                awaitConfirmation(request, cleanup.confirmation(), cleanup.result(),
                        result -> new Outcome("CLEANUP_DONE", result.deletedRows() + "건의 오래된 기록을 정리했습니다.",
                                Map.of("days", result.days(), "deletedRows", result.deletedRows())),
                        result -> result.state());
            }
            case CONFIRM -> {
                boolean approved = parseDecision(request.requireArg("decision"));
                confirmations.respond(request.requireArg("confirmationId"), actor.userId(), approved);
                ok(request, "CONFIRMATION_RECEIVED", approved ? "승인했습니다." : "거절했습니다.", Map.of());
            }
        }
    }

    private <R> void awaitConfirmation(CommandRequest request,
                                       PendingConfirmation pending,
                                       CompletionStage<R> result,
                                       Function<R, Outcome> onConfirmed,
                                       Function<R, ConfirmationState> stateOf) {
        reply(request, ReplyStatus.AWAITING_CONFIRMATION, "CONFIRMATION_REQUIRED", "확인이 필요합니다.",
                Map.of("confirmationId", pending.id(),
                        "subject", pending.subject(),
                        "timeoutSeconds", limits.confirmationTimeout().toSeconds()));
        result.whenComplete((value, error) -> {
            try {
                if (error != null) {
                    log.errorf(error, "확인 후 작업 실패: %s", pending.subject());
                    reply(request, ReplyStatus.ERROR, "CONFIRMED_ACTION_FAILED", "확인 후 작업에 실패했습니다.", Map.of());
                    return;
                }
                switch (stateOf.apply(value)) {
                    case CONFIRMED -> {
                        Outcome outcome = onConfirmed.apply(value);
                        reply(request, ReplyStatus.OK, outcome.code(), outcome.message(), outcome.data());
                    }
                    case DECLINED -> reply(request, ReplyStatus.CANCELLED, "CANCELLED", "취소되었습니다.", Map.of());
                    default -> reply(request, ReplyStatus.EXPIRED, "EXPIRED", "확인 시간이 초과되었습니다.", Map.of());
                }
            } catch (RuntimeException e) {
                log.errorf(e, "확인 결과 응답 전송 실패: %s", pending.subject());
            }
        });
    }

    private static boolean parseDecision(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (Set.of("yes", "y", "true", "approve", "confirm").contains(value)) {
            return true;
        }
        if (Set.of("no", "n", "false", "decline", "cancel").contains(value)) {
            return false;
        }
        throw new ValidationException(ValidationError.INVALID_ARGUMENT,
                "decision은 yes 또는 no 여야 합니다: " + raw);
    }

    private void autoDeleteCommand(CommandRequest request) {
        if (request.messageId() == null) {
            return;
        }
        try {
            if (serverSettings.get(request.guildId()).autoDeleteCommands()) {
                gateway.deleteMessage(request.channelId(), request.messageId());
            }
        } catch (RuntimeException e) {
            log.debugf("명령 메시지 자동 삭제 실패: %s", e.getMessage());
        }
    }

    private void ok(CommandRequest request, String code, String message, Map<String, Object> data) {
        reply(request, ReplyStatus.OK, code, message, data);
    }

    private void reply(CommandRequest request, ReplyStatus status, String code, String message, Map<String, Object> data) {
        replyPort.send(new CommandReply(request.requestId(), request.channelId(), status, code, message, data));
    }

    private record Outcome(String code, String message, Map<String, Object> data) {
    }
}
