package com.my.bridge.config;

import com.my.bridge.adapter.out.clock.SystemClockAdapter;
import com.my.bridge.adapter.out.signal.InMemorySignalAwaiter;
import com.my.bridge.domain.model.BridgeLimits;
import com.my.bridge.domain.model.ConfirmationSignal;
import com.my.bridge.domain.model.FilterRules;
import com.my.bridge.domain.port.in.ConnectionAdminUseCase;
import com.my.bridge.domain.port.in.GuildLifecycleUseCase;
import com.my.bridge.domain.port.in.RelayMessageUseCase;
import com.my.bridge.domain.port.in.RetentionUseCase;
import com.my.bridge.domain.port.in.ServerSettingsUseCase;
import com.my.bridge.domain.port.in.StatsUseCase;
import com.my.bridge.domain.port.out.ChatGatewayPort;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.ConnectionRepository;
import com.my.bridge.domain.port.out.MessageLogRepository;
import com.my.bridge.domain.port.out.RuntimeMetricsPort;
import com.my.bridge.domain.port.out.ServerSettingsRepository;
import com.my.bridge.domain.port.out.SpamTrackingRepository;
import com.my.bridge.domain.service.AbuseTracker;
import com.my.bridge.domain.service.ConfirmationService;
import com.my.bridge.domain.service.ConnectionAdminService;
import com.my.bridge.domain.service.ConnectionRegistry;
import com.my.bridge.domain.service.ContentFilter;
import com.my.bridge.domain.service.GuildLifecycleService;
import com.my.bridge.domain.service.RelayService;
import com.my.bridge.domain.service.RetentionService;
import com.my.bridge.domain.service.ServerSettingsService;
import com.my.bridge.domain.service.StatsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 * 설정 값은 여기서 한 번 레코드로 바꿔 각 서비스에 넘긴다.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @Singleton
    public BridgeLimits bridgeLimits(AppConfig appConfig) {
        return new BridgeLimits(
                appConfig.relay().commandPrefix(),
                appConfig.spam().threshold(),
                Duration.ofSeconds(appConfig.spam().windowSeconds()),
                appConfig.connections().maxPerServer(),
                appConfig.relay().maxFileSize(),
                appConfig.relay().maxAttachments(),
                appConfig.relay().maxMessageLength(),
                appConfig.retention().minDays(),
                Duration.ofSeconds(appConfig.confirmation().timeoutSeconds()));
    }

    @Produces
    @Singleton
    public FilterRules filterRules(AppConfig appConfig) {
        AppConfig.FilterConfig filter = appConfig.filter();
        return new FilterRules(Set.copyOf(filter.blockedDomains()),
                filter.profanityWords().orElse(List.of()),
                filter.massMentionThreshold());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }

    @Produces
    @Singleton
    public ContentFilter contentFilter(FilterRules rules) {
        return new ContentFilter(rules);
    }

    @Produces
    @Singleton
    public AbuseTracker abuseTracker(SpamTrackingRepository repository, ClockPort clockPort, BridgeLimits limits) {
        return new AbuseTracker(repository, clockPort, limits.spamThreshold(), limits.spamWindow());
    }

    @Produces
    @Singleton
    public ConnectionRegistry connectionRegistry(ConnectionRepository repository, ClockPort clockPort, BridgeLimits limits) {
        return new ConnectionRegistry(repository, clockPort, limits.maxConnectionsPerServer());
    }

    @Produces
    @Singleton
    public ConfirmationService confirmationService(BridgeLimits limits) {
        return new ConfirmationService(new InMemorySignalAwaiter<ConfirmationSignal>(), limits.confirmationTimeout());
    }

    @Produces
    @ApplicationScoped
    public ServerSettingsUseCase serverSettingsUseCase(ServerSettingsRepository repository, ClockPort clockPort) {
        return new ServerSettingsService(repository, clockPort);
    }

    @Produces
    @ApplicationScoped
    public RelayMessageUseCase relayMessageUseCase(ServerSettingsUseCase serverSettings,
                                                   AbuseTracker abuseTracker,
                                                   ConnectionRegistry connectionRegistry,
                                                   ContentFilter contentFilter,
                                                   ChatGatewayPort gateway,
                                                   MessageLogRepository messageLog,
                                                   ClockPort clockPort,
                                                   BridgeLimits limits) {
        return new RelayService(serverSettings, abuseTracker, connectionRegistry, contentFilter,
                gateway, messageLog, clockPort, limits);
    }

    @Produces
    @ApplicationScoped
    public ConnectionAdminUseCase connectionAdminUseCase(ConnectionRegistry registry,
                                                         ServerSettingsUseCase serverSettings,
                                                         MessageLogRepository messageLog,
                                                         ConfirmationService confirmations,
                                                         ChatGatewayPort gateway,
                                                         ClockPort clockPort) {
        return new ConnectionAdminService(registry, serverSettings, messageLog, confirmations, gateway, clockPort);
    }

    @Produces
    @ApplicationScoped
    public StatsUseCase statsUseCase(ConnectionRepository connections,
                                     MessageLogRepository messageLog,
                                     ServerSettingsRepository settings,
                                     RuntimeMetricsPort runtimeMetrics,
                                     ClockPort clockPort,
                                     BridgeLimits limits) {
        return new StatsService(connections, messageLog, settings, runtimeMetrics, clockPort, limits.maxConnectionsPerServer());
    }

    @Produces
    @ApplicationScoped
    public RetentionUseCase retentionUseCase(SpamTrackingRepository spamTracking,
                                             ConfirmationService confirmations,
                                             ClockPort clockPort,
                                             BridgeLimits limits) {
        return new RetentionService(spamTracking, confirmations, clockPort, limits.minRetentionDays());
    }

    @Produces
    @ApplicationScoped
    public GuildLifecycleUseCase guildLifecycleUseCase(ServerSettingsUseCase serverSettings, ConnectionRegistry registry) {
        return new GuildLifecycleService(serverSettings, registry);
    }
}
