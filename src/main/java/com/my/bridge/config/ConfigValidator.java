package com.my.bridge.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.configuration.ProfileManager;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = "prod".equals(ProfileManager.getActiveProfile());
        validateRequired("DISCORD_TOKEN", appConfig.discord().botToken().orElse(null), isProd);
        validateRange("app.spam.threshold", appConfig.spam().threshold(), 1);
        validateRange("app.spam.window-seconds", appConfig.spam().windowSeconds(), 1);
        validateRange("app.connections.max-per-server", appConfig.connections().maxPerServer(), 1);
        validateRange("app.relay.max-message-length", appConfig.relay().maxMessageLength(), 4);
        validateRange("app.retention.days", appConfig.retention().days(), appConfig.retention().minDays());
        validateRange("app.retention.sweep-interval-hours", appConfig.retention().sweepIntervalHours(), 1);
        validateRange("app.confirmation.timeout-seconds", appConfig.confirmation().timeoutSeconds(), 1);
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validateRange(String name, long value, long min) {
        if (value < min) {
            throw new IllegalStateException("설정 값이 최소값보다 작습니다: " + name + "=" + value + " (최소 " + min + ")");
        }
    }
}
