package com.my.bridge.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    RelayConfig relay();

    SpamConfig spam();

    ConnectionsConfig connections();

    FilterConfig filter();

    RetentionConfig retention();

    ConfirmationConfig confirmation();

    DatabaseConfig database();

    IdempotencyConfig idempotency();

    DiscordConfig discord();

    interface RelayConfig {
        @WithName("command-prefix")
        @WithDefault("!")
        String commandPrefix();

        @WithName("max-file-size")
        @WithDefault("8388608")
        long maxFileSize();

        @WithName("max-attachments")
        @WithDefault("10")
        int maxAttachments();

        @WithName("max-message-length")
        @WithDefault("2000")
        int maxMessageLength();
    }

    interface SpamConfig {
        @WithDefault("5")
        int threshold();

        @WithName("window-seconds")
        @WithDefault("10")
        int windowSeconds();

        @WithName("backend")
        @WithDefault("sqlite")
        String backend();
    }

    interface ConnectionsConfig {
        @WithName("max-per-server")
        @WithDefault("10")
        int maxPerServer();
    }

    interface FilterConfig {
        @WithName("blocked-domains")
        @WithDefault("bit.ly,tinyurl.com,grabify.link,iplogger.org,2no.co,cutt.ly,discord.gift,discordnitro.info,"
                + "discord-nitro.org,discordgift.site,steamcommunity-net.org,steemcommunity.org,stemcommunity.org,"
                + "iplogger.com,iplogger.net,yip.su,iplis.ru,iplogger.co,ip-api.io,bmwforum.co,leancoding.co,"
                + "quickmessage.io,spottyfly.com")
        List<String> blockedDomains();

        @WithName("profanity-words")
        Optional<List<String>> profanityWords();

        @WithName("mass-mention-threshold")
        @WithDefault("3")
        int massMentionThreshold();
    }

    interface RetentionConfig {
        @WithDefault("30")
        int days();

        @WithName("min-days")
        @WithDefault("7")
        int minDays();

        @WithName("sweep-interval-hours")
        @WithDefault("24")
        int sweepIntervalHours();
    }

    interface ConfirmationConfig {
        @WithName("timeout-seconds")
        @WithDefault("30")
        int timeoutSeconds();
    }

    interface DatabaseConfig {
        @WithDefault("./data/bridge.db")
        String path();

        @WithName("busy-timeout-ms")
        @WithDefault("5000")
        int busyTimeoutMs();
    }

    interface IdempotencyConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }

    interface DiscordConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("api-base")
        @WithDefault("https://discord.com/api/v10")
        String apiBase();

        @WithName("request-timeout-seconds")
        @WithDefault("10")
        int requestTimeoutSeconds();
    }
}
