package com.my.bridge.adapter.in.rabbitmq;

import com.my.bridge.domain.model.BotStats;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.ConnectionDetails;
import com.my.bridge.domain.model.ConnectionDiagnostics;
import com.my.bridge.domain.model.ConnectionPage;
import com.my.bridge.domain.model.MessageStats;
import com.my.bridge.domain.model.ServerSettings;
import com.my.bridge.domain.model.ServerStats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 왜: 응답 data 필드를 표현 계층이 그리기 쉬운 평평한 맵으로 만든다. 값이 null인 항목은 넣지 않는다.
 */
final class ReplyViews {

    private ReplyViews() {
    }

    static Map<String, Object> connection(Connection connection) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", connection.id());
        view.put("name", connection.name());
        view.put("server1Id", connection.server1Id());
        view.put("channel1Id", connection.channel1Id());
        view.put("server2Id", connection.server2Id());
        view.put("channel2Id", connection.channel2Id());
        view.put("createdBy", connection.createdBy());
        putIfPresent(view, "description", connection.description());
        view.put("createdAt", connection.createdAt().toString());
        view.put("active", connection.active());
        return view;
    }

    static Map<String, Object> page(ConnectionPage page) {
        List<Map<String, Object>> items = page.items().stream().map(ReplyViews::connection).toList();
        return Map.of(
                "items", items,
                "page", page.page(),
                "totalPages", page.totalPages(),
                "totalItems", page.totalItems());
    }

    static Map<String, Object> details(ConnectionDetails details) {
        Map<String, Object> view = connection(details.connection());
        view.put("lastWeek", stats(details.lastWeek()));
        return view;
    }

    static Map<String, Object> diagnostics(ConnectionDiagnostics diagnostics) {
        return Map.of(
                "connection", connection(diagnostics.connection()),
                "channels", diagnostics.channels().name(),
                "permissions", diagnostics.permissions().name(),
                "settings", diagnostics.settings().name(),
                "state", diagnostics.state().name(),
                "healthy", diagnostics.healthy());
    }

    static Map<String, Object> settings(ServerSettings settings) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("serverId", settings.serverId());
        putIfPresent(view, "prefix", settings.prefix());
        view.put("enabled", settings.enabled());
        putIfPresent(view, "modRoleId", settings.modRoleId());
        putIfPresent(view, "logChannelId", settings.logChannelId());
        view.put("spamProtection", settings.spamProtection());
        view.put("profanityFilter", settings.profanityFilter());
        view.put("autoDeleteCommands", settings.autoDeleteCommands());
        view.put("webhookNotifications", settings.webhookNotifications());
        view.put("updatedAt", settings.updatedAt().toString());
        return view;
    }

    static Map<String, Object> stats(MessageStats stats) {
        return Map.of(
                "totalMessages", stats.totalMessages(),
                "uniqueUsers", stats.uniqueUsers(),
                "activeConnections", stats.activeConnections());
    }

    static Map<String, Object> botStats(BotStats stats) {
        return Map.of(
                "activeConnections", stats.database().activeConnections(),
                "totalMessages", stats.database().totalMessages(),
                "totalServers", stats.database().totalServers(),
                "lastWeek", stats(stats.lastWeek()),
                "usedMemoryMb", stats.process().usedMemoryMb(),
                "maxMemoryMb", stats.process().maxMemoryMb(),
                "liveThreads", stats.process().liveThreads(),
                "availableProcessors", stats.process().availableProcessors(),
                "uptimeSeconds", stats.process().uptime().toSeconds());
    }

    static Map<String, Object> serverStats(ServerStats stats) {
        List<Map<String, Object>> top = stats.topConnections().stream()
                .map(activity -> Map.<String, Object>of(
                        "id", activity.connection().id(),
                        "name", activity.connection().name(),
                        "messagesLastWeek", activity.messages()))
                .toList();
        return Map.of(
                "serverId", stats.serverId(),
                "activeConnections", stats.activeConnections(),
                "connectionLimit", stats.connectionLimit(),
                "freeSlots", stats.freeSlots(),
                "messagesLastMonth", stats.messagesLastMonth(),
                "topConnections", top);
    }

    private static void putIfPresent(Map<String, Object> view, String key, Object value) {
        if (value != null) {
            view.put(key, value);
        }
    }
}
