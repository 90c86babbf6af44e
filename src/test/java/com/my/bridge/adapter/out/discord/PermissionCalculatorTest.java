package com.my.bridge.adapter.out.discord;

import com.my.bridge.domain.model.ChannelCapability;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.my.bridge.adapter.out.discord.PermissionCalculator.ATTACH_FILES;
import static com.my.bridge.adapter.out.discord.PermissionCalculator.EMBED_LINKS;
import static com.my.bridge.adapter.out.discord.PermissionCalculator.MEMBER_OVERWRITE;
import static com.my.bridge.adapter.out.discord.PermissionCalculator.READ_MESSAGE_HISTORY;
import static com.my.bridge.adapter.out.discord.PermissionCalculator.ROLE_OVERWRITE;
import static com.my.bridge.adapter.out.discord.PermissionCalculator.SEND_MESSAGES;
import static com.my.bridge.adapter.out.discord.PermissionCalculator.VIEW_CHANNEL;
import static org.assertj.core.api.Assertions.assertThat;

class PermissionCalculatorTest {

    private static final long GUILD = 100L;
    private static final long OWNER = 1L;
    private static final long BOT = 2L;
    private static final long BOT_ROLE = 300L;

    private static final long EVERYDAY = VIEW_CHANNEL | SEND_MESSAGES | EMBED_LINKS | ATTACH_FILES | READ_MESSAGE_HISTORY;

    @Test
    void owner_gets_everything() {
        long permissions = PermissionCalculator.compute(GUILD, OWNER, OWNER, List.of(), Map.of(), List.of());

        assertThat(PermissionCalculator.toCapabilities(permissions)).containsExactlyInAnyOrder(ChannelCapability.values());
    }

    @Test
    void administrator_role_ignores_channel_denies() {
        long permissions = PermissionCalculator.compute(GUILD, OWNER, BOT, List.of(BOT_ROLE),
                Map.of(GUILD, 0L, BOT_ROLE, PermissionCalculator.ADMINISTRATOR),
                List.of(new PermissionCalculator.Overwrite(GUILD, ROLE_OVERWRITE, 0, EVERYDAY)));

        assertThat(permissions).isEqualTo(PermissionCalculator.ALL);
    }

    @Test
    void role_overwrite_beats_everyone_overwrite() {
        long permissions = PermissionCalculator.compute(GUILD, OWNER, BOT, List.of(BOT_ROLE),
                Map.of(GUILD, EVERYDAY),
                List.of(new PermissionCalculator.Overwrite(GUILD, ROLE_OVERWRITE, 0, SEND_MESSAGES | ATTACH_FILES),
                        new PermissionCalculator.Overwrite(BOT_ROLE, ROLE_OVERWRITE, SEND_MESSAGES, 0)));

        assertThat(PermissionCalculator.toCapabilities(permissions)).containsExactlyInAnyOrder(
                ChannelCapability.VIEW_CHANNEL, ChannelCapability.SEND_MESSAGES,
                ChannelCapability.EMBED_LINKS, ChannelCapability.READ_MESSAGE_HISTORY);
    }

    @Test
    void member_overwrite_applies_last() {
        long permissions = PermissionCalculator.compute(GUILD, OWNER, BOT, List.of(BOT_ROLE),
                Map.of(GUILD, EVERYDAY),
                List.of(new PermissionCalculator.Overwrite(BOT_ROLE, ROLE_OVERWRITE, EMBED_LINKS, 0),
                        new PermissionCalculator.Overwrite(BOT, MEMBER_OVERWRITE, 0, EMBED_LINKS)));

        assertThat(PermissionCalculator.toCapabilities(permissions)).doesNotContain(ChannelCapability.EMBED_LINKS);
    }

    @Test
    void overwrites_for_roles_the_bot_lacks_are_ignored() {
        long permissions = PermissionCalculator.compute(GUILD, OWNER, BOT, List.of(BOT_ROLE),
                Map.of(GUILD, EVERYDAY),
                List.of(new PermissionCalculator.Overwrite(999L, ROLE_OVERWRITE, 0, SEND_MESSAGES)));

        assertThat(PermissionCalculator.toCapabilities(permissions)).contains(ChannelCapability.SEND_MESSAGES);
    }

    @Test
    void hidden_channel_has_no_capabilities() {
        assertThat(PermissionCalculator.toCapabilities(SEND_MESSAGES | EMBED_LINKS)).isEmpty();
    }
}
