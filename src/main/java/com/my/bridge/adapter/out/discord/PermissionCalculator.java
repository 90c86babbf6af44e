package com.my.bridge.adapter.out.discord;

import com.my.bridge.domain.model.ChannelCapability;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 왜: 길드 역할 권한과 채널 덮어쓰기(@everyone, 역할, 멤버 순)를 합쳐 봇의 실제 채널 권한을 계산하기 위함.
 * HTTP와 분리된 순수 계산이라 단독으로 테스트한다.
 */
final class PermissionCalculator {

    static final long ADMINISTRATOR = 1L << 3;
    static final long VIEW_CHANNEL = 1L << 10;
    static final long SEND_MESSAGES = 1L << 11;
    static final long EMBED_LINKS = 1L << 14;
    static final long ATTACH_FILES = 1L << 15;
    static final long READ_MESSAGE_HISTORY = 1L << 16;
    static final long ALL = -1L;

    static final int ROLE_OVERWRITE = 0;
    static final int MEMBER_OVERWRITE = 1;

    record Overwrite(long id, int type, long allow, long deny) {
    }

    private PermissionCalculator() {
    }

    static long compute(long guildId,
                        long ownerId,
                        long memberId,
                        Collection<Long> memberRoleIds,
                        Map<Long, Long> rolePermissions,
                        List<Overwrite> overwrites) {
        if (memberId == ownerId) {
            return ALL;
        }
        long permissions = rolePermissions.getOrDefault(guildId, 0L);
        for (Long roleId : memberRoleIds) {
            permissions |= rolePermissions.getOrDefault(roleId, 0L);
        }
        if ((permissions & ADMINISTRATOR) != 0) {
            return ALL;
        }

        for (Overwrite overwrite : overwrites) {
            if (overwrite.type() == ROLE_OVERWRITE && overwrite.id() == guildId) {
                permissions &= ~overwrite.deny();
                permissions |= overwrite.allow();
            }
        }

        long roleAllow = 0;
        long roleDeny = 0;
        for (Overwrite overwrite : overwrites) {
            if (overwrite.type() == ROLE_OVERWRITE && overwrite.id() != guildId && memberRoleIds.contains(overwrite.id())) {
                roleAllow |= overwrite.allow();
                roleDeny |= overwrite.deny();
            }
        }
        permissions &= ~roleDeny;
        permissions |= roleAllow;

        for (Overwrite overwrite : overwrites) {
            if (overwrite.type() == MEMBER_OVERWRITE && overwrite.id() == memberId) {
                permissions &= ~overwrite.deny();
                permissions |= overwrite.allow();
            }
        }
        return permissions;
    }

    static Set<ChannelCapability> toCapabilities(long permissions) {
        Set<ChannelCapability> capabilities = EnumSet.noneOf(ChannelCapability.class);
        if ((permissions & VIEW_CHANNEL) == 0) {
            return capabilities;
        }
        capabilities.add(ChannelCapability.VIEW_CHANNEL);
        if ((permissions & SEND_MESSAGES) != 0) {
            capabilities.add(ChannelCapability.SEND_MESSAGES);
        }
        if ((permissions & EMBED_LINKS) != 0) {
            capabilities.add(ChannelCapability.EMBED_LINKS);
        }
        if ((permissions & ATTACH_FILES) != 0) {
            capabilities.add(ChannelCapability.ATTACH_FILES);
        }
        if ((permissions & READ_MESSAGE_HISTORY) != 0) {
            capabilities.add(ChannelCapability.READ_MESSAGE_HISTORY);
        }
        return capabilities;
    }
}
