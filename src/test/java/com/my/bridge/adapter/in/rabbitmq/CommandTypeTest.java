package com.my.bridge.adapter.in.rabbitmq;

import com.my.bridge.domain.model.Actor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandTypeTest {

    private final Actor member = new Actor(1L, 2L, 3L, false, false);
    private final Actor manager = new Actor(1L, 2L, 3L, false, true);
    private final Actor admin = new Actor(1L, 2L, 3L, true, false);

    @Test
    void parses_dashed_names() {
        assertThat(CommandType.parse("connect-create")).contains(CommandType.CONNECT_CREATE);
        assertThat(CommandType.parse(" Server_Stats ")).contains(CommandType.SERVER_STATS);
        assertThat(CommandType.parse("dance")).isEmpty();
    }

    @Test
    void gates_follow_required_server_permission() {
        assertThat(CommandType.CONNECT_LIST.permits(member)).isTrue();
        assertThat(CommandType.CONNECT_CREATE.permits(member)).isFalse();
        assertThat(CommandType.CONNECT_CREATE.permits(manager)).isTrue();
        assertThat(CommandType.CONNECT_REMOVE.permits(admin)).isTrue();
        assertThat(CommandType.CLEANUP.permits(manager)).isFalse();
        assertThat(CommandType.CLEANUP.permits(admin)).isTrue();
    }
}
