package com.projectgroup5.arena.net;

import com.projectgroup5.arena.config.ArenaProperties;
import org.junit.jupiter.api.Test;

import java.net.Socket;
import java.net.SocketException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameConnectionServerTest {

    /** 设置 socket 选项时就失败的连接 */
    private static class BrokenSocket extends Socket {
        @Override
        public void setTcpNoDelay(boolean on) throws SocketException {
            throw new SocketException("Socket is closed");
        }
    }

    @Test
    void socketIsClosedWhenConnectionSetupFails() {
        GameConnectionServer server = new GameConnectionServer(new ArenaProperties(), null, null, null, null);
        BrokenSocket socket = new BrokenSocket();

        assertThatThrownBy(() -> server.handleNewConnection(socket)).isInstanceOf(SocketException.class);

        assertThat(socket.isClosed()).isTrue();
        assertThat(server.getOpenConnectionCount()).isZero();
    }
}
