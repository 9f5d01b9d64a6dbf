package com.projectgroup5.arena.net;

import com.projectgroup5.arena.dto.GameMessage;
import com.projectgroup5.arena.dto.JoinAckMessage;
import com.projectgroup5.arena.dto.JoinMessage;
import com.projectgroup5.arena.protocol.FrameCodec;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 测试用：在 loopback 上建真实的 socket 对，
 * 服务端一侧交给 ClientConnection，客户端一侧由测试直接读写帧。
 */
class LoopbackConnections implements Closeable {

    static final int TIMEOUT_MILLIS = 3000;

    /** 读线程和写线程都跑在这里 */
    final ExecutorService threads = Executors.newCachedThreadPool();

    private final FrameCodec codec;
    private final ServerSocket listener;
    private final List<Socket> sockets = new ArrayList<>();

    LoopbackConnections(FrameCodec codec) throws IOException {
        this.codec = codec;
        this.listener = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    }

    static final class Link {
        final Socket serverSide;
        final InputStream clientIn;
        final OutputStream clientOut;

        Link(Socket serverSide, Socket clientSide) throws IOException {
            this.serverSide = serverSide;
            this.clientIn = clientSide.getInputStream();
            this.clientOut = clientSide.getOutputStream();
        }
    }

    Link open() throws IOException {
        Socket client = new Socket(InetAddress.getLoopbackAddress(), listener.getLocalPort());
        client.setSoTimeout(TIMEOUT_MILLIS);
        Socket server = listener.accept();
        sockets.add(client);
        sockets.add(server);
        return new Link(server, client);
    }

    /** 启动读线程，发 JOIN，返回读到的第一帧（必须是 JOIN_ACK） */
    JoinAckMessage join(ClientConnection connection, Link link) throws IOException {
        threads.execute(connection);
        codec.write(link.clientOut, new JoinMessage());
        Optional<GameMessage> first = codec.read(link.clientIn);
        if (first.isEmpty() || !(first.get() instanceof JoinAckMessage)) {
            throw new IOException("Expected JOIN_ACK but got " + first);
        }
        return (JoinAckMessage) first.get();
    }

    Optional<GameMessage> read(Link link) throws IOException {
        return codec.read(link.clientIn);
    }

    @Override
    public void close() throws IOException {
        threads.shutdownNow();
        for (Socket socket : sockets) {
            socket.close();
        }
        listener.close();
    }
}
