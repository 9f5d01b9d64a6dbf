package com.projectgroup5.arena.client;

import com.projectgroup5.arena.dto.GameMessage;
import com.projectgroup5.arena.dto.InputMessage;
import com.projectgroup5.arena.dto.JoinAckMessage;
import com.projectgroup5.arena.dto.JoinMessage;
import com.projectgroup5.arena.dto.LeaveMessage;
import com.projectgroup5.arena.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Optional;

/**
 * 无界面的协议客户端：只负责序列化输入、反序列化快照。
 * 渲染和键鼠采集不在服务器工程里。
 */
public class ArenaClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ArenaClient.class);

    private final FrameCodec codec;
    private Socket socket;
    private InputStream in;
    private OutputStream out;
    private String playerId;

    /**
     * 服务器读取入站帧的上限对 STATE 来说太小，客户端换成 STATE 的上限
     */
    public ArenaClient(FrameCodec codec) {
        this(codec, FrameCodec.DEFAULT_MAX_STATE_FRAME_BYTES);
    }

    public ArenaClient(FrameCodec codec, int maxFrameBytes) {
        this.codec = codec.withMaxFrameBytes(maxFrameBytes);
    }

    public void connect(String host, int port, int timeoutMillis) throws IOException {
        socket = new Socket();
        socket.connect(new InetSocketAddress(host, port), timeoutMillis);
        socket.setTcpNoDelay(true);
        socket.setSoTimeout(timeoutMillis);
        in = new BufferedInputStream(socket.getInputStream());
        out = new BufferedOutputStream(socket.getOutputStream());
    }

    /**
     * 发送 JOIN 并等待 JOIN_ACK
     */
    public JoinAckMessage join() throws IOException {
        send(new JoinMessage());
        Optional<GameMessage> response = receive();
        if (response.isEmpty() || !(response.get() instanceof JoinAckMessage)) {
            throw new IOException("Server did not acknowledge JOIN");
        }
        JoinAckMessage ack = (JoinAckMessage) response.get();
        playerId = ack.getPlayerId();
        logger.debug("Joined as {}", playerId);
        return ack;
    }

    public void sendInput(InputMessage input) throws IOException {
        send(input);
    }

    public void leave() throws IOException {
        send(new LeaveMessage());
    }

    public void send(GameMessage message) throws IOException {
        codec.write(out, message);
    }

    /** 写原始字节，测试里用来构造异常帧 */
    public void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    /** 连接断开时返回 empty */
    public Optional<GameMessage> receive() throws IOException {
        return codec.read(in);
    }

    public String getPlayerId() {
        return playerId;
    }

    public boolean isConnected() {
        return socket != null && socket.isConnected() && !socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        if (socket != null) {
            socket.close();
        }
    }
}
