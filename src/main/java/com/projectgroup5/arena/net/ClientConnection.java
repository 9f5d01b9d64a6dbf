package com.projectgroup5.arena.net;

import com.projectgroup5.arena.dto.GameMessage;
import com.projectgroup5.arena.dto.InputMessage;
import com.projectgroup5.arena.dto.JoinAckMessage;
import com.projectgroup5.arena.dto.JoinMessage;
import com.projectgroup5.arena.dto.LeaveMessage;
import com.projectgroup5.arena.game.GameTickScheduler;
import com.projectgroup5.arena.game.InputAggregator;
import com.projectgroup5.arena.game.PlayerColors;
import com.projectgroup5.arena.game.PlayerInput;
import com.projectgroup5.arena.protocol.FrameCodec;
import com.projectgroup5.arena.protocol.MalformedFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 单个客户端连接
 *
 * 读线程：握手（只接受 JOIN）后循环读取 INPUT / LEAVE。
 * 写线程：从有界发送队列取出已编码的帧写到 socket。
 * 无论从哪条路径退出（LEAVE、读写错误、广播判定死亡、服务器关闭），
 * {@link #close(String)} 只会真正执行一次。
 */
public class ClientConnection implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ClientConnection.class);

    private static final long WRITER_POLL_MILLIS = 200;

    private final Socket socket;
    private final FrameCodec codec;
    private final ClientRegistry registry;
    private final InputAggregator inputAggregator;
    private final GameTickScheduler scheduler;
    private final Executor writerExecutor;
    private final Consumer<ClientConnection> onClosed;
    private final String remoteAddress;

    private final BlockingQueue<byte[]> outbound;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ConnectionState state = ConnectionState.ACCEPTED;
    private volatile String playerId;
    private OutputStream out;

    public ClientConnection(Socket socket,
                            FrameCodec codec,
                            ClientRegistry registry,
                            InputAggregator inputAggregator,
                            GameTickScheduler scheduler,
                            Executor writerExecutor,
                            int outboundCapacity,
                            Consumer<ClientConnection> onClosed) {
        this.socket = socket;
        this.codec = codec;
        this.registry = registry;
        this.inputAggregator = inputAggregator;
        this.scheduler = scheduler;
        this.writerExecutor = writerExecutor;
        this.onClosed = onClosed;
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
        this.outbound = new ArrayBlockingQueue<>(outboundCapacity);
    }

    @Override
    public void run() {
        String reason = "connection closed";
        try {
            state = ConnectionState.AWAITING_JOIN;
            InputStream in = new BufferedInputStream(socket.getInputStream());
            out = new BufferedOutputStream(socket.getOutputStream());

            // 第一帧必须是 JOIN
            Optional<GameMessage> first = codec.read(in);
            if (first.isEmpty() || !(first.get() instanceof JoinMessage)) {
                logger.warn("Invalid JOIN from {}, closing", remoteAddress);
                reason = "invalid join";
                return;
            }

            if (!join()) {
                reason = "closed during join";
                return;
            }
            reason = receiveLoop(in);

        } catch (MalformedFrameException e) {
            logger.warn("Malformed frame from {} ({}): {}", remoteAddress, playerId, e.getMessage());
            reason = "malformed frame";
        } catch (SocketTimeoutException e) {
            reason = "idle timeout";
        } catch (IOException e) {
            if (!closed.get()) {
                logger.info("Client {} ({}) I/O error: {}", remoteAddress, playerId, e.getMessage());
            }
            reason = "I/O error";
        } finally {
            close(reason);
        }
    }

    /**
     * 分配玩家、登记为在线连接、回复 JOIN_ACK、启动写线程
     *
     * 状态先切到 JOINED 再登记，广播线程从登记表里拿到的连接一定可以入队。
     * 这之后到达的 STATE 先在发送队列里排着，写线程在 JOIN_ACK 写完后才启动，
     * 所以客户端收到的第一帧总是 JOIN_ACK。
     */
    private boolean join() throws IOException {
        String id;
        synchronized (this) {
            if (closed.get()) return false;
            id = registry.nextPlayerId();
            playerId = id;
            scheduler.requestJoin(id);
            state = ConnectionState.JOINED;
            registry.register(this, id);
        }

        // 写线程还没启动，这里直接写
        codec.write(out, new JoinAckMessage(id, PlayerColors.forId(id)));
        writerExecutor.execute(this::writeLoop);

        logger.info("Player {} joined from {}", id, remoteAddress);
        return true;
    }

    private String receiveLoop(InputStream in) throws IOException {
        while (!closed.get()) {
            Optional<GameMessage> next = codec.read(in);
            if (next.isEmpty()) {
                return "peer closed";
            }

            GameMessage message = next.get();
            if (message.isServerOnly()) {
                logger.warn("Client {} sent server-only {}, closing", playerId, message.getClass().getSimpleName());
                return "protocol error";
            }

            if (message instanceof InputMessage) {
                inputAggregator.submit(playerId, PlayerInput.from((InputMessage) message));
            } else if (message instanceof LeaveMessage) {
                return "leave";
            } else if (message instanceof JoinMessage) {
                logger.debug("Ignoring duplicate JOIN from {}", playerId);
            } else {
                logger.warn("Unexpected {} from {}, closing", message.getClass().getSimpleName(), playerId);
                return "protocol error";
            }
        }
        return "server shutdown";
    }

    private void writeLoop() {
        try {
            while (!closed.get()) {
                byte[] frame = outbound.poll(WRITER_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (frame != null) {
                    codec.writeFrame(out, frame);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close("writer interrupted");
        } catch (IOException e) {
            if (!closed.get()) {
                logger.info("Write to {} ({}) failed: {}", remoteAddress, playerId, e.getMessage());
            }
            close("write failed");
        }
    }

    /**
     * 非阻塞入队一帧
     *
     * @return 连接已关闭、还没加入或发送队列已满时返回 false
     */
    public boolean enqueue(byte[] frame) {
        if (closed.get() || state != ConnectionState.JOINED) {
            return false;
        }
        return outbound.offer(frame);
    }

    /**
     * 断开连接并清理：移除玩家、清掉缓存的输入、从在线表删除、关闭 socket。
     * 多条路径并发调用时只有第一次生效。
     */
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        String id;
        synchronized (this) {
            id = playerId;
            state = ConnectionState.CLOSED;
        }

        registry.unregister(this);
        if (id != null) {
            inputAggregator.remove(id);
            scheduler.requestLeave(id);
        }

        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket {}", remoteAddress, e);
        }
        outbound.clear();
        onClosed.accept(this);

        logger.info("Player {} disconnected from {} ({})", id, remoteAddress, reason);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public ConnectionState getState() {
        return state;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }
}
