package com.projectgroup5.arena.net;

import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.game.GameTickScheduler;
import com.projectgroup5.arena.game.InputAggregator;
import com.projectgroup5.arena.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * TCP 接入层
 * - 一个 acceptor 线程（带超时轮询，能及时感知关闭）
 * - 每个连接一个读线程 + 一个写线程
 *
 * 端口绑定失败直接抛异常，Spring 上下文启动失败，进程退出。
 */
@Component
public class GameConnectionServer implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(GameConnectionServer.class);

    private static final int BACKLOG = 50;

    private final ArenaProperties.Server config;
    private final FrameCodec codec;
    private final ClientRegistry registry;
    private final InputAggregator inputAggregator;
    private final GameTickScheduler scheduler;

    // 所有还没关闭的连接（包括还没 JOIN 的），关闭服务器时逐个断开
    private final Set<ClientConnection> openConnections = ConcurrentHashMap.newKeySet();

    private volatile boolean running = false;
    private ServerSocket serverSocket;
    private Thread acceptThread;
    private ExecutorService connectionExecutor;

    public GameConnectionServer(ArenaProperties properties,
                                FrameCodec codec,
                                ClientRegistry registry,
                                InputAggregator inputAggregator,
                                GameTickScheduler scheduler) {
        this.config = properties.getServer();
        this.codec = codec;
        this.registry = registry;
        this.inputAggregator = inputAggregator;
        this.scheduler = scheduler;
    }

    // ==================== 生命周期 ====================

    @Override
    public void start() {
        if (running) return;

        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(config.getHost(), config.getPort()), BACKLOG);
            serverSocket.setSoTimeout(config.getAcceptPollMillis());
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Cannot bind arena server to " + config.getHost() + ":" + config.getPort(), e);
        }

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("arena-conn-");
        threadFactory.setDaemon(true);
        connectionExecutor = Executors.newCachedThreadPool(threadFactory);

        running = true;
        acceptThread = new Thread(this::acceptLoop, "arena-acceptor");
        acceptThread.setDaemon(true);
        acceptThread.start();

        logger.info("Arena server listening on {}:{}", config.getHost(), getLocalPort());
    }

    @Override
    public void stop() {
        if (!running) return;
        logger.info("Shutting down arena server...");
        running = false;

        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.warn("Error closing server socket", e);
        }

        // 关掉所有 socket，阻塞中的读会立刻返回
        for (ClientConnection connection : new ArrayList<>(openConnections)) {
            connection.close("server shutdown");
        }
        connectionExecutor.shutdownNow();

        try {
            acceptThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Arena server stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ==================== 接入 ====================

    private void acceptLoop() {
        logger.info("Waiting for connections...");

        while (running) {
            try {
                Socket socket = serverSocket.accept();
                handleNewConnection(socket);
            } catch (SocketTimeoutException e) {
                // 轮询间隔到了，回去检查 running
                continue;
            } catch (IOException e) {
                if (running) {
                    logger.error("Error accepting connection", e);
                }
            }
        }
    }

    void handleNewConnection(Socket socket) throws IOException {
        logger.debug("New connection from {}", socket.getRemoteSocketAddress());

        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(config.getIdleTimeoutMillis());
        } catch (IOException e) {
            // 连接对象还没建起来，socket 只能在这里关
            closeSocket(socket);
            throw e;
        }

        ClientConnection connection = new ClientConnection(
                socket,
                codec,
                registry,
                inputAggregator,
                scheduler,
                connectionExecutor,
                config.getOutboundQueueCapacity(),
                openConnections::remove
        );
        openConnections.add(connection);

        try {
            connectionExecutor.execute(connection);
        } catch (RejectedExecutionException e) {
            connection.close("server shutting down");
        }
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket {}", socket.getRemoteSocketAddress(), e);
        }
    }

    public int getLocalPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    public int getOpenConnectionCount() {
        return openConnections.size();
    }
}
