package io.github.respkv.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 监听指定端口，每个连接一个{@link ClientSession}任务，所有连接共享同一个{@link KeyValueEngine}。
 */
public class KeyValueServer implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);

    // 服务地址，端口为0时绑定后由系统分配
    private final    InetSocketAddress       socketAddress;
    private final    KeyValueEngine          engine;
    private final    int                     readBufferSize;
    private final    Set<ClientSession>      sessions = ConcurrentHashMap.newKeySet();
    private volatile ServerSocketChannel     ssc;
    private volatile Thread                  acceptor;
    private volatile ExecutorService         executorService;
    private volatile boolean                 started  = false;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress,
                          @NonNull KeyValueEngine keyValueEngine,
                          Integer readBufferSize) {
        this.socketAddress = socketAddress;
        this.engine = keyValueEngine;
        this.readBufferSize = readBufferSize == null ? 512 : readBufferSize;
    }

    /**
     * 启动服务
     *
     * @throws IOException 绑定端口失败
     */
    public synchronized void start() throws IOException {
        Preconditions.checkState(!started, "already started");
        ssc = ServerSocketChannel.open();
        ssc.setOption(StandardSocketOptions.SO_REUSEADDR, true);
        ssc.bind(socketAddress);
        ssc.configureBlocking(true);

        executorService = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("respkv-session-%d")
                .setUncaughtExceptionHandler((t, e) -> logger.error("{} terminated unexpectedly.", t.getName(), e))
                .build());
        started = true;
        acceptor = new Thread(this, "respkv-acceptor");
        acceptor.start();
        logger.info("kv server listening on {}.", getLocalAddress());
    }

    /**
     * @return 实际绑定的地址
     */
    public InetSocketAddress getLocalAddress() throws IOException {
        Preconditions.checkState(started, "not started");
        return (InetSocketAddress) ssc.getLocalAddress();
    }

    @Override
    public void run() {
        while (started) {
            try {
                SocketChannel channel = ssc.accept();
                logger.debug("accepted connection from {}.", channel.getRemoteAddress());
                ClientSession session = ClientSession.builder()
                        .channel(channel)
                        .engine(engine)
                        .readBufferSize(readBufferSize)
                        .build();
                sessions.add(session);
                executorService.execute(() -> {
                    try {
                        session.run();
                    } finally {
                        sessions.remove(session);
                    }
                });
            } catch (ClosedChannelException e) {
                logger.debug("server channel closed, acceptor exits.");
                return;
            } catch (IOException e) {
                logger.error("accept connection failed.", e);
            }
        }
    }

    /**
     * 关闭服务和所有客户连接
     *
     * @throws IOException 关闭监听channel失败
     */
    public synchronized void shutdown() throws IOException {
        if (!started) {
            return;
        }
        started = false;
        ssc.close();
        for (ClientSession session : sessions) {
            session.close();
        }
        sessions.clear();
        executorService.shutdown();
        try {
            acceptor.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("kv server stopped.");
    }
}
