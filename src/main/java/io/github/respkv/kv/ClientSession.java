package io.github.respkv.kv;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.util.Optional;

import io.github.respkv.resp.ByteBuf;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespDecoder;
import io.github.respkv.resp.RespProtocolException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 一个客户连接上的请求循环：解码一个请求，交给{@link KeyValueEngine}执行，写回响应，再处理下一个。
 * <p>
 * 缓冲区里没有完整请求时才从channel读取，所以同一次读到的多个请求会依次处理。
 * 对端关闭、协议错误、读写失败或QUIT命令都会结束循环并关闭channel。
 */
public class ClientSession implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientSession.class);

    public enum State {
        ACTIVE,
        CLOSED
    }

    private final ByteChannel    channel;
    private final KeyValueEngine engine;
    private final RespDecoder    decoder = RespDecoder.create();
    @Getter(AccessLevel.PACKAGE)
    private final ByteBuf        buffer;
    private final ByteBuffer     readBuffer;
    @Getter
    private volatile State       state   = State.ACTIVE;

    @Builder
    ClientSession(@NonNull ByteChannel channel, @NonNull KeyValueEngine engine, Integer readBufferSize) {
        int size = readBufferSize == null ? 512 : readBufferSize;
        this.channel = channel;
        this.engine = engine;
        this.buffer = ByteBuf.allocate(size);
        this.readBuffer = ByteBuffer.allocate(size);
    }

    @Override
    public void run() {
        try {
            while (state == State.ACTIVE) {
                Optional<RespDecoder.Decoded> decoded = decoder.decode(buffer);
                if (!decoded.isPresent()) {
                    if (!fill()) {
                        logger.debug("client closed the connection.");
                        break;
                    }
                    continue;
                }
                buffer.skipBytes(decoded.get().getLength());
                buffer.discardReadBytes();
                handle(decoded.get().getData());
            }
        } catch (RespProtocolException e) {
            logger.warn("protocol error, close connection: {}", e.getMessage());
        } catch (IOException e) {
            if (state == State.CLOSED) {
                logger.debug("connection closed while waiting for io.");
            } else {
                logger.warn("connection failed.", e);
            }
        } catch (RuntimeException e) {
            logger.error("session failed, close connection.", e);
        } finally {
            close();
        }
    }

    private void handle(RespData request) throws IOException {
        RespData response;
        try {
            KeyValueCommand command = KeyValueCommand.parse(request);
            if (command.getCommand() == Command.QUIT) {
                logger.info("client requested to quit.");
                state = State.CLOSED;
                return;
            }
            response = engine.execute(command);
        } catch (MalformedCommandException e) {
            response = e.toRespError();
        }
        write(response.toByteBuffer());
    }

    /**
     * 从channel读取一次数据追加到缓冲区。
     * @return false 对端已关闭
     */
    private boolean fill() throws IOException {
        readBuffer.clear();
        int n = channel.read(readBuffer);
        if (n == -1) {
            return false;
        }
        readBuffer.flip();
        buffer.writeBytes(readBuffer);
        return true;
    }

    private void write(ByteBuffer src) throws IOException {
        while (src.hasRemaining()) {
            channel.write(src);
        }
    }

    void close() {
        state = State.CLOSED;
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("close channel failed.", e);
        }
    }
}
