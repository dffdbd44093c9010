package io.github.respkv.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import io.github.respkv.resp.ByteBuf;
import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespDecoder;
import io.github.respkv.resp.RespError;
import io.github.respkv.resp.RespProtocolException;
import io.github.respkv.resp.RespSimpleString;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyValueServerTest {
    private static KeyValueServer server;
    private static MemoryStore    store;
    private static RespDecoder    respDecoder = RespDecoder.create();

    @BeforeAll
    static void beforeAll() throws IOException {
        store = MemoryStore.builder().expiryUnit(TimeUnit.MILLISECONDS).build();
        KeyValueEngine engine = KeyValueEngine.builder().store(store).build();
        server = KeyValueServer.builder()
                .socketAddress(new InetSocketAddress("127.0.0.1", 0))
                .keyValueEngine(engine)
                .build();
        server.start();
    }

    @AfterAll
    static void afterAll() throws IOException {
        server.shutdown();
        store.shutdown();
    }

    @Test
    void ping() throws Exception {
        try (SocketChannel client = connect()) {
            assertEquals(RespSimpleString.withUTF8("PONG"), request(client, "PING"));
        }
    }

    @Test
    void setAndGet() throws Exception {
        try (SocketChannel client = connect()) {
            assertEquals(RespBulkString.withUTF8(KeyValueEngine.INSERTED), request(client, "SET", "server-k", "v1"));
            assertEquals(RespBulkString.withUTF8(KeyValueEngine.UPDATED), request(client, "SET", "server-k", "v2"));
            assertEquals(RespBulkString.withUTF8("v2"), request(client, "GET", "server-k"));
            assertEquals(RespBulkString.withUTF8(KeyValueEngine.REMOVED), request(client, "DEL", "server-k"));
            assertEquals(RespError.withUTF8(KeyValueEngine.NO_VALUE), request(client, "GET", "server-k"));
        }
    }

    @Test
    void unknownCommand() throws Exception {
        try (SocketChannel client = connect()) {
            assertEquals(RespError.withUTF8(KeyValueEngine.INVALID), request(client, "FLUSHALL"));
            assertEquals(RespSimpleString.withUTF8("PONG"), request(client, "PING"));
        }
    }

    @Test
    void clientsShareStore() throws Exception {
        try (SocketChannel a = connect(); SocketChannel b = connect()) {
            request(a, "SET", "shared", "from-a");
            assertEquals(RespBulkString.withUTF8("from-a"), request(b, "GET", "shared"));
            RespArray values = (RespArray) request(b, "MGET", "shared", "missing");
            assertEquals(RespBulkString.withUTF8("from-a"), values.get(0));
            assertEquals(RespError.withUTF8(KeyValueEngine.MGET_NO_VALUE), values.get(1));
        }
    }

    @Test
    void expire() throws Exception {
        try (SocketChannel client = connect()) {
            request(client, "SET", "short-lived", "v");
            assertEquals(RespSimpleString.withUTF8("OK"), request(client, "EXPIRE", "short-lived", "50"));
            long deadline = System.currentTimeMillis() + 5000;
            RespData data = request(client, "GET", "short-lived");
            while (!(data instanceof RespError) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
                data = request(client, "GET", "short-lived");
            }
            assertEquals(RespError.withUTF8(KeyValueEngine.NO_VALUE), data);
        }
    }

    @Test
    void quit() throws Exception {
        try (SocketChannel client = connect()) {
            send(client, "QUIT");
            ByteBuffer buf = ByteBuffer.allocate(16);
            assertEquals(-1, client.read(buf));
        }
    }

    private static SocketChannel connect() throws IOException {
        return SocketChannel.open(server.getLocalAddress());
    }

    private static void send(SocketChannel client, String... args) throws IOException {
        RespBulkString[] datas = new RespBulkString[args.length];
        for (int i = 0; i < args.length; i++) {
            datas[i] = RespBulkString.withUTF8(args[i]);
        }
        ByteBuffer src = RespArray.with(datas).toByteBuffer();
        while (src.hasRemaining()) {
            client.write(src);
        }
    }

    private static RespData request(SocketChannel client, String... args) throws IOException, RespProtocolException {
        send(client, args);
        ByteBuf buf = ByteBuf.allocate(64);
        ByteBuffer bb = ByteBuffer.allocate(64);
        while (true) {
            Optional<RespDecoder.Decoded> decoded = respDecoder.decode(buf);
            if (decoded.isPresent()) {
                assertEquals(buf.readableBytes(), decoded.get().getLength());
                return decoded.get().getData();
            }
            bb.clear();
            int n = client.read(bb);
            assertNotEquals(-1, n, "server closed connection");
            bb.flip();
            buf.writeBytes(bb);
        }
    }
}
