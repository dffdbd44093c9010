package io.github.respkv;

import java.io.IOException;

import io.github.respkv.kv.KeyValueEngine;
import io.github.respkv.kv.KeyValueServer;
import io.github.respkv.kv.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws Exception {
        ServerConf conf = ServerConf.fromSystemProperties();
        logger.info("starting with {}", conf);

        MemoryStore store = MemoryStore.builder()
                .expiryThreads(conf.getExpiryThreads())
                .expiryUnit(conf.getExpiryUnit())
                .build();
        KeyValueEngine engine = KeyValueEngine.builder().store(store).build();
        KeyValueServer server = KeyValueServer.builder()
                .socketAddress(conf.getAddress())
                .keyValueEngine(engine)
                .readBufferSize(conf.getReadBufferSize())
                .build();

        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("服务进程退出.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.error("shutdown kv server failed.", e);
            } finally {
                store.shutdown();
            }
        }));
    }
}
