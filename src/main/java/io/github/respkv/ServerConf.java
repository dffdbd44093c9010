package io.github.respkv;

import java.net.InetSocketAddress;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 服务配置，可以从系统属性读取，没有设置的项使用默认值。
 */
@Builder
@ToString
public class ServerConf {
    static final String ADDRESS_PROPERTY          = "respkv.address";
    static final String READ_BUFFER_SIZE_PROPERTY = "respkv.readBufferSize";
    static final String EXPIRY_THREADS_PROPERTY   = "respkv.expiryThreads";
    static final String EXPIRY_UNIT_PROPERTY      = "respkv.expiryUnit";

    @Builder.Default
    @Getter
    private InetSocketAddress address = new InetSocketAddress("127.0.0.1", 6379);

    // 每次读取的字节数，也是连接缓冲区的初始容量
    @Builder.Default
    @Getter
    private int readBufferSize = 512;

    @Builder.Default
    @Getter
    private int expiryThreads = 1;

    // EXPIRE参数的时间单位
    @Builder.Default
    @Getter
    private TimeUnit expiryUnit = TimeUnit.SECONDS;

    public static ServerConf fromSystemProperties() {
        ServerConfBuilder builder = ServerConf.builder();

        String prop = System.getProperty(ADDRESS_PROPERTY);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.address(getInetSocketAddress(prop));
        }
        prop = System.getProperty(READ_BUFFER_SIZE_PROPERTY);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.readBufferSize(positive(READ_BUFFER_SIZE_PROPERTY, prop));
        }
        prop = System.getProperty(EXPIRY_THREADS_PROPERTY);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.expiryThreads(positive(EXPIRY_THREADS_PROPERTY, prop));
        }
        prop = System.getProperty(EXPIRY_UNIT_PROPERTY);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.expiryUnit(TimeUnit.valueOf(prop.trim().toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    public static InetSocketAddress getInetSocketAddress(String prop) {
        int i = prop.lastIndexOf(':');
        Preconditions.checkArgument(i > 0 && i < prop.length() - 1, "address must be host:port, but was %s", prop);
        String host = prop.substring(0, i).trim();
        int port = Integer.parseInt(prop.substring(i + 1).trim());
        Preconditions.checkArgument(port >= 0 && port <= 0xffff, "invalid port %s", port);
        return new InetSocketAddress(host, port);
    }

    private static int positive(String name, String prop) {
        int n = Integer.parseInt(prop.trim());
        Preconditions.checkArgument(n > 0, "%s must be positive, but was %s", name, n);
        return n;
    }
}
