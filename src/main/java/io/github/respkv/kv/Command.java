package io.github.respkv.kv;

import java.util.Locale;

/**
 * 支持的命令，以及每个命令允许的参数个数。
 */
public enum Command {
    PING(0, Integer.MAX_VALUE),
    ECHO(1, 1),
    GET(1, 1),
    MGET(1, Integer.MAX_VALUE),
    SET(2, 2),
    DEL(1, 1),
    EXPIRE(2, 2),
    QUIT(0, Integer.MAX_VALUE),
    UNKNOWN(0, Integer.MAX_VALUE);

    private final int minArgs;
    private final int maxArgs;

    Command(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    boolean accepts(int args) {
        return args >= minArgs && args <= maxArgs;
    }

    /**
     * 命令名不区分大小写，不认识的命令返回{@link #UNKNOWN}。
     */
    public static Command of(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (Command c : values()) {
            if (c != UNKNOWN && c.name().equals(upper)) {
                return c;
            }
        }
        return UNKNOWN;
    }
}
