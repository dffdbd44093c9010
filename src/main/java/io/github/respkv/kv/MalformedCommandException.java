package io.github.respkv.kv;

import java.util.Locale;

/**
 * 请求是合法的协议值，但不是合法的命令。
 */
public class MalformedCommandException extends CommandException {
    private static final long serialVersionUID = 5180972353418925021L;

    MalformedCommandException(String message) {
        super(message);
    }

    static MalformedCommandException wrongArity(Command command) {
        return new MalformedCommandException(
                "wrong number of arguments for '" + command.name().toLowerCase(Locale.ROOT) + "' command");
    }
}
