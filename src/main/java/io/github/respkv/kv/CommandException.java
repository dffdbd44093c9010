package io.github.respkv.kv;

import io.github.respkv.resp.RespError;

/**
 * 命令执行失败。连接不受影响，错误信息以{@link RespError}返回给客户端。
 */
public abstract class CommandException extends Exception {
    private static final long serialVersionUID = -2618405218373710215L;

    CommandException(String message) {
        super(message);
    }

    RespError toRespError() {
        return RespError.withUTF8(getMessage());
    }
}
