package io.github.respkv.resp;

/**
 * 收到的数据不可能是任何合法编码的前缀，连接无法继续解析。
 */
public class RespProtocolException extends Exception {
    private static final long serialVersionUID = 3112486307441983215L;

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
