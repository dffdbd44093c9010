package io.github.respkv.resp;

import java.nio.ByteBuffer;

/**
 * 协议中的一个值。只有{@link RespSimpleString}、{@link RespError}、{@link RespBulkString}
 * 和{@link RespArray}四种实现，都可以直接编码。
 */
public interface RespData {

    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
