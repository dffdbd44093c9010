package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 定长字符串，长度是内容UTF-8编码后的字节数。
 */
@EqualsAndHashCode
@ToString
public class RespBulkString implements RespData {
    static final char firstChar = '$';

    @Getter
    private final String content;

    public static RespBulkString withUTF8(String content) {
        return new RespBulkString(content);
    }

    private RespBulkString(@NonNull String content) {
        this.content = content;
    }

    /**
     * @return 编码后内容的字节数
     */
    public int getLength() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public byte[] toBytes() {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        byte[] header = (firstChar + String.valueOf(bytes.length) + "\r\n").getBytes(StandardCharsets.UTF_8);
        return Bytes.concat(header, bytes, "\r\n".getBytes(StandardCharsets.UTF_8));
    }
}
