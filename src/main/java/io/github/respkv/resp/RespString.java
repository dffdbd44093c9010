package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 单行字符串，以首字符区分类型，以\r\n结束。
 */
@EqualsAndHashCode
@ToString
abstract class RespString implements RespData {
    @Getter
    private final String content;

    RespString(@NonNull String content) {
        Preconditions.checkArgument(!content.contains("\r"), "resp simple string不能包含\\r");
        Preconditions.checkArgument(!content.contains("\n"), "resp simple string不能包含\\n");
        this.content = content;
    }

    abstract char getFirstChar();

    @Override
    public byte[] toBytes() {
        return (getFirstChar() + content + "\r\n").getBytes(StandardCharsets.UTF_8);
    }
}
