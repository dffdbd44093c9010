package io.github.respkv.kv;

import java.util.List;

import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 从请求中解析出的命令名和参数。请求必须是数组，第一个元素是命令名bulk string。
 */
@Value
@Builder
public class KeyValueCommand {
    @NonNull
    Command        command;
    @NonNull
    String         name;
    @NonNull
    List<RespData> args;

    public static KeyValueCommand parse(RespData request) throws MalformedCommandException {
        if (!(request instanceof RespArray)) {
            throw new MalformedCommandException("Invalid command format");
        }
        RespArray array = (RespArray) request;
        if (array.size() == 0 || !(array.get(0) instanceof RespBulkString)) {
            throw new MalformedCommandException("Invalid command format");
        }
        String name = ((RespBulkString) array.get(0)).getContent();
        List<RespData> datas = array.getDatas();
        return KeyValueCommand.builder()
                .command(Command.of(name))
                .name(name)
                .args(datas.subList(1, datas.size()))
                .build();
    }

    public int argc() {
        return args.size();
    }

    public RespData arg(int i) {
        return args.get(i);
    }

    /**
     * 第i个参数作为key。
     * @throws StoreException 参数不是bulk string
     */
    String key(int i) throws StoreException {
        return bulk(i, "Invalid key type");
    }

    /**
     * 第i个参数作为value。
     * @throws StoreException 参数不是bulk string
     */
    String value(int i) throws StoreException {
        return bulk(i, "Invalid value type");
    }

    private String bulk(int i, String error) throws StoreException {
        RespData data = args.get(i);
        if (!(data instanceof RespBulkString)) {
            throw new StoreException(StoreException.Reason.WRONG_TYPE, error);
        }
        return ((RespBulkString) data).getContent();
    }
}
