package io.github.respkv.kv;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import io.github.respkv.resp.RespSimpleString;
import lombok.Builder;
import lombok.NonNull;

/**
 * 命令分发：把请求映射到{@link Store}操作，生成响应。
 * <p>
 * 命令错误（{@link MalformedCommandException}、{@link StoreException}）在这里转换成{@link RespError}，
 * 不会抛给连接。QUIT由连接自己处理，不会到达这里。
 */
public class KeyValueEngine {
    static final String INSERTED       = "Successfully inserted value in database";
    static final String UPDATED        = "Successfully updated value in database";
    static final String REMOVED        = "Removed the key from database";
    static final String NOT_EXISTS     = "Value doesnt exist in database";
    static final String NO_VALUE       = "key has no associated value";
    static final String MGET_NO_VALUE  = "no associated value";
    static final String INVALID        = "Invalid command";
    static final String INVALID_EXPIRE = "value is not a non-negative integer";

    private final Store store;

    @Builder
    public KeyValueEngine(@NonNull Store store) {
        this.store = store;
    }

    public RespData execute(RespData request) {
        try {
            return execute(KeyValueCommand.parse(request));
        } catch (MalformedCommandException e) {
            return e.toRespError();
        }
    }

    public RespData execute(@NonNull KeyValueCommand cmd) {
        try {
            if (!cmd.getCommand().accepts(cmd.argc())) {
                throw MalformedCommandException.wrongArity(cmd.getCommand());
            }
            switch (cmd.getCommand()) {
                case PING:
                    return RespSimpleString.withUTF8("PONG");
                case ECHO:
                    return cmd.arg(0);
                case GET:
                    return get(cmd);
                case MGET:
                    return mget(cmd);
                case SET:
                    return set(cmd);
                case DEL:
                    return del(cmd);
                case EXPIRE:
                    return expire(cmd);
                case QUIT:
                    return RespSimpleString.withUTF8("OK");
                default:
                    throw new MalformedCommandException(INVALID);
            }
        } catch (CommandException e) {
            return e.toRespError();
        }
    }

    private RespData get(KeyValueCommand cmd) throws StoreException {
        Optional<String> v = store.get(cmd.key(0));
        if (!v.isPresent()) {
            throw new StoreException(StoreException.Reason.KEY_NOT_FOUND, NO_VALUE);
        }
        return RespBulkString.withUTF8(v.get());
    }

    /**
     * 每个key的结果单独返回，key不存在或类型错误时该位置是一个错误，整个命令仍然成功。
     */
    private RespData mget(KeyValueCommand cmd) {
        RespError[] errors = new RespError[cmd.argc()];
        List<String> keys = new ArrayList<>(cmd.argc());
        for (int i = 0; i < cmd.argc(); i++) {
            try {
                keys.add(cmd.key(i));
            } catch (StoreException e) {
                errors[i] = e.toRespError();
            }
        }
        Iterator<Optional<String>> values = store.getAll(keys).iterator();
        List<RespData> a = new ArrayList<>(errors.length);
        for (RespError error : errors) {
            if (error != null) {
                a.add(error);
                continue;
            }
            Optional<String> v = values.next();
            a.add(v.isPresent() ? RespBulkString.withUTF8(v.get()) : RespError.withUTF8(MGET_NO_VALUE));
        }
        return RespArray.with(a);
    }

    private RespData set(KeyValueCommand cmd) throws StoreException {
        String key = cmd.key(0);
        String value = cmd.value(1);
        Optional<String> previous = store.put(key, value);
        return RespBulkString.withUTF8(previous.isPresent() ? UPDATED : INSERTED);
    }

    private RespData del(KeyValueCommand cmd) throws StoreException {
        if (!store.remove(cmd.key(0))) {
            throw new StoreException(StoreException.Reason.KEY_NOT_FOUND, NOT_EXISTS);
        }
        return RespBulkString.withUTF8(REMOVED);
    }

    private RespData expire(KeyValueCommand cmd) throws CommandException {
        String key = cmd.key(0);
        String seconds = cmd.value(1);
        long delay;
        try {
            delay = Long.parseLong(seconds);
        } catch (NumberFormatException e) {
            throw new MalformedCommandException(INVALID_EXPIRE);
        }
        if (delay < 0) {
            throw new MalformedCommandException(INVALID_EXPIRE);
        }
        store.expire(key, delay);
        return RespSimpleString.withUTF8("OK");
    }
}
