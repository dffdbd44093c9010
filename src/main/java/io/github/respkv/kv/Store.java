package io.github.respkv.kv;

import java.util.List;
import java.util.Optional;

/**
 * 进程内共享的字符串键值存储。
 */
public interface Store {
    Optional<String> get(String key);

    /**
     * 在同一次读锁内读取多个key，结果与keys一一对应。
     */
    List<Optional<String>> getAll(List<String> keys);

    /**
     * @return 被覆盖的旧值，新插入时为空
     */
    Optional<String> put(String key, String value);

    boolean remove(String key);

    /**
     * 延迟删除key。任务一旦提交不能取消，到期时key存在就删除，不管期间是否被重新设置过。
     * @param key   key
     * @param delay 延迟，单位由实现决定
     */
    void expire(String key, long delay);

    int size();
}
