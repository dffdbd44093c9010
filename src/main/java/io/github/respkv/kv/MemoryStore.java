package io.github.respkv.kv;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于{@link HashMap}的内存存储，读写锁保护：GET/MGET共享读锁，SET/DEL/过期删除独占写锁，
 * 锁只覆盖一次map操作。
 * <p>
 * EXPIRE不在map里记录元数据，而是向调度线程池提交一个延迟删除任务。
 */
public class MemoryStore implements Store {
    private static final Logger logger = LoggerFactory.getLogger(MemoryStore.class);

    private final Map<String, String>      map           = new HashMap<>();
    private final ReadWriteLock            readWriteLock = new ReentrantReadWriteLock();
    private final ScheduledExecutorService scheduler;
    @Getter
    private final TimeUnit                 expiryUnit;

    @Builder
    MemoryStore(Integer expiryThreads, TimeUnit expiryUnit) {
        int threads = expiryThreads == null ? 1 : expiryThreads;
        Preconditions.checkArgument(threads > 0, "expiry threads must be positive: %s", threads);
        this.expiryUnit = expiryUnit == null ? TimeUnit.SECONDS : expiryUnit;
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(threads,
                new ThreadFactoryBuilder().setNameFormat("respkv-expiry-%d").setDaemon(true).build());
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler = executor;
    }

    public static MemoryStore create() {
        return builder().build();
    }

    @Override
    public Optional<String> get(@NonNull String key) {
        readWriteLock.readLock().lock();
        try {
            return Optional.ofNullable(map.get(key));
        } finally {
            readWriteLock.readLock().unlock();
        }
    }

    @Override
    public List<Optional<String>> getAll(@NonNull List<String> keys) {
        List<Optional<String>> values = new ArrayList<>(keys.size());
        readWriteLock.readLock().lock();
        try {
            for (String key : keys) {
                values.add(Optional.ofNullable(map.get(key)));
            }
        } finally {
            readWriteLock.readLock().unlock();
        }
        return values;
    }

    @Override
    public Optional<String> put(@NonNull String key, @NonNull String value) {
        readWriteLock.writeLock().lock();
        try {
            return Optional.ofNullable(map.put(key, value));
        } finally {
            readWriteLock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(@NonNull String key) {
        readWriteLock.writeLock().lock();
        try {
            return map.remove(key) != null;
        } finally {
            readWriteLock.writeLock().unlock();
        }
    }

    @Override
    public void expire(@NonNull String key, long delay) {
        Preconditions.checkArgument(delay >= 0, "delay must not be negative: %s", delay);
        scheduler.schedule(() -> {
            if (remove(key)) {
                logger.debug("key {} expired.", key);
            }
        }, delay, expiryUnit);
        logger.debug("key {} scheduled to expire in {} {}.", key, delay, expiryUnit);
    }

    @Override
    public int size() {
        readWriteLock.readLock().lock();
        try {
            return map.size();
        } finally {
            readWriteLock.readLock().unlock();
        }
    }

    /**
     * 停止调度线程，未到期的删除任务被丢弃。
     */
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
