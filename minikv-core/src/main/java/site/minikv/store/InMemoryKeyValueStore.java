package site.minikv.store;

import lombok.extern.slf4j.Slf4j;
import site.minikv.datastructure.RedisBytes;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于HashMap的内存键值存储
 *
 * <p>一把互斥锁保护整个哈希表，所有读写操作都在锁内完成。
 *
 * <p>过期处理：
 * <ul>
 *     <li>惰性过期 - GET/EXISTS/TTL/DEL 遇到过期条目时删除它，这是权威的过期判断</li>
 *     <li>主动过期 - {@link ExpirationSweeper} 周期调用 {@link #evictExpired(int)}，
 *     从带过期时间的键中随机抽样清理，只是内存优化</li>
 * </ul>
 *
 * <p>带过期时间的键额外记录在一个可随机访问的列表中，删除时与末尾元素交换，
 * 抽样和维护都是O(1)。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<RedisBytes, StoreEntry> data = new HashMap<>();

    /** 带过期时间的键，用于随机抽样 */
    private final List<RedisBytes> expiringKeys = new ArrayList<>();

    /** 键在 expiringKeys 中的下标 */
    private final Map<RedisBytes, Integer> expiringIndex = new HashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final Clock clock;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public void set(final RedisBytes key, final RedisBytes value, final long expireAt) {
        final StoreEntry entry = new StoreEntry(value, expireAt);
        lock.lock();
        try {
            data.put(key, entry);
            if (entry.hasExpire()) {
                trackExpiring(key);
            } else {
                untrackExpiring(key);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RedisBytes get(final RedisBytes key) {
        lock.lock();
        try {
            final StoreEntry entry = liveEntry(key, clock.millis());
            return entry == null ? null : entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int delete(final List<RedisBytes> keys) {
        lock.lock();
        try {
            final long now = clock.millis();
            int deleted = 0;
            for (final RedisBytes key : keys) {
                final StoreEntry removed = remove(key);
                if (removed != null && !removed.isExpired(now)) {
                    deleted++;
                }
            }
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int exists(final List<RedisBytes> keys) {
        lock.lock();
        try {
            final long now = clock.millis();
            int count = 0;
            for (final RedisBytes key : keys) {
                if (liveEntry(key, now) != null) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long timeToLive(final RedisBytes key) {
        lock.lock();
        try {
            final long now = clock.millis();
            final StoreEntry entry = liveEntry(key, now);
            if (entry == null) {
                return -2;
            }
            if (!entry.hasExpire()) {
                return -1;
            }
            return (entry.getExpireAt() - now) / 1000;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int evictExpired(final int sampleSize) {
        lock.lock();
        try {
            final long now = clock.millis();
            final ThreadLocalRandom random = ThreadLocalRandom.current();
            int evicted = 0;
            for (int i = 0; i < sampleSize && !expiringKeys.isEmpty(); i++) {
                final RedisBytes key = expiringKeys.get(random.nextInt(expiringKeys.size()));
                final StoreEntry entry = data.get(key);
                if (entry == null || entry.isExpired(now)) {
                    remove(key);
                    evicted++;
                }
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return data.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    /**
     * 读取未过期的条目，过期条目会被删除。调用者必须持有锁。
     */
    private StoreEntry liveEntry(final RedisBytes key, final long now) {
        final StoreEntry entry = data.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now)) {
            remove(key);
            log.trace("惰性删除过期键: {}", key);
            return null;
        }
        return entry;
    }

    private StoreEntry remove(final RedisBytes key) {
        final StoreEntry removed = data.remove(key);
        if (removed != null && removed.hasExpire()) {
            untrackExpiring(key);
        }
        return removed;
    }

    private void trackExpiring(final RedisBytes key) {
        if (!expiringIndex.containsKey(key)) {
            expiringIndex.put(key, expiringKeys.size());
            expiringKeys.add(key);
        }
    }

    private void untrackExpiring(final RedisBytes key) {
        final Integer index = expiringIndex.remove(key);
        if (index == null) {
            return;
        }
        // 与末尾元素交换后删除末尾
        final int last = expiringKeys.size() - 1;
        final RedisBytes lastKey = expiringKeys.remove(last);
        if (index != last) {
            expiringKeys.set(index, lastKey);
            expiringIndex.put(lastKey, index);
        }
    }
}
