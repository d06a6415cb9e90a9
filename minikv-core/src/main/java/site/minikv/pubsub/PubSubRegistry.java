package site.minikv.pubsub;

import lombok.extern.slf4j.Slf4j;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespInteger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 发布订阅注册表
 *
 * <p>维护频道到订阅出口列表的映射，由读写锁保护：
 * <ul>
 *     <li>订阅 - 持有写锁登记出口，并立即向出口写出订阅确认</li>
 *     <li>发布 - 持有读锁获取出口快照，释放锁后逐个投递</li>
 *     <li>连接关闭 - {@link #unsubscribeAll(ReplySink)} 把出口从所有频道移除</li>
 * </ul>
 *
 * <p>发布返回的是尝试投递的出口数量，单个出口投递失败不会减少这个数。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class PubSubRegistry {
    private static final BulkString SUBSCRIBE = BulkString.fromString("subscribe");

    private static final BulkString MESSAGE = BulkString.fromString("message");

    private final Map<RedisBytes, List<ReplySink>> channels = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 订阅一组频道
     *
     * <p>对每个频道按顺序登记出口，并发送 ["subscribe", 频道, i]，i为本次调用中从1开始的序号。
     *
     * @param channelNames 频道名列表
     * @param sink 订阅者出口
     */
    public void subscribe(final List<RedisBytes> channelNames, final ReplySink sink) {
        lock.writeLock().lock();
        try {
            int index = 0;
            for (final RedisBytes channel : channelNames) {
                channels.computeIfAbsent(channel, k -> new ArrayList<>()).add(sink);
                index++;
                sink.send(RespArray.valueOf(SUBSCRIBE, BulkString.create(channel), RespInteger.valueOf(index)));
                log.debug("订阅频道 {} -> {}", channel, sink);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 向频道发布消息
     *
     * @param channel 频道名
     * @param message 消息内容
     * @return 尝试投递的订阅出口数量
     */
    public int publish(final RedisBytes channel, final RedisBytes message) {
        final List<ReplySink> snapshot;
        lock.readLock().lock();
        try {
            final List<ReplySink> sinks = channels.get(channel);
            if (sinks == null || sinks.isEmpty()) {
                return 0;
            }
            snapshot = new ArrayList<>(sinks);
        } finally {
            lock.readLock().unlock();
        }

        final RespArray payload = RespArray.valueOf(MESSAGE, BulkString.create(channel), BulkString.create(message));
        for (final ReplySink sink : snapshot) {
            try {
                sink.send(payload);
            } catch (RuntimeException e) {
                log.warn("向订阅者 {} 投递频道 {} 的消息失败: {}", sink, channel, e.getMessage());
            }
        }
        return snapshot.size();
    }

    /**
     * 从所有频道移除某个出口，连接关闭时调用
     *
     * @param sink 订阅者出口
     * @return 移除的登记数
     */
    public int unsubscribeAll(final ReplySink sink) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            final Iterator<Map.Entry<RedisBytes, List<ReplySink>>> it = channels.entrySet().iterator();
            while (it.hasNext()) {
                final List<ReplySink> sinks = it.next().getValue();
                while (sinks.remove(sink)) {
                    removed++;
                }
                if (sinks.isEmpty()) {
                    it.remove();
                }
            }
            if (removed > 0) {
                log.debug("出口 {} 已从 {} 个订阅中移除", sink, removed);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int channelCount() {
        lock.readLock().lock();
        try {
            return channels.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriberCount(final RedisBytes channel) {
        lock.readLock().lock();
        try {
            final List<ReplySink> sinks = channels.get(channel);
            return sinks == null ? 0 : sinks.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
