package site.minikv.store;

import site.minikv.datastructure.RedisBytes;

import java.util.List;

/**
 * 键值存储接口
 *
 * <p>所有操作都是线性一致的：每个操作在持有存储锁期间完整执行。
 * 读取类操作遇到已过期的条目时会顺带删除它（惰性过期）。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * 无条件写入，覆盖已有值和过期时间
     *
     * @param key 键
     * @param value 值
     * @param expireAt 过期时间戳（毫秒），{@link StoreEntry#NO_EXPIRE} 表示永不过期
     */
    void set(RedisBytes key, RedisBytes value, long expireAt);

    /**
     * 读取值
     *
     * @param key 键
     * @return 值；从未写入或已过期时返回null
     */
    RedisBytes get(RedisBytes key);

    /**
     * 删除多个键
     *
     * @param keys 键列表
     * @return 删除前存在且未过期的键数量
     */
    int delete(List<RedisBytes> keys);

    /**
     * 统计存在的键，重复出现的键重复计数
     *
     * @param keys 键列表
     * @return 未过期键的数量
     */
    int exists(List<RedisBytes> keys);

    /**
     * 剩余生存时间
     *
     * @param key 键
     * @return -2 不存在或已过期；-1 没有过期时间；否则为剩余秒数（向下取整，可能为0）
     */
    long timeToLive(RedisBytes key);

    /**
     * 随机抽样带过期时间的条目，删除其中已过期的
     *
     * @param sampleSize 本轮最多抽样的条目数
     * @return 本轮删除的条目数
     */
    int evictExpired(int sampleSize);

    /**
     * 物理条目数，包括尚未被清理的过期条目
     */
    int size();

    /**
     * 存储使用的当前时间，过期时间以它为基准
     *
     * @return 当前时间（毫秒）
     */
    long currentTimeMillis();
}
