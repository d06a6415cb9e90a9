package site.minikv.aof.writer;

/**
 * AOF 刷盘策略
 *
 * @author hnfy258
 * @since 1.0.0
 */
public enum AofSyncPolicy {
    /**
     * 不主动刷盘，完全依赖操作系统的缓冲区刷新机制。
     * 对应 Redis 的 appendfsync no 配置。
     */
    NO,

    /**
     * 每次追加后立即刷盘，最安全也最慢。
     * 对应 Redis 的 appendfsync always 配置。
     */
    ALWAYS,

    /**
     * 后台线程按固定间隔（默认1秒）刷盘，崩溃时最多丢失一个间隔内的记录。
     */
    EVERYSEC;

    /**
     * 按名称解析策略，忽略大小写
     *
     * @param name 策略名称
     * @return 对应的策略
     * @throws IllegalArgumentException 名称无法识别时
     */
    public static AofSyncPolicy fromName(final String name) {
        for (final AofSyncPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(name)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("未知的AOF刷盘策略: " + name);
    }
}
