package site.minikv.store;

import lombok.Getter;
import site.minikv.datastructure.RedisBytes;

/**
 * 存储条目：值与可选的过期时间
 *
 * <p>过期时间为毫秒级Unix时间戳，{@link #NO_EXPIRE} 表示永不过期。
 * 过期时间小于等于当前时间的条目在语义上已不存在，即使它仍在哈希表中。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public final class StoreEntry {
    /** 永不过期 */
    public static final long NO_EXPIRE = -1L;

    private final RedisBytes value;

    private final long expireAt;

    public StoreEntry(final RedisBytes value, final long expireAt) {
        if (value == null) {
            throw new IllegalArgumentException("value 不能为null");
        }
        this.value = value;
        this.expireAt = expireAt;
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    /**
     * 判断条目在给定时刻是否已过期
     *
     * @param nowMillis 当前时间（毫秒）
     * @return 已过期返回true
     */
    public boolean isExpired(final long nowMillis) {
        return hasExpire() && expireAt <= nowMillis;
    }
}
