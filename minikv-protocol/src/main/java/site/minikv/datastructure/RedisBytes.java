package site.minikv.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节数组封装类，用作键、值、频道名与命令参数的统一载体。
 *
 * <p>键值对中的键和值都是二进制安全的字节序列，可以包含任意字节（包括{@code \r\n}），
 * 因此存储层与协议层之间统一使用本类传递数据，而不是直接使用{@link String}。
 *
 * <p>主要特性：
 * <ul>
 *   <li>不可变：公开构造函数执行防御性拷贝</li>
 *   <li>零拷贝：{@link #wrapTrusted(byte[])} 供解码器等可信路径使用</li>
 *   <li>哈希缓存：构造时预计算哈希值，适合作为 HashMap 的键</li>
 *   <li>字符串缓存：延迟初始化字符串表示</li>
 * </ul>
 *
 * <p>线程安全性：本类是不可变的，线程安全。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class RedisBytes {

    /** 字符串编码解码使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 预分配的空字节数组实例 */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    private final byte[] bytes;

    private final int hashCode;

    private volatile String stringValue;

    /**
     * 创建不可变字节数组实例，执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 创建零拷贝实例。
     *
     * <p><b>警告</b>：调用者必须保证参数数组在实例生命周期内不被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 从UTF-8字符串创建实例。
     *
     * @param str 源字符串
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /**
     * 获取底层字节数组的直接引用，仅用于只读场景（编码、写文件）。
     *
     * @return 字节数组的直接引用，调用者不得修改
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取UTF-8字符串表示。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 获取ASCII大写形式的字符串，命令名查找使用。
     *
     * @return 大写字符串
     */
    public String toUpperCaseString() {
        final byte[] upper = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            upper[i] = (b >= 'a' && b <= 'z') ? (byte) (b - 32) : b;
        }
        return new String(upper, CHARSET);
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("RedisBytes[length=").append(bytes.length);
        // 小数据显示预览，不可打印字符转义
        if (bytes.length <= 32) {
            sb.append(", preview='");
            for (int i = 0; i < Math.min(bytes.length, 16); i++) {
                final byte b = bytes[i];
                if (b >= 32 && b <= 126) {
                    sb.append((char) b);
                } else {
                    sb.append("\\x").append(String.format("%02x", b & 0xFF));
                }
            }
            if (bytes.length > 16) {
                sb.append("...");
            }
            sb.append("'");
        }
        sb.append("]");
        return sb.toString();
    }
}
