package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.minikv.datastructure.RedisBytes;

import java.nio.charset.StandardCharsets;

/**
 * RESP批量字符串类型
 *
 * <p>二进制安全的字符串，长度字段是权威的，内容可以包含 {@code \r\n}。
 * 内容为null的实例即协议中的Null值（编码为"$-1\r\n"），统一使用 {@link #NULL} 常量。
 *
 * <p>使用建议：
 * <ul>
 *     <li>解码器等可信路径使用 {@link #wrapTrusted(byte[])}</li>
 *     <li>外部数据使用 {@link #create(byte[])} 确保安全性</li>
 *     <li>命令回复使用 {@link #create(RedisBytes)} 直接包装存储中的值</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BulkString extends Resp {
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** Null值 */
    public static final BulkString NULL = new BulkString(null);

    /** 字符串内容，为null时表示Null值 */
    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    /**
     * 安全模式工厂方法，复制输入数组
     *
     * @param content 字节数组内容
     * @return BulkString实例
     */
    public static BulkString create(final byte[] content) {
        if (content == null) {
            return NULL;
        }
        return new BulkString(new RedisBytes(content));
    }

    public static BulkString create(final RedisBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    /**
     * 零拷贝工厂方法，调用者必须保证数组不再被修改
     *
     * @param trustedBytes 受信任的字节数组
     * @return BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.fromString(str));
    }

    /**
     * 是否为Null值
     *
     * @return 内容为null时返回true
     */
    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }

        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        // '$' + 长度 + CRLF + 内容 + CRLF
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeIntegerAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * 获取字符串内容
     *
     * @return 字符串内容，Null值返回null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
