package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * RESP数组类型
 *
 * <p>有序的RESP值序列，元素可以是任意RESP类型（包括嵌套数组）。
 * 客户端请求总是以批量字符串数组的形式发送，追加日志中记录的也是这个数组的原始编码。
 *
 * <p>编码时整个数组（包括所有嵌套元素）写入同一个缓冲区，
 * 交给连接时是一次完整的写出，不会与同一连接上的其他回复交错。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class RespArray extends Resp {
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 数组内容 */
    private final Resp[] content;

    public RespArray(final Resp[] content) {
        if (content == null) {
            throw new IllegalArgumentException("数组内容不能为null");
        }
        this.content = content;
    }

    public static RespArray valueOf(final Resp... content) {
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    /**
     * 由字符串构造批量字符串数组，常用于构造命令请求和推送消息
     *
     * @param parts 各元素的字符串内容
     * @return RespArray实例
     */
    public static RespArray ofBulkStrings(final String... parts) {
        final Resp[] content = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            content[i] = BulkString.fromString(parts[i]);
        }
        return valueOf(content);
    }

    public int size() {
        return content.length;
    }

    public Resp get(final int index) {
        return content[index];
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        // 1. 写入数组标识符与长度
        byteBuf.writeByte('*');
        writeIntegerAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);

        // 2. 按顺序编码所有元素
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public String toString() {
        return Arrays.toString(content);
    }
}
