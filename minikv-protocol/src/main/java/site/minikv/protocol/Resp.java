package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * RESP协议值的基础类
 *
 * <p>所有RESP数据类型的抽象父类，提供统一的编码入口和流式解码实现。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头，64位有符号</li>
 *     <li>批量字符串 - 以"$"开头，"$-1"表示Null</li>
 *     <li>数组 - 以"*"开头，"*0"为空数组</li>
 * </ul>
 *
 * <p>解码语义：
 * <ul>
 *     <li>完整的值 - 返回该值，读索引前移到值之后</li>
 *     <li>数据不完整 - 返回null并恢复读索引，等待更多数据</li>
 *     <li>格式错误 - 恢复读索引并抛出 {@link RespProtocolException}</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[512][];

    private static final int MAX_CACHED_NUMBER = 255;

    static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;
    static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 写入十进制整数，常用小整数走缓存
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeIntegerAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 将当前值完整编码到缓冲区，数组按顺序递归编码其元素
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 从缓冲区解码一个完整的RESP值
     *
     * @param buffer 输入缓冲区
     * @return 解码后的值，数据不完整时返回null
     * @throws RespProtocolException 数据不符合RESP规范时
     */
    public static Resp decode(final ByteBuf buffer) {
        if (buffer.readableBytes() <= 0) {
            return null;
        }

        // 保存初始读索引，以便出错时回滚
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeValue(buffer);
        } catch (IncompleteFrame e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (RespProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decodeValue(final ByteBuf buffer) {
        if (!buffer.isReadable()) {
            throw IncompleteFrame.INSTANCE;
        }
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case '+':
                return new SimpleString(readLine(buffer));
            case '-':
                return new Errors(readLine(buffer));
            case ':':
                return RespInteger.valueOf(readNumber(buffer));
            case '$':
                return decodeBulkString(buffer);
            case '*':
                return decodeArray(buffer);
            default:
                log.warn("无法识别的RESP类型标识: 字节值 {}", typeIndicator & 0xFF);
                throw new RespProtocolException(RespProtocolException.Reason.MALFORMED_FRAME,
                        "unknown RESP type prefix: " + (typeIndicator & 0xFF));
        }
    }

    private static Resp decodeBulkString(final ByteBuf buffer) {
        final long length = readNumber(buffer);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0) {
            throw new RespProtocolException(RespProtocolException.Reason.INVALID_INTEGER,
                    "invalid bulk length: " + length);
        }
        if (length > PROTO_MAX_BULK_LEN) {
            throw new RespProtocolException(RespProtocolException.Reason.MALFORMED_FRAME,
                    "bulk length exceeds limit: " + length);
        }
        final int len = (int) length;
        if (buffer.readableBytes() < len + 2) {
            throw IncompleteFrame.INSTANCE;
        }
        final byte[] content = new byte[len];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new RespProtocolException(RespProtocolException.Reason.MALFORMED_FRAME,
                    "bulk string not terminated by CRLF");
        }
        return BulkString.wrapTrusted(content);
    }

    private static Resp decodeArray(final ByteBuf buffer) {
        final long count = readNumber(buffer);
        if (count == -1) {
            return BulkString.NULL;
        }
        if (count < 0) {
            throw new RespProtocolException(RespProtocolException.Reason.INVALID_INTEGER,
                    "invalid array length: " + count);
        }
        if (count > PROTO_MAX_ARRAY_LEN) {
            throw new RespProtocolException(RespProtocolException.Reason.MALFORMED_FRAME,
                    "array length exceeds limit: " + count);
        }
        if (count == 0) {
            return RespArray.EMPTY;
        }
        final Resp[] array = new Resp[(int) count];
        for (int i = 0; i < array.length; i++) {
            array[i] = decodeValue(buffer);
        }
        return new RespArray(array);
    }

    /**
     * 读取到 \r\n 为止的一行文本，用于简单字符串和错误消息
     */
    private static String readLine(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer);
        final String result = buffer.toString(startIndex, endIndex - startIndex, StandardCharsets.UTF_8);
        buffer.readerIndex(endIndex + 2);
        return result;
    }

    /**
     * 读取到 \r\n 为止的十进制整数，用于整数值和长度字段
     */
    private static long readNumber(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer);
        final int length = endIndex - startIndex;
        if (length == 0) {
            throw new RespProtocolException(RespProtocolException.Reason.INVALID_INTEGER, "empty integer field");
        }

        int i = startIndex;
        final boolean negative = buffer.getByte(i) == '-';
        if (negative || buffer.getByte(i) == '+') {
            i++;
        }
        if (i == endIndex) {
            throw new RespProtocolException(RespProtocolException.Reason.INVALID_INTEGER, "sign without digits");
        }
        long value = 0;
        for (; i < endIndex; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new RespProtocolException(RespProtocolException.Reason.INVALID_INTEGER,
                        "non-digit character in integer field");
            }
            // 按负数累加，Long.MIN_VALUE 也能表示
            final long next = value * 10 - (b - '0');
            if (value < Long.MIN_VALUE / 10 || next > value) {
                throw new RespProtocolException(RespProtocolException.Reason.INVALID_INTEGER,
                        "integer field out of range");
            }
            value = next;
        }
        if (!negative) {
            if (value == Long.MIN_VALUE) {
                throw new RespProtocolException(RespProtocolException.Reason.INVALID_INTEGER,
                        "integer field out of range");
            }
            value = -value;
        }

        buffer.readerIndex(endIndex + 2);
        return value;
    }

    /**
     * 查找当前行的 '\r' 位置，并校验其后紧跟 '\n'
     */
    private static int findLineEnd(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = buffer.indexOf(startIndex, buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0 || endIndex + 1 >= buffer.writerIndex()) {
            throw IncompleteFrame.INSTANCE;
        }
        if (buffer.getByte(endIndex + 1) != '\n') {
            throw new RespProtocolException(RespProtocolException.Reason.MALFORMED_FRAME,
                    "expected \\n after \\r");
        }
        return endIndex;
    }

    /**
     * 数据不完整的内部信号，不会逃逸出 {@link #decode(ByteBuf)}
     */
    private static final class IncompleteFrame extends RuntimeException {
        private static final IncompleteFrame INSTANCE = new IncompleteFrame();

        private IncompleteFrame() {
            super("incomplete frame", null, false, false);
        }
    }
}
