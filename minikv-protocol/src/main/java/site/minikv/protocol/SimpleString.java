package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP简单字符串类型
 *
 * <p>单行文本，不能包含 {@code \r} 或 {@code \n}。常用回复使用预定义常量。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class SimpleString extends Resp {
    public static final SimpleString OK = new SimpleString("OK");

    public static final SimpleString PONG = new SimpleString("PONG");

    private final String content;

    public SimpleString(final String content) {
        this.content = content;
    }

    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "+" + content;
    }
}
