package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP错误消息类型
 *
 * <p>格式为 "-ERR message\r\n"，例如 "-ERR unknown command 'FOO'"。
 * 错误回复不会关闭连接，客户端可以继续发送命令。
 *
 * <p>错误文本可能带有客户端输入（例如未知的命令名），其中的 CR、LF 替换为空格，
 * 保证一个错误只编码为一行。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    public Errors(final String content) {
        this.content = singleLine(content);
    }

    private static String singleLine(final String text) {
        if (text == null || (text.indexOf('\r') < 0 && text.indexOf('\n') < 0)) {
            return text;
        }
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "-" + content;
    }
}
