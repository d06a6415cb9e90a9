package site.minikv.protocol;

import lombok.Getter;

/**
 * RESP协议错误
 *
 * <p>解码过程中遇到不符合RESP规范的数据时抛出。协议错误对连接是致命的，
 * 解码器捕获后关闭连接，不做重试。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class RespProtocolException extends RuntimeException {

    /**
     * 协议错误原因
     */
    public enum Reason {
        /** 无法识别的类型前缀、缺少CRLF或超出长度限制 */
        MALFORMED_FRAME,
        /** 数据流在值的中间结束 */
        TRUNCATED,
        /** 长度或数值字段不是合法的十进制整数 */
        INVALID_INTEGER
    }

    private final Reason reason;

    public RespProtocolException(final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }
}
