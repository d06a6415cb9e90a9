package site.minikv.aof.loader;

import lombok.Getter;

import java.io.IOException;

/**
 * 日志重放失败
 *
 * <p>记录解码失败、记录被截断、记录不是命令数组或命令无法执行时抛出，启动过程应当因此中止。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class AofLoadException extends IOException {
    /** 出错记录在文件中的起始偏移 */
    private final long offset;

    public AofLoadException(final String message, final long offset) {
        super(message + " (offset " + offset + ")");
        this.offset = offset;
    }

    public AofLoadException(final String message, final long offset, final Throwable cause) {
        super(message + " (offset " + offset + ")", cause);
        this.offset = offset;
    }
}
