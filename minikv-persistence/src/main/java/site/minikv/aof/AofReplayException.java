package site.minikv.aof;

/**
 * 日志记录可以识别但无法执行
 *
 * <p>由 {@link CommandExecutor} 抛出，加载器会把它转换为带记录偏移的加载失败。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class AofReplayException extends RuntimeException {

    public AofReplayException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
