package site.minikv.aof;

import site.minikv.protocol.RespArray;

/**
 * 日志重放时执行单条命令的回调
 *
 * <p>由服务端提供，持久化模块本身不理解命令语义。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandExecutor {

    /**
     * 执行一条从日志中读出的请求
     *
     * @param command 原始请求数组
     * @return 命令可识别并已执行返回true；无法识别的命令返回false，由调用者决定如何处理
     * @throws AofReplayException 命令可以识别但参数不合法
     */
    boolean executeCommand(RespArray command);
}
