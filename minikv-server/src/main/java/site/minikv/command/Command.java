package site.minikv.command;

import site.minikv.protocol.Resp;
import site.minikv.pubsub.ReplySink;

/**
 * 命令接口，定义所有命令的基本行为。
 *
 * <p>一次命令调用的生命周期：
 * <ul>
 *   <li>{@link #setContext(Resp[])} 解析并校验参数，失败时抛出 {@link CommandException}
 *   <li>分发器根据 {@link #isWriteCommand()} 决定是否先追加到日志
 *   <li>{@link #handle(ReplySink)} 执行命令并返回回复
 * </ul>
 *
 * <p>命令实例只服务一次调用，不需要线程安全。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface Command {

    CommandType getType();

    /**
     * 解析请求参数
     *
     * @param array 完整的请求数组，第0个元素是命令名
     * @throws CommandException 参数数量或格式不正确
     */
    void setContext(Resp[] array);

    /**
     * 执行命令
     *
     * @param sink 当前连接的出口；日志重放时为 {@link ReplySink#NOOP}
     * @return 回复；返回 {@link site.minikv.protocol.Ignore} 表示不需要同步写出回复
     */
    Resp handle(ReplySink sink);

    /**
     * 是否为写命令，写命令在执行前追加到日志
     */
    boolean isWriteCommand();
}
