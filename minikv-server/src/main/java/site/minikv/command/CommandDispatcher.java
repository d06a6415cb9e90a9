package site.minikv.command;

import lombok.extern.slf4j.Slf4j;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 命令分发器，把一个请求值路由到对应的命令实现。
 *
 * <p>处理流程：
 * <ul>
 *   <li>非数组或空数组直接跳过，不回复
 *   <li>按命令名（大小写不敏感）查找命令，不存在时返回错误，连接保持可用
 *   <li>校验参数个数，解析参数
 *   <li>写命令先追加到日志再执行，追加失败时不执行
 *   <li>执行命令并返回回复
 * </ul>
 *
 * <p>写命令的追加与执行在同一把锁内完成，日志中的记录顺序与内存中的执行顺序一致。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    private static final Errors AOF_WRITE_FAILED = new Errors("ERR AOF write failed");

    private static final Errors INTERNAL_ERROR = new Errors("ERR internal error");

    private final RedisContext context;

    private final ReentrantLock writeLock = new ReentrantLock();

    public CommandDispatcher(final RedisContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Redis上下文不能为null");
        }
        this.context = context;
    }

    /**
     * 分发一个请求
     *
     * @param msg  解码得到的请求值
     * @param sink 当前连接的出口
     * @return 需要写回的回复；返回null表示不需要回复
     */
    public Resp dispatch(final Resp msg, final ReplySink sink) {
        if (!(msg instanceof RespArray) || ((RespArray) msg).size() == 0) {
            log.debug("跳过非命令请求: {}", msg);
            return null;
        }
        final RespArray request = (RespArray) msg;
        final Resp[] array = request.getContent();
        try {
            final RedisBytes name = CommandArgs.bytes(array[0]);
            final CommandType type = CommandType.findByBytes(name);
            if (type == null) {
                throw CommandException.unknownCommand(name.toUpperCaseString());
            }
            type.checkArity(array.length);
            final Command command = type.createCommand(context);
            command.setContext(array);

            if (command.isWriteCommand() && context.isAofEnabled()) {
                return executeLogged(command, request, sink);
            }
            return command.handle(sink);
        } catch (CommandException e) {
            return new Errors(e.getMessage());
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", describe(array[0]), e);
            return INTERNAL_ERROR;
        }
    }

    private Resp executeLogged(final Command command, final RespArray request, final ReplySink sink) {
        writeLock.lock();
        try {
            try {
                context.appendAof(request);
            } catch (IOException e) {
                log.error("[AOF] 追加失败，命令未执行: {}, 错误: {}", command.getType(), e.getMessage(), e);
                return AOF_WRITE_FAILED;
            }
            return command.handle(sink);
        } finally {
            writeLock.unlock();
        }
    }

    private static String describe(final Resp name) {
        if (name instanceof BulkString && !((BulkString) name).isNull()) {
            return ((BulkString) name).getContent().getString();
        }
        return String.valueOf(name);
    }
}
