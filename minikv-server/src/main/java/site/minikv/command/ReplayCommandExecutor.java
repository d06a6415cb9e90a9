package site.minikv.command;

import site.minikv.aof.AofReplayException;
import site.minikv.aof.CommandExecutor;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

/**
 * 日志重放时的命令执行器
 *
 * <p>直接执行命令，不再追加日志，回复丢弃。
 * 日志中的记录在写入时已经通过校验，重放时校验失败说明日志损坏，抛出异常中止启动。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class ReplayCommandExecutor implements CommandExecutor {

    private final RedisContext context;

    public ReplayCommandExecutor(final RedisContext context) {
        this.context = context;
    }

    @Override
    public boolean executeCommand(final RespArray command) {
        final Resp[] array = command.getContent();
        final RedisBytes name = ((BulkString) array[0]).getContent();
        final CommandType type = CommandType.findByBytes(name);
        if (type == null) {
            return false;
        }
        try {
            type.checkArity(array.length);
            final Command cmd = type.createCommand(context);
            cmd.setContext(array);
            cmd.handle(ReplySink.NOOP);
        } catch (CommandException e) {
            throw new AofReplayException(command.get(0) + ": " + e.getMessage(), e);
        }
        return true;
    }
}
