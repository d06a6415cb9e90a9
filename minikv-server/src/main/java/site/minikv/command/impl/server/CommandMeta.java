package site.minikv.command.impl.server;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.pubsub.ReplySink;

/**
 * COMMAND 命令，客户端库连接时会查询，返回空数组即可
 */
public class CommandMeta implements Command {

    @Override
    public CommandType getType() {
        return CommandType.COMMAND;
    }

    @Override
    public void setContext(final Resp[] array) {
    }

    @Override
    public Resp handle(final ReplySink sink) {
        return RespArray.EMPTY;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
