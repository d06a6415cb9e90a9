package site.minikv.command.impl;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;
import site.minikv.pubsub.ReplySink;

/**
 * 只有一个键空间，SELECT 直接返回成功，保证客户端库的初始化流程能通过
 */
public class Select implements Command {

    @Override
    public CommandType getType() {
        return CommandType.SELECT;
    }

    @Override
    public void setContext(final Resp[] array) {
    }

    @Override
    public Resp handle(final ReplySink sink) {
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
