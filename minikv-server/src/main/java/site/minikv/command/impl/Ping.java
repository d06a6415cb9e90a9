package site.minikv.command.impl;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandException;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;
import site.minikv.pubsub.ReplySink;

public class Ping implements Command {
    private RedisBytes message;

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length > 2) {
            throw CommandException.wrongArity(getType().getCommandName());
        }
        if (array.length == 2) {
            message = CommandArgs.bytes(array[1]);
        }
    }

    @Override
    public Resp handle(final ReplySink sink) {
        if (message == null) {
            return SimpleString.PONG;
        }
        final String text = message.getString();
        // 简单字符串不能携带换行
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            return BulkString.create(message);
        }
        return SimpleString.valueOf(text);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
