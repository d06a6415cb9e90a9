package site.minikv.command.impl;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.pubsub.ReplySink;

public class Echo implements Command {
    private RedisBytes message;

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public void setContext(final Resp[] array) {
        message = CommandArgs.bytes(array[1]);
    }

    @Override
    public Resp handle(final ReplySink sink) {
        return BulkString.create(message);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
