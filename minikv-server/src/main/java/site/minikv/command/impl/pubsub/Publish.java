package site.minikv.command.impl.pubsub;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

public class Publish implements Command {
    private final RedisContext context;
    private RedisBytes channel;
    private RedisBytes message;

    public Publish(final RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.PUBLISH;
    }

    @Override
    public void setContext(final Resp[] array) {
        channel = CommandArgs.bytes(array[1]);
        message = CommandArgs.bytes(array[2]);
    }

    @Override
    public Resp handle(final ReplySink sink) {
        return RespInteger.valueOf(context.getPubSub().publish(channel, message));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
