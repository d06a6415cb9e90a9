package site.minikv.command.impl.string;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

public class Get implements Command {
    private final RedisContext context;
    private RedisBytes key;

    public Get(final RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
    }

    @Override
    public Resp handle(final ReplySink sink) {
        return BulkString.create(context.getStore().get(key));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
