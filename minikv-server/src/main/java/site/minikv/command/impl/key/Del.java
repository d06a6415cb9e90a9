package site.minikv.command.impl.key;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

import java.util.List;

public class Del implements Command {
    private final RedisContext context;
    private List<RedisBytes> keys;

    public Del(final RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.DEL;
    }

    @Override
    public void setContext(final Resp[] array) {
        keys = CommandArgs.bytesFrom(array, 1);
    }

    @Override
    public Resp handle(final ReplySink sink) {
        return RespInteger.valueOf(context.getStore().delete(keys));
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
