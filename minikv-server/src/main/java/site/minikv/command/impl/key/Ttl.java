package site.minikv.command.impl.key;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

public class Ttl implements Command {
    private final RedisContext context;
    private RedisBytes key;

    public Ttl(final RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.TTL;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
    }

    @Override
    public Resp handle(final ReplySink sink) {
        // -2 不存在，-1 永不过期
        return RespInteger.valueOf(context.getStore().timeToLive(key));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
