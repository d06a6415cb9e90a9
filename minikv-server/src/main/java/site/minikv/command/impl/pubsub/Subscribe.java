package site.minikv.command.impl.pubsub;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.Ignore;
import site.minikv.protocol.Resp;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

import java.util.List;

public class Subscribe implements Command {
    private final RedisContext context;
    private List<RedisBytes> channels;

    public Subscribe(final RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.SUBSCRIBE;
    }

    @Override
    public void setContext(final Resp[] array) {
        channels = CommandArgs.bytesFrom(array, 1);
    }

    @Override
    public Resp handle(final ReplySink sink) {
        // 订阅确认已直接写给出口
        context.getPubSub().subscribe(channels, sink);
        return Ignore.INSTANCE;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
