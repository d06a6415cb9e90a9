package site.minikv.command.impl.server;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;
import site.minikv.pubsub.ReplySink;

public class Client implements Command {

    @Override
    public CommandType getType() {
        return CommandType.CLIENT;
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
