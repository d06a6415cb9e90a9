package site.minikv.command.impl.server;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;

public class Info implements Command {
    private static final String VERSION = "1.0.0";

    private final RedisContext context;
    private String section;

    public Info(final RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.INFO;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length > 1) {
            section = CommandArgs.bytes(array[1]).getString().toLowerCase();
        }
    }

    @Override
    public Resp handle(final ReplySink sink) {
        final StringBuilder info = new StringBuilder();
        if (includes("server")) {
            info.append("# Server\r\n");
            info.append("redis_version:").append(VERSION).append("\r\n");
            info.append("redis_mode:standalone\r\n");
            info.append("tcp_port:").append(context.getConfig().getPort()).append("\r\n");
            info.append("uptime_in_seconds:")
                    .append((System.currentTimeMillis() - context.getStartTime()) / 1000).append("\r\n");
            info.append("\r\n");
        }
        if (includes("replication")) {
            info.append("# Replication\r\n");
            info.append("role:master\r\n");
            info.append("\r\n");
        }
        if (includes("persistence")) {
            info.append("# Persistence\r\n");
            info.append("aof_enabled:").append(context.isAofEnabled() ? 1 : 0).append("\r\n");
            info.append("\r\n");
        }
        if (includes("keyspace")) {
            info.append("# Keyspace\r\n");
            info.append("db0:keys=").append(context.getStore().size()).append("\r\n");
        }
        return BulkString.fromString(info.toString());
    }

    private boolean includes(final String name) {
        return section == null || "all".equals(section) || "default".equals(section) || name.equals(section);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
