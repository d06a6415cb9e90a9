package site.minikv.command.impl.string;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandException;
import site.minikv.command.CommandType;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.context.RedisContext;
import site.minikv.store.StoreEntry;

public class Set implements Command {
    private final RedisContext context;
    private RedisBytes key;
    private RedisBytes value;
    /** 相对过期时间（毫秒），-1 表示不过期 */
    private long ttlMillis = -1;

    public Set(final RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
        value = CommandArgs.bytes(array[2]);

        // 从左到右扫描选项，后出现的覆盖先出现的，无法识别的选项忽略
        int i = 3;
        while (i < array.length) {
            final String option = CommandArgs.bytes(array[i]).getString();
            if ("EX".equalsIgnoreCase(option) || "PX".equalsIgnoreCase(option)) {
                if (i + 1 >= array.length) {
                    throw CommandException.syntaxError();
                }
                final long amount = CommandArgs.parseLong(array[i + 1]);
                if (amount <= 0) {
                    throw CommandException.invalidExpireTime(getType().getCommandName());
                }
                ttlMillis = "EX".equalsIgnoreCase(option) ? toMillis(amount) : amount;
                i += 2;
            } else {
                i++;
            }
        }
    }

    private long toMillis(final long seconds) {
        try {
            return Math.multiplyExact(seconds, 1000L);
        } catch (ArithmeticException e) {
            throw CommandException.invalidExpireTime(getType().getCommandName());
        }
    }

    @Override
    public Resp handle(final ReplySink sink) {
        long expireAt = StoreEntry.NO_EXPIRE;
        if (ttlMillis > 0) {
            final long now = context.getStore().currentTimeMillis();
            expireAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
        }
        context.getStore().set(key, value, expireAt);
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
