package site.minikv.command;

/**
 * 命令级错误
 *
 * <p>消息即返回给客户端的错误文本（不含前缀 '-'），连接保持可用。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class CommandException extends RuntimeException {

    public CommandException(final String message) {
        super(message);
    }

    public static CommandException wrongArity(final String commandName) {
        return new CommandException("ERR wrong number of arguments for '"
                + commandName.toLowerCase() + "' command");
    }

    public static CommandException syntaxError() {
        return new CommandException("ERR syntax error");
    }

    public static CommandException notAnInteger() {
        return new CommandException("ERR value is not an integer or out of range");
    }

    public static CommandException unknownCommand(final String commandName) {
        return new CommandException("ERR unknown command '" + commandName + "'");
    }

    public static CommandException invalidExpireTime(final String commandName) {
        return new CommandException("ERR invalid expire time in '" + commandName.toLowerCase() + "' command");
    }

    public static CommandException notBulkString() {
        return new CommandException("ERR Protocol error: expected bulk string argument");
    }
}
