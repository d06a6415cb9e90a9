package site.minikv.command;

import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;

import java.util.ArrayList;
import java.util.List;

/**
 * 命令参数解析工具
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class CommandArgs {

    private CommandArgs() {
    }

    /**
     * 取出批量字符串参数的内容
     *
     * @throws CommandException 参数不是非空的批量字符串
     */
    public static RedisBytes bytes(final Resp arg) {
        if (!(arg instanceof BulkString) || ((BulkString) arg).isNull()) {
            throw CommandException.notBulkString();
        }
        return ((BulkString) arg).getContent();
    }

    /**
     * 取出从 from 开始的所有参数
     */
    public static List<RedisBytes> bytesFrom(final Resp[] array, final int from) {
        final List<RedisBytes> result = new ArrayList<>(Math.max(0, array.length - from));
        for (int i = from; i < array.length; i++) {
            result.add(bytes(array[i]));
        }
        return result;
    }

    /**
     * 解析十进制64位整数参数
     *
     * @throws CommandException 不是合法整数
     */
    public static long parseLong(final Resp arg) {
        final String text = bytes(arg).getString();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw CommandException.notAnInteger();
        }
    }
}
