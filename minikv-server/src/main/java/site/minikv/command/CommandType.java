package site.minikv.command;

import lombok.Getter;
import site.minikv.command.impl.Echo;
import site.minikv.command.impl.Ping;
import site.minikv.command.impl.Select;
import site.minikv.command.impl.key.Del;
import site.minikv.command.impl.key.Exists;
import site.minikv.command.impl.key.Ttl;
import site.minikv.command.impl.pubsub.Publish;
import site.minikv.command.impl.pubsub.Subscribe;
import site.minikv.command.impl.server.Client;
import site.minikv.command.impl.server.CommandMeta;
import site.minikv.command.impl.server.Info;
import site.minikv.command.impl.string.Get;
import site.minikv.command.impl.string.Set;
import site.minikv.datastructure.RedisBytes;
import site.minikv.server.context.RedisContext;

import java.util.HashMap;
import java.util.Map;

/**
 * 命令类型枚举，定义系统支持的所有命令。
 *
 * <p>每个命令登记了名称和参数个数约束（沿用Redis的arity约定）：
 * <ul>
 *   <li>正数 - 请求数组长度必须恰好等于该值（包括命令名）
 *   <li>负数 - 请求数组长度至少为其绝对值
 * </ul>
 *
 * <p>命令名查找大小写不敏感。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 连接命令 ==========
    /** PING命令：测试服务器连接 */
    PING("PING", -1),
    /** ECHO命令：原样返回参数 */
    ECHO("ECHO", 2),
    /** SELECT命令：选择数据库（只接受，不切换） */
    SELECT("SELECT", 2),

    // ========== 字符串命令 ==========
    /** SET命令：设置键值对，可带过期时间 */
    SET("SET", -3),
    /** GET命令：获取键值 */
    GET("GET", 2),

    // ========== 键命令 ==========
    /** DEL命令：删除键 */
    DEL("DEL", -2),
    /** EXISTS命令：统计存在的键 */
    EXISTS("EXISTS", -2),
    /** TTL命令：获取键的剩余生存时间 */
    TTL("TTL", 2),

    // ========== 发布订阅命令 ==========
    /** SUBSCRIBE命令：订阅频道 */
    SUBSCRIBE("SUBSCRIBE", -2),
    /** PUBLISH命令：向频道发布消息 */
    PUBLISH("PUBLISH", 3),

    // ========== 服务器命令 ==========
    /** COMMAND命令：命令元信息，返回空数组 */
    COMMAND("COMMAND", -1),
    /** CLIENT命令：客户端设置，总是成功 */
    CLIENT("CLIENT", -1),
    /** INFO命令：获取服务器信息 */
    INFO("INFO", -1);

    private static final Map<String, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandName, type);
        }
    }

    private final String commandName;

    private final int arity;

    CommandType(final String commandName, final int arity) {
        this.commandName = commandName;
        this.arity = arity;
    }

    /**
     * 根据命令名查找命令类型，大小写不敏感
     *
     * @param commandBytes 命令名
     * @return 对应的CommandType，不存在则返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        return COMMAND_CACHE.get(commandBytes.toUpperCaseString());
    }

    /**
     * 校验请求数组长度
     *
     * @param argc 请求数组长度（包括命令名）
     * @throws CommandException 参数个数不符合约束
     */
    public void checkArity(final int argc) {
        if ((arity > 0 && argc != arity) || (arity < 0 && argc < -arity)) {
            throw CommandException.wrongArity(commandName);
        }
    }

    /**
     * 创建命令实例
     *
     * @param context 服务器上下文
     * @return 新的命令实例
     */
    public Command createCommand(final RedisContext context) {
        switch (this) {
            case PING:
                return new Ping();
            case ECHO:
                return new Echo();
            case SELECT:
                return new Select();
            case SET:
                return new Set(context);
            case GET:
                return new Get(context);
            case DEL:
                return new Del(context);
            case EXISTS:
                return new Exists(context);
            case TTL:
                return new Ttl(context);
            case SUBSCRIBE:
                return new Subscribe(context);
            case PUBLISH:
                return new Publish(context);
            case COMMAND:
                return new CommandMeta();
            case CLIENT:
                return new Client();
            case INFO:
                return new Info(context);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
