package site.minikv.server.context;

import site.minikv.aof.AofManager;
import site.minikv.protocol.RespArray;
import site.minikv.pubsub.PubSubRegistry;
import site.minikv.server.config.RedisServerConfig;
import site.minikv.store.KeyValueStore;

import java.io.IOException;

/**
 * 服务器上下文接口，命令实现通过它访问存储、发布订阅和持久化组件。
 *
 * <p>上下文持有的组件都是注入的服务对象，不使用全局单例，
 * 因此同一个进程内可以同时运行多个相互独立的服务器实例。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface RedisContext {

    // ========== 组件访问 ==========

    KeyValueStore getStore();

    PubSubRegistry getPubSub();

    RedisServerConfig getConfig();

    /**
     * 获取AOF管理器
     *
     * @return AOF管理器，未启用或未启动时返回null
     */
    AofManager getAofManager();

    // ========== 持久化 ==========

    boolean isAofEnabled();

    /**
     * 追加一条写命令到日志，调用者应当在执行命令之前调用
     *
     * @param command 客户端发送的原始请求数组
     * @throws IOException 写入失败
     */
    void appendAof(RespArray command) throws IOException;

    // ========== 生命周期 ==========

    /**
     * 打开并重放日志，随后启动后台任务
     *
     * @throws IOException 日志无法打开或重放失败，服务器不应继续启动
     */
    void startup() throws IOException;

    /**
     * 停止后台任务并关闭日志，可重复调用
     */
    void shutdown();

    boolean isRunning();

    /**
     * @return 上下文创建时刻（毫秒）
     */
    long getStartTime();
}
