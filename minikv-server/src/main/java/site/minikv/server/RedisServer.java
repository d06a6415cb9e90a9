package site.minikv.server;

import site.minikv.server.context.RedisContext;

import java.io.IOException;

/**
 * 服务器生命周期接口
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface RedisServer {

    /**
     * 启动服务器：打开并重放日志，启动后台任务，然后开始接受连接。
     *
     * @throws IOException 日志无法打开、重放失败或端口绑定失败
     */
    void start() throws IOException;

    /**
     * 优雅停止服务器：先停止接受连接，再停止后台任务，最后关闭日志。可重复调用。
     */
    void stop();

    RedisContext getRedisContext();
}
