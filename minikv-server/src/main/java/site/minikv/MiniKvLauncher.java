package site.minikv;

import lombok.extern.slf4j.Slf4j;
import site.minikv.server.MiniKvServer;
import site.minikv.server.RedisServer;
import site.minikv.server.config.RedisServerConfig;

/**
 * 启动入口
 *
 * <p>支持的参数：{@code --port <n>}、{@code --aof <path>}、{@code --host <addr>}
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class MiniKvLauncher {

    public static void main(final String[] args) throws Exception {
        final RedisServerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("参数错误: {}", e.getMessage());
            log.error("用法: MiniKvLauncher [--port <n>] [--aof <path>] [--host <addr>]");
            System.exit(2);
            return;
        }

        final RedisServer redisServer = new MiniKvServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            redisServer.stop();
            log.info("服务器已安全关闭");
        }, "minikv-shutdown"));

        redisServer.start();
    }

    /**
     * 解析命令行参数
     *
     * @param args 命令行参数
     * @return 服务器配置
     * @throws IllegalArgumentException 未知参数、缺少参数值或端口不是数字
     */
    public static RedisServerConfig parseArgs(final String[] args) {
        final RedisServerConfig.RedisServerConfigBuilder builder = RedisServerConfig.builder();
        for (int i = 0; i < args.length; i++) {
            final String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("参数缺少值: " + flag);
            }
            final String value = args[++i];
            switch (flag) {
                case "--port":
                    try {
                        builder.port(Integer.parseInt(value));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("端口必须是数字: " + value, e);
                    }
                    break;
                case "--aof":
                    builder.aofFileName(value);
                    break;
                case "--host":
                    builder.host(value);
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + flag);
            }
        }
        final RedisServerConfig config = builder.build();
        config.validate();
        return config;
    }
}
