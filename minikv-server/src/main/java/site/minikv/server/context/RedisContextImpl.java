package site.minikv.server.context;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.aof.AofManager;
import site.minikv.command.ReplayCommandExecutor;
import site.minikv.protocol.RespArray;
import site.minikv.pubsub.PubSubRegistry;
import site.minikv.server.config.RedisServerConfig;
import site.minikv.store.ExpirationSweeper;
import site.minikv.store.InMemoryKeyValueStore;
import site.minikv.store.KeyValueStore;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 服务器上下文实现
 *
 * <p>启动顺序：打开日志、重放、启动刷盘任务、启动过期清理。
 * 关闭顺序相反：先停止过期清理，再关闭日志。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedisContextImpl implements RedisContext {

    private final RedisServerConfig config;

    private final KeyValueStore store;

    private final PubSubRegistry pubSub;

    private final ExpirationSweeper sweeper;

    private final long startTime;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile AofManager aofManager;

    public RedisContextImpl(final RedisServerConfig config) {
        this(config, new InMemoryKeyValueStore());
    }

    public RedisContextImpl(final RedisServerConfig config, final KeyValueStore store) {
        if (config == null || store == null) {
            throw new IllegalArgumentException("配置和存储不能为null");
        }
        this.config = config;
        this.store = store;
        this.pubSub = new PubSubRegistry();
        this.sweeper = new ExpirationSweeper(store, config.getExpireSweepIntervalMs(),
                config.getExpireSweepSampleSize());
        this.startTime = System.currentTimeMillis();
    }

    @Override
    public boolean isAofEnabled() {
        return config.isAofEnabled();
    }

    @Override
    public void appendAof(final RespArray command) throws IOException {
        final AofManager manager = aofManager;
        if (manager == null) {
            throw new IOException("AOF未打开");
        }
        manager.append(command);
    }

    @Override
    public void startup() throws IOException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("RedisContext启动中...");
        try {
            if (config.isAofEnabled()) {
                final AofManager manager = new AofManager(config.getAofFileName(),
                        config.getAofSyncPolicy(), config.getAofSyncIntervalMs());
                try {
                    final int replayed = manager.load(new ReplayCommandExecutor(this));
                    log.info("AOF重放完成，共执行{}条命令，当前键数量: {}", replayed, store.size());
                } catch (IOException | RuntimeException e) {
                    manager.close();
                    throw e;
                }
                manager.startSync();
                this.aofManager = manager;
            }
            sweeper.start();
        } catch (IOException | RuntimeException e) {
            running.set(false);
            log.error("RedisContext启动失败: {}", e.getMessage());
            throw e;
        }
        log.info("RedisContext启动完成");
    }

    @Override
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("RedisContext关闭中...");
        sweeper.stop();
        final AofManager manager = aofManager;
        if (manager != null) {
            try {
                manager.close();
            } catch (IOException e) {
                log.error("关闭AOF失败: {}", e.getMessage(), e);
            }
        }
        log.info("RedisContext关闭完成");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
