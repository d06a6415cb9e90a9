package site.minikv.store;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 过期键主动清理任务
 *
 * <p>单个守护线程按固定间隔调用 {@link KeyValueStore#evictExpired(int)}，
 * 每轮最多抽样 sampleSize 个条目。惰性过期才是权威判断，本任务只负责回收内存，
 * 某一轮执行失败只记录日志，不影响后续调度。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class ExpirationSweeper implements AutoCloseable {
    public static final long DEFAULT_INTERVAL_MS = 100;

    public static final int DEFAULT_SAMPLE_SIZE = 20;

    private final KeyValueStore store;

    private final long intervalMs;

    private final int sampleSize;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public ExpirationSweeper(final KeyValueStore store) {
        this(store, DEFAULT_INTERVAL_MS, DEFAULT_SAMPLE_SIZE);
    }

    public ExpirationSweeper(final KeyValueStore store, final long intervalMs, final int sampleSize) {
        if (intervalMs <= 0 || sampleSize <= 0) {
            throw new IllegalArgumentException("清理间隔和抽样数量必须为正数");
        }
        this.store = store;
        this.intervalMs = intervalMs;
        this.sampleSize = sampleSize;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            final Thread thread = new Thread(r);
            thread.setName("Expire-Sweeper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("过期键清理任务已启动，间隔: {}ms，每轮抽样: {}", intervalMs, sampleSize);
    }

    /**
     * 执行一轮清理
     */
    void sweep() {
        try {
            final int evicted = store.evictExpired(sampleSize);
            if (evicted > 0) {
                log.debug("本轮清理过期键: {}", evicted);
            }
        } catch (RuntimeException e) {
            log.error("过期键清理失败", e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("过期键清理任务已停止");
    }

    @Override
    public void close() {
        stop();
    }
}
