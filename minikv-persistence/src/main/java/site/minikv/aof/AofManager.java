package site.minikv.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.aof.loader.AofLoader;
import site.minikv.aof.writer.AofSyncPolicy;
import site.minikv.aof.writer.AofWriter;
import site.minikv.aof.writer.Writer;
import site.minikv.protocol.RespArray;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AOF 持久化管理器
 *
 * <p>管理追加日志的整个生命周期：启动时打开（不存在则创建）并重放，
 * 运行期间追加写命令并按策略刷盘，停机时最后一次刷盘并关闭文件。
 *
 * <p>核心功能：
 * <ul>
 *     <li>命令追加 - 把收到的原始请求数组编码后追加到文件末尾</li>
 *     <li>文件加载 - 启动时从头重放日志</li>
 *     <li>定时刷盘 - EVERYSEC 策略下由后台线程周期性 force</li>
 * </ul>
 *
 * <p>追加、刷盘、重放与关闭共用同一把锁，单条记录的字节不会与其他追加或刷盘交错。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class AofManager implements AutoCloseable {
    public static final long DEFAULT_SYNC_INTERVAL_MS = 1000;

    @Getter
    private final String fileName;

    @Getter
    private final AofSyncPolicy syncPolicy;

    private final long syncIntervalMs;

    private final Writer aofWriter;

    private final AofLoader aofLoader;

    /** 追加、刷盘、重放与关闭共用的锁 */
    private final ReentrantLock lock = new ReentrantLock();

    private final ByteBufAllocator allocator = PooledByteBufAllocator.DEFAULT;

    /** 是否有未刷盘的数据 */
    private final AtomicBoolean hasPendingFlush = new AtomicBoolean(false);

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /** 写了一半的记录无法回滚，日志尾部不可信，拒绝后续追加 */
    private volatile boolean failed;

    private ScheduledExecutorService syncScheduler;

    public AofManager(final String fileName) throws IOException {
        this(fileName, AofSyncPolicy.EVERYSEC, DEFAULT_SYNC_INTERVAL_MS);
    }

    public AofManager(final String fileName, final AofSyncPolicy syncPolicy, final long syncIntervalMs)
            throws IOException {
        this(fileName, new AofWriter(new File(fileName)), syncPolicy, syncIntervalMs);
    }

    AofManager(final String fileName, final Writer aofWriter, final AofSyncPolicy syncPolicy,
               final long syncIntervalMs) throws IOException {
        if (syncIntervalMs <= 0) {
            aofWriter.close();
            throw new IllegalArgumentException("刷盘间隔必须为正数: " + syncIntervalMs);
        }
        this.fileName = fileName;
        this.syncPolicy = syncPolicy;
        this.syncIntervalMs = syncIntervalMs;
        this.aofWriter = aofWriter;
        this.aofLoader = new AofLoader(new File(fileName));
        log.info("AofManager初始化完成，文件: {}，刷盘策略: {}", fileName, syncPolicy);
    }

    /**
     * 重放日志，必须在接受连接之前调用
     *
     * @param executor 命令执行回调
     * @return 成功执行的命令数
     * @throws IOException 日志损坏或读取失败，启动应当中止
     */
    public int load(final CommandExecutor executor) throws IOException {
        lock.lock();
        try {
            ensureOpen();
            return aofLoader.load(executor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 启动后台刷盘任务，仅 EVERYSEC 策略生效
     */
    public void startSync() {
        if (syncPolicy != AofSyncPolicy.EVERYSEC || syncScheduler != null) {
            return;
        }
        syncScheduler = new ScheduledThreadPoolExecutor(1, r -> {
            final Thread thread = new Thread(r);
            thread.setName("AOF-Sync-Scheduler");
            thread.setDaemon(true);
            return thread;
        });
        syncScheduler.scheduleAtFixedRate(this::scheduledSyncTask, syncIntervalMs, syncIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("EVERYSEC刷盘模式已启动，刷盘间隔: {}ms", syncIntervalMs);
    }

    /**
     * 追加一条请求记录
     *
     * @param respArray 客户端发送的原始请求数组
     * @throws IOException 写入失败，调用者不应执行该命令
     */
    public void append(final RespArray respArray) throws IOException {
        if (respArray == null) {
            throw new IllegalArgumentException("RespArray cannot be null");
        }

        // 1. 在锁外完成编码
        final ByteBuf byteBuf = allocator.buffer();
        try {
            respArray.encode(byteBuf);

            // 2. 整条记录在锁内一次写完
            lock.lock();
            try {
                ensureOpen();
                ensureWritable();
                writeRecord(byteBuf);
                if (syncPolicy == AofSyncPolicy.ALWAYS) {
                    aofWriter.flush();
                } else {
                    hasPendingFlush.set(true);
                }
            } finally {
                lock.unlock();
            }
        } finally {
            byteBuf.release();
        }
    }

    /**
     * 写入一条完整记录，失败时把文件截回写入前的长度，保证日志里只有完整记录
     */
    private void writeRecord(final ByteBuf record) throws IOException {
        final long sizeBefore = aofWriter.size();
        try {
            aofWriter.write(record.nioBuffer());
        } catch (IOException e) {
            try {
                aofWriter.truncate(sizeBefore);
                log.warn("AOF追加失败，已回滚到 {} bytes: {}", sizeBefore, e.getMessage());
            } catch (IOException rollbackError) {
                failed = true;
                e.addSuppressed(rollbackError);
                log.error("AOF追加失败且无法回滚，后续追加将被拒绝: {}", fileName, rollbackError);
            }
            throw e;
        }
    }

    /**
     * 立即刷盘
     *
     * @throws IOException 刷盘失败
     */
    public void sync() throws IOException {
        lock.lock();
        try {
            ensureOpen();
            hasPendingFlush.set(false);
            try {
                aofWriter.flush();
            } catch (IOException e) {
                hasPendingFlush.set(true);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 定时刷盘任务，失败时保留待刷盘标志，下个周期重试
     */
    void scheduledSyncTask() {
        if (closed.get() || !hasPendingFlush.get()) {
            return;
        }
        try {
            sync();
            log.trace("EVERYSEC定时刷盘完成");
        } catch (IOException e) {
            log.error("EVERYSEC定时刷盘失败，将在下个周期重试: {}", fileName, e);
        }
    }

    public boolean isFailed() {
        return failed;
    }

    public boolean hasPendingFlush() {
        return hasPendingFlush.get();
    }

    public long size() throws IOException {
        lock.lock();
        try {
            ensureOpen();
            return aofWriter.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 停止刷盘任务，最后一次刷盘并关闭文件。可重复调用。
     *
     * @throws IOException 关闭文件失败
     */
    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("开始关闭AOF管理器...");

        // 1. 先停止定时刷盘
        if (syncScheduler != null) {
            syncScheduler.shutdown();
            try {
                if (!syncScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    syncScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                syncScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // 2. 等待进行中的追加完成后关闭文件，关闭时会最后一次刷盘
        lock.lock();
        try {
            aofWriter.close();
            hasPendingFlush.set(false);
        } finally {
            lock.unlock();
        }
        log.info("AOF管理器关闭完成: {}", fileName);
    }

    private void ensureOpen() throws IOException {
        if (closed.get()) {
            throw new IOException("AOF管理器已关闭: " + fileName);
        }
    }

    private void ensureWritable() throws IOException {
        if (failed) {
            throw new IOException("AOF文件尾部存在无法回滚的残缺记录，拒绝追加: " + fileName);
        }
    }
}
