package site.minikv.server.config;

import lombok.Builder;
import lombok.Data;
import site.minikv.aof.writer.AofSyncPolicy;

/**
 * 服务器配置类，统一管理网络、持久化、过期清理和线程参数。
 *
 * <p>采用Builder模式创建，所有字段都有默认值：
 * <ul>
 *   <li>网络配置：监听地址、端口、连接参数
 *   <li>持久化配置：AOF开关、文件路径、刷盘策略
 *   <li>过期配置：主动清理的间隔与每轮抽样数
 *   <li>线程配置：各类线程池大小
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    // ========== 网络配置 ==========

    /** 服务器监听地址 */
    @Builder.Default
    private String host = "0.0.0.0";

    /**
     * 服务器监听端口，0 表示由系统分配临时端口
     */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 持久化配置 ==========

    @Builder.Default
    private boolean aofEnabled = true;

    @Builder.Default
    private String aofFileName = "database.aof";

    @Builder.Default
    private AofSyncPolicy aofSyncPolicy = AofSyncPolicy.EVERYSEC;

    /** EVERYSEC 策略下的刷盘间隔（毫秒） */
    @Builder.Default
    private long aofSyncIntervalMs = 1000L;

    // ========== 过期配置 ==========

    @Builder.Default
    private long expireSweepIntervalMs = 100L;

    @Builder.Default
    private int expireSweepSampleSize = 20;

    // ========== 线程配置 ==========

    @Builder.Default
    private int bossThreadCount = 1;

    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行线程数。每个连接固定在一个执行线程上，
     * 同一连接的命令按到达顺序执行，不同连接之间并行
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    /**
     * 校验配置的有效性
     *
     * @throws IllegalArgumentException 配置不合法
     */
    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }
        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }
        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
        if (aofEnabled && (aofFileName == null || aofFileName.trim().isEmpty())) {
            throw new IllegalArgumentException("启用AOF时必须指定AOF文件名");
        }
        if (aofEnabled && aofSyncPolicy == null) {
            throw new IllegalArgumentException("启用AOF时必须指定刷盘策略");
        }
        if (aofSyncIntervalMs <= 0) {
            throw new IllegalArgumentException("AOF刷盘间隔必须大于0");
        }
        if (expireSweepIntervalMs <= 0 || expireSweepSampleSize <= 0) {
            throw new IllegalArgumentException("过期清理间隔和抽样数必须大于0");
        }
    }
}
