package site.minikv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.command.CommandDispatcher;
import site.minikv.protocol.handler.RespDecoder;
import site.minikv.protocol.handler.RespEncoder;
import site.minikv.server.config.RedisServerConfig;
import site.minikv.server.context.RedisContext;
import site.minikv.server.context.RedisContextImpl;
import site.minikv.server.handler.RespCommandHandler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于Netty的服务器实现。
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss线程组接受连接，worker线程组负责编解码
 *   <li>命令在独立的执行线程组中运行，每个连接固定在一个执行线程上
 *   <li>根据操作系统选择Epoll、KQueue或NIO实现
 * </ul>
 *
 * <p>启动时先完成日志重放再绑定端口，重放期间不接受任何连接。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
@Getter
public class MiniKvServer implements RedisServer {

    private final RedisServerConfig config;

    private final RedisContext redisContext;

    private final CommandDispatcher dispatcher;

    /** 服务器Channel类型，根据操作系统自动选择 */
    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    private Channel serverChannel;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public MiniKvServer(final RedisServerConfig config) {
        this(config, new RedisContextImpl(config));
    }

    public MiniKvServer(final RedisServerConfig config, final RedisContext redisContext) {
        config.validate();
        this.config = config;
        this.redisContext = redisContext;
        this.dispatcher = new CommandDispatcher(redisContext);
    }

    @Override
    public void start() throws IOException {
        // 1. 日志重放与后台任务
        redisContext.startup();

        // 2. 网络层
        initializeEventLoopGroups();
        initializeCommandExecutor();
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor,
                                new RespCommandHandler(dispatcher, redisContext.getPubSub()));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("MiniKv server started at {}:{}", config.getHost(), getPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IOException("服务器启动被中断", e);
        } catch (RuntimeException e) {
            log.error("端口绑定失败: {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw new IOException("端口绑定失败: " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    /**
     * 获取实际监听的端口，配置端口为0时返回系统分配的端口
     *
     * @return 监听端口，未启动时返回配置端口
     */
    public int getPort() {
        if (serverChannel != null && serverChannel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return config.getPort();
    }

    /**
     * 按以下顺序关闭：服务器Channel、worker线程组、boss线程组、命令执行器、上下文
     */
    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
        } catch (InterruptedException e) {
            log.error("MiniKv server stop interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            redisContext.shutdown();
        }
        log.info("MiniKv server stopped");
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("minikv-cmd"));
        log.info("命令执行线程数: {}", config.getCommandExecutorThreadCount());
    }
}
