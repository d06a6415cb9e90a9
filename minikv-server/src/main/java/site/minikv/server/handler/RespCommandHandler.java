package site.minikv.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.minikv.command.CommandDispatcher;
import site.minikv.protocol.Ignore;
import site.minikv.protocol.Resp;
import site.minikv.pubsub.PubSubRegistry;
import site.minikv.pubsub.ReplySink;

/**
 * 命令处理器，把解码得到的请求交给分发器并写回回复。
 *
 * <p>每个连接持有一个独立的处理器实例和一个出口，连接断开时释放该出口上的所有订阅。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private final CommandDispatcher dispatcher;

    private final PubSubRegistry pubSub;

    private ReplySink sink;

    public RespCommandHandler(final CommandDispatcher dispatcher, final PubSubRegistry pubSub) {
        if (dispatcher == null || pubSub == null) {
            throw new IllegalArgumentException("分发器和订阅表不能为null");
        }
        this.dispatcher = dispatcher;
        this.pubSub = pubSub;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        sink = new ChannelReplySink(ctx.channel());
        log.debug("客户端连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final Resp response = dispatcher.dispatch(msg, sink());
        if (response == null || response instanceof Ignore) {
            return;
        }
        sink().send(response);
    }

    private ReplySink sink() {
        if (sink == null) {
            throw new IllegalStateException("连接尚未激活");
        }
        return sink;
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (sink != null) {
            final int removed = pubSub.unsubscribeAll(sink);
            if (removed > 0) {
                log.debug("连接关闭，已取消{}个订阅: {}", removed, ctx.channel().remoteAddress());
            }
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("连接异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
