package site.minikv.server.handler;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Resp;
import site.minikv.pubsub.ReplySink;

/**
 * 基于Netty Channel的出口
 *
 * <p>所有写入都经过Channel的事件循环串行化，一个值的字节不会与同一连接上的其他值交错。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class ChannelReplySink implements ReplySink {

    private final Channel channel;

    public ChannelReplySink(final Channel channel) {
        this.channel = channel;
    }

    @Override
    public void send(final Resp resp) {
        if (!channel.isActive()) {
            log.debug("Channel已关闭，丢弃消息: {}", channel);
            return;
        }
        channel.writeAndFlush(resp).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("消息发送失败: {}, 原因: {}", channel, String.valueOf(future.cause()));
            }
        });
    }

    @Override
    public boolean isActive() {
        return channel.isActive();
    }

    @Override
    public String toString() {
        return "ChannelReplySink[" + channel + "]";
    }
}
