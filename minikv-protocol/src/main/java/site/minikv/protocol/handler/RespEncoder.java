package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Resp;

/**
 * RESP协议编码器
 *
 * <p>把一个完整的RESP值编码到一个出站缓冲区。Netty按消息为单位写出，
 * 因此同一连接上的命令回复与异步推送的订阅消息不会交错。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        msg.encode(out);
        if (log.isTraceEnabled()) {
            log.trace("编码RESP响应: {} ({} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespEncoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
