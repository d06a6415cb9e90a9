package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespProtocolException;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，把连接上的字节流切分为完整的RESP值，
 * 每个完整的值向后传递一次。
 *
 * <p>处理策略：
 * <ul>
 *     <li>数据不完整 - 保留已读字节，等待下一批数据</li>
 *     <li>协议错误 - 记录日志并关闭连接，不做跳字节恢复</li>
 *     <li>连接在值中间关闭 - 视为截断，丢弃残余字节</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable()) {
            final Resp resp;
            try {
                resp = Resp.decode(in);
            } catch (RespProtocolException e) {
                log.warn("协议错误[{}]，关闭连接 {}: {}", e.getReason(), ctx.channel().remoteAddress(), e.getMessage());
                in.skipBytes(in.readableBytes());
                ctx.close();
                return;
            }
            if (resp == null) {
                // 数据不完整，等待更多数据
                return;
            }
            out.add(resp);
        }
    }

    @Override
    protected void decodeLast(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) throws Exception {
        decode(ctx, in, out);
        if (in.isReadable()) {
            log.debug("连接关闭时存在不完整的帧({} bytes)，已丢弃: {}",
                    in.readableBytes(), ctx.channel().remoteAddress());
            in.skipBytes(in.readableBytes());
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
