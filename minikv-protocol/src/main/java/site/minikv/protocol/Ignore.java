package site.minikv.protocol;

import io.netty.buffer.ByteBuf;

/**
 * 命令处理器的内部返回值，表示本次调用不需要同步写出回复
 *
 * <p>例如 SUBSCRIBE 在处理过程中已经通过连接写出了订阅确认，返回本值后分发器不再写任何内容。
 * 该值没有线路编码，调用 {@link #encode(ByteBuf)} 会抛出异常。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class Ignore extends Resp {
    public static final Ignore INSTANCE = new Ignore();

    private Ignore() {
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        throw new IllegalStateException("Ignore 没有线路编码，不能写入连接");
    }

    @Override
    public String toString() {
        return "Ignore";
    }
}
