package site.minikv.pubsub;

import site.minikv.protocol.Resp;

/**
 * 向某个远端连接发送RESP值的出口
 *
 * <p>每次调用发送一个完整的值，不会与同一连接上的其他值交错。
 * 连接已关闭时可以失败，失败通过实现自身的方式报告，不向调用者抛出。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface ReplySink {

    /** 丢弃所有内容的出口，用于日志重放等没有客户端的场景 */
    ReplySink NOOP = new ReplySink() {
        @Override
        public void send(final Resp resp) {
        }

        @Override
        public boolean isActive() {
            return false;
        }

        @Override
        public String toString() {
            return "ReplySink.NOOP";
        }
    };

    /**
     * 发送一个完整的RESP值
     *
     * @param resp 要发送的值
     */
    void send(Resp resp);

    /**
     * 出口对应的连接是否仍然可用
     */
    boolean isActive();
}
