package site.minikv.aof.writer;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * 追加日志写入器接口
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface Writer {
    /**
     * 把缓冲区的全部剩余字节追加到文件末尾
     *
     * @param buffer 待写入的数据缓冲区
     * @return 实际写入的字节数
     * @throws IOException 写入过程中发生IO错误
     */
    int write(ByteBuffer buffer) throws IOException;

    /**
     * 将已写入的数据强制刷到稳定存储
     *
     * @throws IOException 刷盘过程中发生IO错误
     */
    void flush() throws IOException;

    /**
     * 当前文件长度
     *
     * @throws IOException 读取文件状态失败
     */
    long size() throws IOException;

    /**
     * 把文件截断到指定长度，并把写入位置移到新的末尾
     *
     * @param size 截断后的长度
     * @throws IOException 截断失败
     */
    void truncate(long size) throws IOException;

    void close() throws IOException;
}
