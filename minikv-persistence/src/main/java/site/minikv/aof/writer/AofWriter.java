package site.minikv.aof.writer;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * AOF 文件写入器
 *
 * <p>以读写模式打开日志文件（不存在时创建空文件），写入位置定位到文件末尾。
 * 文件只追加，只有回滚写了一半的记录时才会截断。写入器本身不加锁，由 {@code AofManager} 的锁串行化调用。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class AofWriter implements Writer {
    private final File file;

    private RandomAccessFile raf;

    private FileChannel channel;

    public AofWriter(final File file) throws IOException {
        this.file = file;
        try {
            this.raf = new RandomAccessFile(file, "rw");
            this.channel = raf.getChannel();
            this.channel.position(channel.size());
            log.info("AOF文件已打开: {}，当前大小: {} bytes", file.getAbsolutePath(), channel.size());
        } catch (IOException e) {
            closeQuietly(channel);
            closeQuietly(raf);
            this.channel = null;
            this.raf = null;
            throw new IOException("打开AOF文件失败: " + file, e);
        }
    }

    @Override
    public int write(final ByteBuffer buffer) throws IOException {
        ensureOpen();
        return writtenFullyTo(channel, buffer);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        channel.force(true);
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return channel.size();
    }

    @Override
    public void truncate(final long size) throws IOException {
        ensureOpen();
        channel.truncate(size);
        channel.position(size);
    }

    @Override
    public void close() throws IOException {
        if (channel == null) {
            return;
        }
        try {
            if (channel.isOpen()) {
                channel.force(true);
            }
        } finally {
            closeQuietly(channel);
            closeQuietly(raf);
            channel = null;
            raf = null;
            log.info("AOF文件已关闭: {}", file);
        }
    }

    private void ensureOpen() throws IOException {
        if (channel == null || !channel.isOpen()) {
            throw new IOException("AOF Writer 已关闭: " + file);
        }
    }

    private static int writtenFullyTo(final FileChannel channel, final ByteBuffer buffer) throws IOException {
        final int originalPosition = buffer.position();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        return buffer.position() - originalPosition;
    }

    private static void closeQuietly(final Closeable resource) {
        if (resource != null) {
            try {
                resource.close();
            } catch (IOException e) {
                log.warn("关闭资源时发生错误", e);
            }
        }
    }
}
