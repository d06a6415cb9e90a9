package site.minikv.aof.loader;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.PooledByteBufAllocator;
import lombok.extern.slf4j.Slf4j;
import site.minikv.aof.AofReplayException;
import site.minikv.aof.CommandExecutor;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespProtocolException;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;

/**
 * AOF 文件加载器
 *
 * <p>从偏移0开始按块读取日志文件，逐条解码请求数组并交给 {@link CommandExecutor} 执行。
 * 启动时在接受连接之前调用一次。
 *
 * <p>错误处理策略：
 * <ul>
 *     <li>记录无法解码 - 抛出 {@link AofLoadException}，不尝试跳过</li>
 *     <li>文件末尾的记录不完整 - 视为截断，抛出 {@link AofLoadException}</li>
 *     <li>记录不是非空的批量字符串数组 - 抛出 {@link AofLoadException}</li>
 *     <li>命令可以识别但无法执行 - 抛出 {@link AofLoadException}</li>
 *     <li>命令名无法识别 - 记录警告后继续</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class AofLoader {
    private static final int CHUNK_SIZE = 64 * 1024;

    private final File file;

    public AofLoader(final File file) {
        this.file = file;
    }

    /**
     * 加载并重放整个日志文件
     *
     * @param executor 命令执行回调
     * @return 成功执行的命令数
     * @throws IOException 读取失败或日志内容损坏
     */
    public int load(final CommandExecutor executor) throws IOException {
        if (!file.exists() || file.length() == 0) {
            log.info("AOF文件不存在或为空，跳过加载: {}", file);
            return 0;
        }

        final long startTime = System.currentTimeMillis();
        int executed = 0;
        int skipped = 0;
        final ByteBuf buffer = PooledByteBufAllocator.DEFAULT.heapBuffer(CHUNK_SIZE);
        try (RandomAccessFile raf = new RandomAccessFile(file, "r");
             FileChannel channel = raf.getChannel()) {
            final long fileSize = channel.size();
            long filePosition = 0;
            // 已解码字节在文件中的偏移，用于错误定位
            long recordOffset = 0;

            while (filePosition < fileSize) {
                // 1. 读入下一块
                final int toRead = (int) Math.min(CHUNK_SIZE, fileSize - filePosition);
                buffer.ensureWritable(toRead);
                final int read = buffer.writeBytes(channel, filePosition, toRead);
                if (read < 0) {
                    break;
                }
                filePosition += read;

                // 2. 解码当前缓冲区中所有完整的记录
                while (buffer.isReadable()) {
                    final int before = buffer.readerIndex();
                    final Resp record;
                    try {
                        record = Resp.decode(buffer);
                    } catch (RespProtocolException e) {
                        throw new AofLoadException("AOF记录解码失败[" + e.getReason() + "]: " + e.getMessage(),
                                recordOffset, e);
                    }
                    if (record == null) {
                        break;
                    }
                    final RespArray command = asCommand(record, recordOffset);
                    final boolean known;
                    try {
                        known = executor.executeCommand(command);
                    } catch (AofReplayException e) {
                        throw new AofLoadException("AOF记录执行失败: " + e.getMessage(), recordOffset, e);
                    }
                    if (known) {
                        executed++;
                    } else {
                        skipped++;
                        log.warn("AOF中存在无法识别的命令，已跳过: {} (offset {})", command.get(0), recordOffset);
                    }
                    recordOffset += buffer.readerIndex() - before;
                }
                buffer.discardReadBytes();
            }

            // 3. 剩余的字节构不成完整记录
            if (buffer.isReadable()) {
                throw new AofLoadException("AOF文件末尾记录不完整，剩余 " + buffer.readableBytes() + " bytes",
                        recordOffset, new RespProtocolException(RespProtocolException.Reason.TRUNCATED,
                        "truncated record at end of log"));
            }
        } finally {
            buffer.release();
        }

        log.info("AOF文件加载完成: {}，执行 {} 条命令，跳过 {} 条，耗时 {}ms",
                file, executed, skipped, System.currentTimeMillis() - startTime);
        return executed;
    }

    private static RespArray asCommand(final Resp record, final long offset) throws AofLoadException {
        if (!(record instanceof RespArray) || ((RespArray) record).size() == 0) {
            throw new AofLoadException("AOF记录不是命令数组: " + record, offset);
        }
        final RespArray command = (RespArray) record;
        for (final Resp element : command.getContent()) {
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                throw new AofLoadException("AOF记录包含非批量字符串参数", offset);
            }
        }
        return command;
    }
}
