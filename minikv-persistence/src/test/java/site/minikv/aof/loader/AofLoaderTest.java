package site.minikv.aof.loader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import site.minikv.aof.AofReplayException;
import site.minikv.aof.CommandExecutor;
import site.minikv.protocol.RespArray;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AOF加载器测试")
class AofLoaderTest {

    @TempDir
    Path tempDir;

    private File write(final String content) throws Exception {
        final Path path = tempDir.resolve("load.aof");
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path.toFile();
    }

    @Test
    @DisplayName("文件不存在时不执行任何命令")
    void testMissingFile() throws Exception {
        final AofLoader loader = new AofLoader(tempDir.resolve("absent.aof").toFile());
        assertEquals(0, loader.load(command -> fail("不应执行")));
    }

    @Test
    @DisplayName("跨越读取块边界的大记录")
    void testRecordLargerThanChunk() throws Exception {
        final StringBuilder big = new StringBuilder();
        for (int i = 0; i < 200_000; i++) {
            big.append('x');
        }
        final String value = big.toString();
        final String record = "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$" + value.length() + "\r\n" + value + "\r\n";
        final List<RespArray> replayed = new ArrayList<>();

        final int executed = new AofLoader(write(record + record)).load(replayed::add);

        assertEquals(2, executed);
        assertEquals(RespArray.ofBulkStrings("SET", "k", value), replayed.get(1));
    }

    @Test
    @DisplayName("末尾记录被截断时加载失败")
    void testTruncatedTail() throws Exception {
        final String content = "*2\r\n$3\r\nDEL\r\n$1\r\na\r\n*3\r\n$3\r\nSET\r\n$1\r\nk";
        final List<RespArray> replayed = new ArrayList<>();

        final AofLoadException e = assertThrows(AofLoadException.class,
                () -> new AofLoader(write(content)).load(replayed::add));

        assertEquals(1, replayed.size());
        assertEquals(20, e.getOffset());
    }

    @Test
    @DisplayName("损坏的记录使加载失败")
    void testMalformedRecord() throws Exception {
        assertThrows(AofLoadException.class,
                () -> new AofLoader(write("*1\r\n$4\r\nPING\r\n!!!\r\n")).load(command -> true));
    }

    @Test
    @DisplayName("记录不是命令数组时加载失败")
    void testNonArrayRecord() throws Exception {
        assertThrows(AofLoadException.class,
                () -> new AofLoader(write("+OK\r\n")).load(command -> true));
        assertThrows(AofLoadException.class,
                () -> new AofLoader(write("*0\r\n")).load(command -> true));
    }

    @Test
    @DisplayName("无法识别的命令被跳过，加载继续")
    void testUnknownCommandSkipped() throws Exception {
        final List<RespArray> executed = new ArrayList<>();
        final CommandExecutor executor = command -> {
            if ("FOO".equals(command.get(0).toString())) {
                return false;
            }
            executed.add(command);
            return true;
        };

        final int count = new AofLoader(write("*1\r\n$3\r\nFOO\r\n*2\r\n$3\r\nDEL\r\n$1\r\na\r\n")).load(executor);

        assertEquals(1, count);
        assertEquals(RespArray.ofBulkStrings("DEL", "a"), executed.get(0));
    }

    @Test
    @DisplayName("可识别但无法执行的记录使加载失败，并报告该记录的偏移")
    void testReplayFailureCarriesOffset() throws Exception {
        final List<RespArray> executed = new ArrayList<>();
        final CommandExecutor executor = command -> {
            if (command.size() < 3 && "SET".equals(command.get(0).toString())) {
                throw new AofReplayException("SET: wrong number of arguments",
                        new IllegalArgumentException("arity"));
            }
            executed.add(command);
            return true;
        };

        // Given: 第二条记录从偏移20开始
        final File file = write("*2\r\n$3\r\nDEL\r\n$1\r\na\r\n*2\r\n$3\r\nSET\r\n$1\r\nk\r\n");

        // When & Then
        final AofLoadException e = assertThrows(AofLoadException.class, () -> new AofLoader(file).load(executor));
        assertEquals(20, e.getOffset());
        assertTrue(e.getCause() instanceof AofReplayException);
        assertEquals(1, executed.size());
    }
}
