package site.minikv.aof.writer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AOF写入器测试")
class AofWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("打开已有文件时追加在末尾")
    void testAppendsToExistingContent() throws Exception {
        final Path path = tempDir.resolve("w.aof");
        Files.write(path, "abc".getBytes(StandardCharsets.UTF_8));

        final AofWriter writer = new AofWriter(path.toFile());
        try {
            assertEquals(3, writer.write(ByteBuffer.wrap("def".getBytes(StandardCharsets.UTF_8))));
            writer.flush();
            assertEquals(6, writer.size());
        } finally {
            writer.close();
        }

        assertEquals("abcdef", new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("截断后从新的末尾继续写入")
    void testTruncateMovesWritePosition() throws Exception {
        final Path path = tempDir.resolve("t.aof");
        final AofWriter writer = new AofWriter(path.toFile());
        try {
            writer.write(ByteBuffer.wrap("abcdef".getBytes(StandardCharsets.UTF_8)));
            writer.truncate(3);
            writer.write(ByteBuffer.wrap("XY".getBytes(StandardCharsets.UTF_8)));
            assertEquals(5, writer.size());
        } finally {
            writer.close();
        }

        assertEquals("abcXY", new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("关闭后写入抛出IOException")
    void testWriteAfterClose() throws Exception {
        final File file = tempDir.resolve("closed.aof").toFile();
        final AofWriter writer = new AofWriter(file);
        writer.close();
        writer.close();

        assertThrows(IOException.class, () -> writer.write(ByteBuffer.wrap(new byte[]{1})));
        assertThrows(IOException.class, writer::flush);
    }

    @Test
    @DisplayName("刷盘策略按名称解析")
    void testSyncPolicyFromName() {
        assertEquals(AofSyncPolicy.EVERYSEC, AofSyncPolicy.fromName("everysec"));
        assertEquals(AofSyncPolicy.ALWAYS, AofSyncPolicy.fromName("Always"));
        assertThrows(IllegalArgumentException.class, () -> AofSyncPolicy.fromName("sometimes"));
    }
}
