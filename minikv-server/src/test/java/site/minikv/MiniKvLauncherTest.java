package site.minikv;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.server.config.RedisServerConfig;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("启动参数解析测试")
class MiniKvLauncherTest {

    @Test
    @DisplayName("无参数使用默认配置")
    void testNoArgs() {
        final RedisServerConfig config = MiniKvLauncher.parseArgs(new String[0]);

        assertEquals(6379, config.getPort());
        assertEquals("database.aof", config.getAofFileName());
    }

    @Test
    @DisplayName("解析端口、日志路径和地址")
    void testAllFlags() {
        final RedisServerConfig config = MiniKvLauncher.parseArgs(
                new String[]{"--port", "7000", "--aof", "/tmp/kv.aof", "--host", "127.0.0.1"});

        assertEquals(7000, config.getPort());
        assertEquals("/tmp/kv.aof", config.getAofFileName());
        assertEquals("127.0.0.1", config.getHost());
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void testInvalidArgs() {
        assertThrows(IllegalArgumentException.class, () -> MiniKvLauncher.parseArgs(new String[]{"--verbose", "1"}));
        assertThrows(IllegalArgumentException.class, () -> MiniKvLauncher.parseArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> MiniKvLauncher.parseArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> MiniKvLauncher.parseArgs(new String[]{"--port", "99999"}));
    }
}
