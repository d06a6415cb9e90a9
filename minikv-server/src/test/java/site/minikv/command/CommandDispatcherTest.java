package site.minikv.command;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Ignore;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.SimpleString;
import site.minikv.pubsub.ReplySink;
import site.minikv.server.config.RedisServerConfig;
import site.minikv.server.context.RedisContext;
import site.minikv.server.context.RedisContextImpl;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("命令分发器测试")
class CommandDispatcherTest {

    private RedisContext context;
    private CommandDispatcher dispatcher;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        final RedisServerConfig config = RedisServerConfig.builder()
                .aofEnabled(false)
                .build();
        context = new RedisContextImpl(config);
        dispatcher = new CommandDispatcher(context);
        sink = new RecordingSink();
    }

    static class RecordingSink implements ReplySink {
        final List<Resp> received = new ArrayList<>();

        @Override
        public void send(final Resp resp) {
            received.add(resp);
        }

        @Override
        public boolean isActive() {
            return true;
        }
    }

    private Resp run(final String... parts) {
        return dispatcher.dispatch(RespArray.ofBulkStrings(parts), sink);
    }

    private static String errorOf(final Resp resp) {
        assertTrue(resp instanceof Errors, "期望错误回复，实际: " + resp);
        return ((Errors) resp).getContent();
    }

    @Nested
    @DisplayName("请求过滤与错误")
    class Routing {

        @Test
        @DisplayName("非数组请求被跳过")
        void testNonArraySkipped() {
            assertNull(dispatcher.dispatch(SimpleString.valueOf("PING"), sink));
            assertNull(dispatcher.dispatch(BulkString.fromString("PING"), sink));
        }

        @Test
        @DisplayName("空数组被跳过")
        void testEmptyArraySkipped() {
            assertNull(dispatcher.dispatch(RespArray.EMPTY, sink));
        }

        @Test
        @DisplayName("未知命令返回包含大写命令名的错误")
        void testUnknownCommand() {
            assertEquals("ERR unknown command 'FOO'", errorOf(run("foo", "bar")));
            // 之后的命令正常处理
            assertEquals(SimpleString.PONG, run("PING"));
        }

        @Test
        @DisplayName("命令名含换行时错误回复仍然只有一帧")
        void testUnknownCommandWithLineBreaks() {
            final Resp result = run("foo'\r\n:42\r\n+x");

            final ByteBuf wire = Unpooled.buffer();
            try {
                result.encode(wire);
                final Resp decoded = Resp.decode(wire);
                assertEquals(0, wire.readableBytes(), "一次回复应当恰好是一帧");
                assertEquals(result, decoded);
                assertEquals("ERR unknown command 'FOO'  :42  +X'", errorOf(decoded));
            } finally {
                wire.release();
            }
        }

        @Test
        @DisplayName("命令名大小写不敏感")
        void testCaseInsensitiveName() {
            assertEquals(SimpleString.PONG, run("ping"));
            assertEquals(SimpleString.PONG, run("PiNg"));
        }

        @Test
        @DisplayName("命令名不是批量字符串时返回协议错误")
        void testNonBulkCommandName() {
            final Resp result = dispatcher.dispatch(RespArray.valueOf(RespInteger.ONE), sink);
            assertThat(errorOf(result)).startsWith("ERR Protocol error");
        }

        @Test
        @DisplayName("参数个数错误")
        void testWrongArity() {
            assertEquals("ERR wrong number of arguments for 'get' command", errorOf(run("GET")));
            assertEquals("ERR wrong number of arguments for 'get' command", errorOf(run("GET", "a", "b")));
            assertEquals("ERR wrong number of arguments for 'set' command", errorOf(run("SET", "a")));
            assertEquals("ERR wrong number of arguments for 'ping' command", errorOf(run("PING", "a", "b")));
            assertEquals("ERR wrong number of arguments for 'publish' command", errorOf(run("PUBLISH", "c")));
            assertEquals("ERR wrong number of arguments for 'subscribe' command", errorOf(run("SUBSCRIBE")));
        }
    }

    @Nested
    @DisplayName("连接命令")
    class Connection {

        @Test
        @DisplayName("PING 无参数返回 PONG，有参数原样返回")
        void testPing() {
            assertEquals(SimpleString.PONG, run("PING"));
            assertEquals(SimpleString.valueOf("hello"), run("PING", "hello"));
        }

        @Test
        @DisplayName("PING 参数含换行时返回批量字符串")
        void testPingWithNewline() {
            assertEquals(BulkString.fromString("a\r\nb"), run("PING", "a\r\nb"));
        }

        @Test
        @DisplayName("ECHO 返回批量字符串")
        void testEcho() {
            assertEquals(BulkString.fromString("hi there"), run("ECHO", "hi there"));
        }

        @Test
        @DisplayName("SELECT、CLIENT 直接成功，COMMAND 返回空数组")
        void testClientCompatibilityCommands() {
            assertEquals(SimpleString.OK, run("SELECT", "0"));
            assertEquals(SimpleString.OK, run("CLIENT", "SETNAME", "app"));
            assertEquals(RespArray.EMPTY, run("COMMAND", "DOCS"));
        }

        @Test
        @DisplayName("INFO 包含角色与键数量")
        void testInfo() {
            run("SET", "k", "v");

            final Resp all = run("INFO");
            assertTrue(all instanceof BulkString);
            final String text = all.toString();
            assertThat(text).contains("# Server", "role:master", "db0:keys=1");

            final String keyspace = run("INFO", "keyspace").toString();
            assertThat(keyspace).contains("db0:keys=1").doesNotContain("# Server");
        }
    }

    @Nested
    @DisplayName("键值命令")
    class KeyValue {

        @Test
        @DisplayName("SET 后 GET 返回值，缺失键返回 Null")
        void testSetGet() {
            assertEquals(SimpleString.OK, run("SET", "name", "minikv"));
            assertEquals(BulkString.fromString("minikv"), run("GET", "name"));
            assertEquals(BulkString.NULL, run("GET", "missing"));
        }

        @Test
        @DisplayName("值可以包含二进制和换行")
        void testBinarySafeValue() {
            final byte[] raw = {0, '\r', '\n', (byte) 0xFF};
            final RespArray set = RespArray.valueOf(BulkString.fromString("SET"),
                    BulkString.fromString("bin"), BulkString.create(raw));
            assertEquals(SimpleString.OK, dispatcher.dispatch(set, sink));
            assertEquals(BulkString.create(new RedisBytes(raw)), run("GET", "bin"));
        }

        @Test
        @DisplayName("DEL 两次依次返回 1 和 0")
        void testDelTwice() {
            run("SET", "k", "v");
            assertEquals(RespInteger.ONE, run("DEL", "k"));
            assertEquals(RespInteger.ZERO, run("DEL", "k"));
        }

        @Test
        @DisplayName("EXISTS 统计存在的键，重复键重复计数")
        void testExists() {
            run("SET", "a", "1");
            run("SET", "b", "2");
            assertEquals(RespInteger.valueOf(2), run("EXISTS", "a", "b", "c"));
            assertEquals(RespInteger.valueOf(2), run("EXISTS", "a", "a"));
        }

        @Test
        @DisplayName("TTL：不存在 -2，无过期 -1，有过期返回剩余秒数")
        void testTtl() {
            assertEquals(RespInteger.MINUS_TWO, run("TTL", "missing"));
            run("SET", "forever", "v");
            assertEquals(RespInteger.MINUS_ONE, run("TTL", "forever"));
            run("SET", "tmp", "v", "EX", "10");
            final long ttl = ((RespInteger) run("TTL", "tmp")).getContent();
            assertThat(ttl).isBetween(0L, 10L);
        }

        @Test
        @DisplayName("PX 过期后 GET 返回 Null，EXISTS 返回 0")
        void testPxExpiry() throws InterruptedException {
            assertEquals(SimpleString.OK, run("SET", "k", "v", "PX", "50"));
            assertEquals(BulkString.fromString("v"), run("GET", "k"));

            Thread.sleep(120);

            assertEquals(BulkString.NULL, run("GET", "k"));
            assertEquals(RespInteger.ZERO, run("EXISTS", "k"));
        }

        @Test
        @DisplayName("SET 选项大小写不敏感，最后一个生效，未知选项忽略")
        void testSetOptions() {
            assertEquals(SimpleString.OK, run("SET", "k", "v", "px", "50", "ex", "100"));
            assertThat(((RespInteger) run("TTL", "k")).getContent()).isGreaterThan(90L);

            assertEquals(SimpleString.OK, run("SET", "k2", "v", "NX"));
            assertEquals(RespInteger.MINUS_ONE, run("TTL", "k2"));
        }

        @Test
        @DisplayName("不带过期时间的 SET 清除已有过期时间")
        void testSetClearsExpire() {
            run("SET", "k", "v", "EX", "100");
            run("SET", "k", "v2");
            assertEquals(RespInteger.MINUS_ONE, run("TTL", "k"));
        }

        @Test
        @DisplayName("EX 缺少参数为语法错误")
        void testMissingExpireArgument() {
            assertEquals("ERR syntax error", errorOf(run("SET", "k", "v", "EX")));
            assertEquals(BulkString.NULL, run("GET", "k"));
        }

        @Test
        @DisplayName("EX 参数不是整数")
        void testNonIntegerExpire() {
            assertEquals("ERR value is not an integer or out of range", errorOf(run("SET", "k", "v", "EX", "abc")));
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "-5", "9223372036854775807"})
        @DisplayName("非正数或溢出的过期时间被拒绝")
        void testInvalidExpireTime(final String seconds) {
            assertEquals("ERR invalid expire time in 'set' command", errorOf(run("SET", "k", "v", "EX", seconds)));
            assertEquals(BulkString.NULL, run("GET", "k"));
        }

        @Test
        @DisplayName("PX 为负数被拒绝")
        void testNegativePx() {
            assertEquals("ERR invalid expire time in 'set' command", errorOf(run("SET", "k", "v", "PX", "-1")));
        }
    }

    @Nested
    @DisplayName("发布订阅命令")
    class PubSub {

        @Test
        @DisplayName("SUBSCRIBE 不返回同步回复，确认写入出口")
        void testSubscribe() {
            final Resp result = run("SUBSCRIBE", "news", "sports");

            assertSame(Ignore.INSTANCE, result);
            assertEquals(2, sink.received.size());
            assertEquals(RespArray.valueOf(BulkString.fromString("subscribe"), BulkString.fromString("news"),
                    RespInteger.ONE), sink.received.get(0));
        }

        @Test
        @DisplayName("PUBLISH 返回接收者数量并投递消息")
        void testPublish() {
            final RecordingSink subscriber = new RecordingSink();
            dispatcher.dispatch(RespArray.ofBulkStrings("SUBSCRIBE", "c"), subscriber);

            assertEquals(RespInteger.ONE, run("PUBLISH", "c", "hi"));
            assertEquals(RespInteger.ZERO, run("PUBLISH", "nobody", "hi"));
            assertEquals(RespArray.ofBulkStrings("message", "c", "hi"),
                    subscriber.received.get(subscriber.received.size() - 1));
        }
    }

    @Nested
    @DisplayName("日志追加失败")
    class AofFailure {

        @Test
        @DisplayName("日志未打开时写命令返回错误且不执行")
        void testAppendFailureNotExecuted() {
            // 启用AOF但未调用startup，追加必然失败
            final RedisContext unopened = new RedisContextImpl(RedisServerConfig.builder().build());
            final CommandDispatcher failing = new CommandDispatcher(unopened);

            final Resp result = failing.dispatch(RespArray.ofBulkStrings("SET", "k", "v"), sink);

            assertEquals("ERR AOF write failed", errorOf(result));
            assertNull(unopened.getStore().get(RedisBytes.fromString("k")));
            // 读命令不受影响
            assertEquals(BulkString.NULL, failing.dispatch(RespArray.ofBulkStrings("GET", "k"), sink));
        }
    }
}
