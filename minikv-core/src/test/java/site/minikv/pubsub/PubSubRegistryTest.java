package site.minikv.pubsub;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.datastructure.RedisBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.BulkString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("发布订阅注册表测试")
class PubSubRegistryTest {

    private PubSubRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PubSubRegistry();
    }

    private static RedisBytes b(final String s) {
        return RedisBytes.fromString(s);
    }

    /** 记录收到内容的出口 */
    static class RecordingSink implements ReplySink {
        final List<Resp> received = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void send(final Resp resp) {
            received.add(resp);
        }

        @Override
        public boolean isActive() {
            return true;
        }
    }

    @Test
    @DisplayName("订阅确认按顺序编号")
    void testSubscribeConfirmations() {
        final RecordingSink sink = new RecordingSink();

        registry.subscribe(Arrays.asList(b("a"), b("b")), sink);

        assertEquals(Arrays.asList(
                RespArray.valueOf(BulkString.fromString("subscribe"), BulkString.fromString("a"), RespInteger.ONE),
                RespArray.valueOf(BulkString.fromString("subscribe"), BulkString.fromString("b"), RespInteger.valueOf(2))),
                sink.received);
        assertEquals(2, registry.channelCount());
    }

    @Test
    @DisplayName("两个订阅者都收到消息，发布返回2")
    void testFanOut() {
        final RecordingSink first = new RecordingSink();
        final RecordingSink second = new RecordingSink();
        registry.subscribe(Collections.singletonList(b("c")), first);
        registry.subscribe(Collections.singletonList(b("c")), second);

        assertEquals(2, registry.publish(b("c"), b("hi")));

        final RespArray expected = RespArray.ofBulkStrings("message", "c", "hi");
        assertEquals(expected, first.received.get(1));
        assertEquals(expected, second.received.get(1));
    }

    @Test
    @DisplayName("没有订阅者时返回0")
    void testPublishWithoutSubscribers() {
        assertEquals(0, registry.publish(b("nobody"), b("hi")));
    }

    @Test
    @DisplayName("投递失败仍计入返回值，并继续投递其余出口")
    void testFailedSinkStillCounted() {
        final ReplySink broken = mock(ReplySink.class);
        final RecordingSink healthy = new RecordingSink();
        registry.subscribe(Collections.singletonList(b("c")), broken);
        registry.subscribe(Collections.singletonList(b("c")), healthy);
        doThrow(new IllegalStateException("closed")).when(broken).send(any(RespArray.class));

        assertEquals(2, registry.publish(b("c"), b("hi")));
        assertEquals(2, healthy.received.size());
    }

    @Test
    @DisplayName("连接关闭后移除其所有订阅")
    void testUnsubscribeAll() {
        final RecordingSink gone = new RecordingSink();
        final RecordingSink stay = new RecordingSink();
        registry.subscribe(Arrays.asList(b("x"), b("y")), gone);
        registry.subscribe(Collections.singletonList(b("x")), stay);

        assertEquals(2, registry.unsubscribeAll(gone));

        assertEquals(1, registry.publish(b("x"), b("m")));
        assertEquals(0, registry.subscriberCount(b("y")));
        assertEquals(1, registry.channelCount());
    }
}
