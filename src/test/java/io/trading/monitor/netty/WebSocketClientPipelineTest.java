package io.trading.monitor.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.ContinuationWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client's WebSocket pipeline on an embedded channel, past a real upgrade handshake.
 */
class WebSocketClientPipelineTest {

    private static final String WEBSOCKET_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";
    private static final Pattern KEY_HEADER = Pattern.compile("(?im)^sec-websocket-key:\\s*(\\S+)\\s*$");

    private final List<String> messages = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private int connects;

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        WebSocketClientHandler handler = new WebSocketClientHandler(
            URI.create("wss://stream.example.test:9443/stream"), "Test", new FeedTransport.Listener() {
                @Override
                public void onConnected() {
                    connects++;
                }

                @Override
                public void onMessage(String message) {
                    messages.add(message);
                }

                @Override
                public void onError(Throwable error) {
                    errors.add(error);
                }

                @Override
                public void onDisconnected() {
                }
            });

        channel = new EmbeddedChannel(new ChannelInitializer<Channel>() {
            @Override
            protected void initChannel(Channel ch) {
                WebSocketClient.addWebSocketHandlers(ch.pipeline(), handler, false);
            }
        });

        completeHandshake();
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void completeHandshake() throws Exception {
        StringBuilder request = new StringBuilder();
        Object out;
        while ((out = channel.readOutbound()) != null) {
            ByteBuf buf = (ByteBuf) out;
            request.append(buf.toString(StandardCharsets.US_ASCII));
            buf.release();
        }
        Matcher key = KEY_HEADER.matcher(request);
        assertTrue(key.find(), "upgrade request carries a key");

        byte[] digest = MessageDigest.getInstance("SHA-1")
            .digest((key.group(1) + WEBSOCKET_GUID).getBytes(StandardCharsets.US_ASCII));
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.SWITCHING_PROTOCOLS);
        response.headers()
            .set(HttpHeaderNames.UPGRADE, "websocket")
            .set(HttpHeaderNames.CONNECTION, "Upgrade")
            .set(HttpHeaderNames.SEC_WEBSOCKET_ACCEPT, Base64.getEncoder().encodeToString(digest));

        channel.writeInbound(response);
        channel.runPendingTasks();
        assertEquals(1, connects);
    }

    @Test
    void testSingleFrameMessageDelivered() {
        channel.writeInbound(new TextWebSocketFrame("{\"result\":null,\"id\":1}"));

        assertEquals(List.of("{\"result\":null,\"id\":1}"), messages);
        assertTrue(errors.isEmpty());
    }

    @Test
    void testFragmentedMessageReassembled() {
        String part1 = "{\"stream\":\"btcusdt@depth20@100ms\",\"data\":{\"lastUpdateId\":10,";
        String part2 = "\"bids\":[[\"42000.10\",\"1.5\"]],";
        String part3 = "\"asks\":[[\"42000.20\",\"0.75\"]]}}";

        channel.writeInbound(new TextWebSocketFrame(false, 0, part1));
        channel.writeInbound(new ContinuationWebSocketFrame(false, 0, part2));
        assertTrue(messages.isEmpty());

        channel.writeInbound(new ContinuationWebSocketFrame(true, 0, part3));

        assertEquals(List.of(part1 + part2 + part3), messages);
        assertTrue(errors.isEmpty());
    }
}
