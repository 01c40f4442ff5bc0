package io.trading.monitor.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Netty handler for WebSocket client connections.
 * Handles handshake, frame processing, idle detection and connection lifecycle events.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    // Combined depth snapshots can exceed the default 64 KiB frame limit
    static final int MAX_FRAME_PAYLOAD = 1 << 20;

    private final WebSocketClientHandshaker handshaker;
    private final String name;
    private final FeedTransport.Listener listener;

    public WebSocketClientHandler(URI uri, String name, FeedTransport.Listener listener) {
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            MAX_FRAME_PAYLOAD
        );
        this.name = name;
        this.listener = listener;
    }

    public boolean isHandshakeComplete() {
        return handshaker.isHandshakeComplete();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: WebSocket channel inactive", name);
        listener.onDisconnected();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: WebSocket handshake complete", name);
                listener.onConnected();
            } catch (Exception e) {
                LOGGER.error("{}: WebSocket handshake failed", name, e);
                listener.onError(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof TextWebSocketFrame textFrame) {
            try {
                listener.onMessage(textFrame.text());
            } catch (Exception e) {
                LOGGER.error("{}: Error in message handler", name, e);
                listener.onError(e);
            }
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.info("{}: Received close frame (status={}, reason={})",
                name, close.statusCode(), close.reasonText());
            ctx.close();
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        LOGGER.warn("{}: Unsupported frame type: {}", name, frame.getClass().getName());
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
            LOGGER.warn("{}: No data received within the read timeout, closing", name);
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("{}: WebSocket exception", name, cause);
        listener.onError(cause);
        ctx.close();
    }
}
