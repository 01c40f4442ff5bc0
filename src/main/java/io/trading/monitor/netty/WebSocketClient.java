package io.trading.monitor.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Netty-based WebSocket client for the market data feed.
 * Supports both epoll (Linux) and NIO (universal) event loop groups.
 */
public class WebSocketClient implements FeedTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    private static final int CONNECT_TIMEOUT_MS = 10000;
    private static final long HANDSHAKE_TIMEOUT_MS = 10000;
    private static final int READ_IDLE_SECONDS = 60;

    private final URI uri;
    private final String name;
    private final FeedTransport.Listener listener;
    private final boolean enableCompression;

    private volatile EventLoopGroup eventLoopGroup;
    private volatile Channel channel;
    private volatile boolean connected = false;
    private volatile boolean closed = false;

    /**
     * Creates a new WebSocket client with compression enabled.
     */
    public WebSocketClient(URI uri, String name, FeedTransport.Listener listener) {
        this(uri, name, listener, true);
    }

    /**
     * Creates a new WebSocket client.
     *
     * @param uri               The WebSocket URI to connect to
     * @param name              Friendly name for logging (e.g., "Binance")
     * @param listener          Connection and message callbacks
     * @param enableCompression Whether to negotiate permessage-deflate
     */
    public WebSocketClient(URI uri, String name, FeedTransport.Listener listener, boolean enableCompression) {
        this.uri = uri;
        this.name = name;
        this.listener = listener;
        this.enableCompression = enableCompression;
    }

    /**
     * Returns a factory producing clients with the given log name.
     */
    public static FeedTransport.Factory factory(String name) {
        return (uri, listener) -> new WebSocketClient(uri, name, listener);
    }

    @Override
    public synchronized void connect() throws IOException {
        if (closed) {
            throw new IOException(name + ": client already closed");
        }
        if (channel != null) {
            LOGGER.warn("{}: Already connected", name);
            return;
        }

        SslContext sslContext = "wss".equals(uri.getScheme()) ? buildSslContext() : null;
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : ("wss".equals(uri.getScheme()) ? 443 : 80);

        eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, name.toLowerCase() + "-io");

        WebSocketClientHandler handler = new WebSocketClientHandler(uri, name, new FeedTransport.Listener() {
            @Override
            public void onConnected() {
                connected = true;
                LOGGER.info("{}: Connected", name);
                listener.onConnected();
            }

            @Override
            public void onMessage(String message) {
                listener.onMessage(message);
            }

            @Override
            public void onError(Throwable error) {
                listener.onError(error);
            }

            @Override
            public void onDisconnected() {
                connected = false;
                LOGGER.warn("{}: Disconnected", name);
                listener.onDisconnected();
            }
        });

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();

                    // SSL/TLS for wss:// connections
                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }

                    addWebSocketHandlers(pipeline, handler, enableCompression);
                }
            });

        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
        Channel opened;
        try {
            opened = bootstrap.connect(host, port).sync().channel();
            if (closed) {
                opened.close();
                return;
            }
            channel = opened;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownEventLoop();
            throw new IOException(name + ": interrupted while connecting", e);
        } catch (Exception e) {
            shutdownEventLoop();
            throw new IOException(name + ": failed to connect to " + host + ":" + port, e);
        }

        // Close a connection whose handshake never completes so the owner can reconnect
        opened.eventLoop().schedule(() -> {
            if (!handler.isHandshakeComplete()) {
                LOGGER.warn("{}: Handshake not completed within {} ms, closing", name, HANDSHAKE_TIMEOUT_MS);
                opened.close();
            }
        }, HANDSHAKE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }

    /**
     * Adds the HTTP upgrade and WebSocket stages, ending with {@code handler}.
     * Fragmented messages are reassembled before they reach the handler.
     */
    static void addWebSocketHandlers(ChannelPipeline pipeline, WebSocketClientHandler handler, boolean compression) {
        pipeline.addLast(new HttpClientCodec());
        pipeline.addLast(new HttpObjectAggregator(8192));

        if (compression) {
            pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
        }

        pipeline.addLast(new WebSocketFrameAggregator(WebSocketClientHandler.MAX_FRAME_PAYLOAD));
        pipeline.addLast(new IdleStateHandler(READ_IDLE_SECONDS, 0, 0));
        pipeline.addLast(handler);
    }

    private SslContext buildSslContext() throws IOException {
        try {
            return SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .sslProvider(SslProvider.JDK)
                .build();
        } catch (SSLException e) {
            throw new IOException(name + ": failed to create SSL context", e);
        }
    }

    @Override
    public void send(String message) {
        Channel ch = channel;
        if (!connected || ch == null) {
            LOGGER.warn("{}: Cannot send message, not connected", name);
            return;
        }

        ch.writeAndFlush(new TextWebSocketFrame(message)).addListener(future -> {
            if (!future.isSuccess()) {
                LOGGER.error("{}: Failed to send message", name, future.cause());
                listener.onError(future.cause());
            }
        });
    }

    @Override
    public boolean isConnected() {
        Channel ch = channel;
        return connected && ch != null && ch.isActive();
    }

    /**
     * Must not be called from this client's own event loop thread.
     */
    @Override
    public void close() {
        closed = true;
        connected = false;

        Channel ch = channel;
        if (ch != null) {
            try {
                ch.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.error("{}: Interrupted while closing channel", name, e);
            }
            channel = null;
        }

        shutdownEventLoop();
        LOGGER.info("{}: Closed", name);
    }

    private void shutdownEventLoop() {
        EventLoopGroup group = eventLoopGroup;
        eventLoopGroup = null;
        if (group != null) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }
}
