package io.uabridge.api;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.util.CharsetUtil;
import io.uabridge.hub.BroadcastHub;
import io.uabridge.hub.HubClient;
import io.uabridge.hub.HubTransport;
import io.uabridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * WebSocket endpoint of the broadcast hub. {@code GET /ws/subscribe} upgrades to a socket bound
 * to a new hub client; text frames from the peer are control messages.
 */
public final class HubWebSocketServer {
    private static final Logger log = LoggerFactory.getLogger(HubWebSocketServer.class);
    public static final String SUBSCRIBE_PATH = "/ws/subscribe";
    private static final int MAX_CONTENT_LENGTH = 65536;

    private final BroadcastHub hub;
    private final BooleanSupplier connected;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public HubWebSocketServer(BroadcastHub hub, BooleanSupplier connected) {
        this.hub = hub;
        this.connected = connected;
    }

    public synchronized void start(int port) throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(MAX_CONTENT_LENGTH),
                                new SubscribeHandler());
                    }
                });
        try {
            serverChannel = bootstrap.bind(port).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
        log.info("WebSocket hub listening on ws://0.0.0.0:{}{}", port, SUBSCRIBE_PATH);
    }

    public synchronized boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    /**
     * Bound port, or -1 when stopped. Useful when started on port 0.
     */
    public synchronized int port() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        serverChannel.close().awaitUninterruptibly();
        serverChannel = null;
        shutdownGroups();
        log.info("WebSocket hub stopped");
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }

    private final class SubscribeHandler extends SimpleChannelInboundHandler<Object> {
        private WebSocketServerHandshaker handshaker;
        private HubClient client;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest request) {
                handleHttpRequest(ctx, request);
            } else if (msg instanceof WebSocketFrame frame) {
                handleFrame(ctx, frame);
            }
        }

        private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest request) {
            String path = new QueryStringDecoder(request.uri()).path();
            if (!SUBSCRIBE_PATH.equals(path)) {
                sendJson(ctx, HttpResponseStatus.NOT_FOUND, Map.of("error", "not found"));
                return;
            }
            if (!connected.getAsBoolean()) {
                sendJson(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE, Map.of("error", "OPC UA client not connected"));
                return;
            }
            if (!request.headers().contains(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
                sendJson(ctx, HttpResponseStatus.BAD_REQUEST, Map.of("error", "websocket upgrade required"));
                return;
            }
            WebSocketServerHandshakerFactory factory = new WebSocketServerHandshakerFactory(
                    "ws://" + request.headers().get(HttpHeaderNames.HOST) + path, null, true);
            handshaker = factory.newHandshaker(request);
            if (handshaker == null) {
                WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
                return;
            }
            handshaker.handshake(ctx.channel(), request).addListener(future -> {
                if (future.isSuccess()) {
                    client = hub.register(new ChannelTransport(ctx.channel()));
                } else {
                    log.warn("WebSocket handshake failed: {}", future.cause().getMessage());
                    ctx.close();
                }
            });
        }

        private void handleFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof CloseWebSocketFrame) {
                handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
                return;
            }
            if (frame instanceof PingWebSocketFrame) {
                ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
                return;
            }
            if (frame instanceof TextWebSocketFrame text && client != null) {
                hub.handleControl(client, text.text());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            if (client != null) {
                hub.unregister(client);
                client = null;
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("WebSocket handler error: {}", cause.getMessage());
            ctx.close();
        }
    }

    private static void sendJson(ChannelHandlerContext ctx, HttpResponseStatus status, Object body) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(Jsons.toCompactJson(body), CharsetUtil.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * Sends on the hub client's writer thread; blocks until the frame is flushed so a slow
     * peer backs up into that client's queue.
     */
    static final class ChannelTransport implements HubTransport {
        private final Channel channel;

        ChannelTransport(Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(String text) throws IOException {
            if (!channel.isActive()) {
                throw new IOException("channel closed");
            }
            ChannelFuture future = channel.writeAndFlush(new TextWebSocketFrame(text)).awaitUninterruptibly();
            if (!future.isSuccess()) {
                throw new IOException("websocket send failed", future.cause());
            }
        }

        @Override
        public void close() {
            if (channel.isOpen()) {
                channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
            }
        }

        @Override
        public String remoteAddress() {
            return String.valueOf(channel.remoteAddress());
        }
    }
}
