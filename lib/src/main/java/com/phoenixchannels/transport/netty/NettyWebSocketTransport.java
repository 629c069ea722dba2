package com.phoenixchannels.transport.netty;

import com.phoenixchannels.transport.Transport;
import com.phoenixchannels.transport.TransportConnection;
import com.phoenixchannels.transport.TransportException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link Transport} that opens RFC 6455 WebSocket connections with Netty.
 *
 * <p>One instance owns one event loop group shared by every connection it opens; call
 * {@link #shutdown()} when it is no longer needed.
 */
public class NettyWebSocketTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(NettyWebSocketTransport.class);

    public static final int DEFAULT_MAX_FRAME_SIZE = 1 << 20;
    private static final long SEND_TIMEOUT_MILLIS = 10_000;

    private final EventLoopGroup group;
    private final boolean trustAllCertificates;
    private final int maxFrameSize;
    private volatile SslContext sslContext;

    public NettyWebSocketTransport() {
        this(false);
    }

    /**
     * @param trustAllCertificates accept any server certificate on {@code wss} connections;
     *                             only meant for tests and self-signed development servers
     */
    public NettyWebSocketTransport(boolean trustAllCertificates) {
        this(trustAllCertificates, DEFAULT_MAX_FRAME_SIZE, 1);
    }

    public NettyWebSocketTransport(boolean trustAllCertificates, int maxFrameSize, int ioThreads) {
        this.trustAllCertificates = trustAllCertificates;
        this.maxFrameSize = maxFrameSize;
        this.group = new NioEventLoopGroup(ioThreads, new DefaultThreadFactory("phoenix-ws", true));
    }

    @Override
    public TransportConnection open(URI uri, Duration connectTimeout) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new TransportException("Unsupported scheme for WebSocket: " + uri);
        }
        if (group.isShuttingDown()) {
            throw new TransportException("Transport has been shut down");
        }
        boolean secure = scheme.equals("wss");
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        SslContext ssl = secure ? sslContext() : null;

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), maxFrameSize);
        CompletableFuture<NettyWebSocketConnection> handshakeFuture = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new WebSocketFrameAggregator(maxFrameSize));
                        NettyWebSocketConnection connection = new NettyWebSocketConnection(ch, SEND_TIMEOUT_MILLIS);
                        p.addLast(new WebSocketClientHandler(handshaker, connection, handshakeFuture));
                    }
                });

        logger.debug("Connecting to {}", uri);
        ChannelFuture connectFuture = bootstrap.connect(host, port);
        connectFuture.addListener(f -> {
            if (!f.isSuccess()) {
                handshakeFuture.completeExceptionally(f.cause());
            }
        });

        try {
            NettyWebSocketConnection connection = handshakeFuture.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("Connected to {}", uri);
            return connection;
        } catch (TimeoutException e) {
            closeQuietly(connectFuture.channel());
            throw new TransportException("Timed out connecting to " + uri + " after " + connectTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            closeQuietly(connectFuture.channel());
            throw new TransportException("Failed to connect to " + uri, e.getCause());
        } catch (InterruptedException e) {
            closeQuietly(connectFuture.channel());
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + uri, e);
        }
    }

    /**
     * Releases the event loop group. Open connections are closed.
     */
    public void shutdown() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
        logger.debug("WebSocket transport shut down");
    }

    private SslContext sslContext() {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    try {
                        SslContextBuilder builder = SslContextBuilder.forClient();
                        if (trustAllCertificates) {
                            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
                        }
                        ctx = builder.build();
                    } catch (SSLException e) {
                        throw new TransportException("Failed to initialise TLS", e);
                    }
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }

    private static void closeQuietly(Channel channel) {
        if (channel != null) {
            channel.close();
        }
    }
}
