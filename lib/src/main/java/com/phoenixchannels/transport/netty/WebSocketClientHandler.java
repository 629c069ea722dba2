package com.phoenixchannels.transport.netty;

import com.phoenixchannels.transport.Frame;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Completes the WebSocket handshake and then translates Netty frames into transport frames.
 * Ping frames are passed up rather than answered here so the reader decides how to respond.
 */
class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final NettyWebSocketConnection connection;
    private final CompletableFuture<NettyWebSocketConnection> handshakeFuture;

    WebSocketClientHandler(WebSocketClientHandshaker handshaker,
                           NettyWebSocketConnection connection,
                           CompletableFuture<NettyWebSocketConnection> handshakeFuture) {
        this.handshaker = handshaker;
        this.connection = connection;
        this.handshakeFuture = handshakeFuture;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.completeExceptionally(
                    new WebSocketHandshakeException("Channel closed before handshake completed"));
        }
        connection.channelLost();
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                logger.debug("WebSocket handshake with {} complete", ctx.channel().remoteAddress());
                handshakeFuture.complete(connection);
            } catch (WebSocketHandshakeException e) {
                handshakeFuture.completeExceptionally(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof TextWebSocketFrame textFrame) {
            connection.deliver(new Frame.Text(textFrame.text()));
        } else if (msg instanceof BinaryWebSocketFrame binaryFrame) {
            connection.deliver(new Frame.Text(binaryFrame.content().toString(StandardCharsets.UTF_8)));
        } else if (msg instanceof PingWebSocketFrame pingFrame) {
            connection.deliver(new Frame.Ping(bytes(pingFrame.content())));
        } else if (msg instanceof PongWebSocketFrame pongFrame) {
            connection.deliver(new Frame.Pong(bytes(pongFrame.content())));
        } else if (msg instanceof CloseWebSocketFrame closeFrame) {
            connection.deliver(new Frame.Close(closeFrame.statusCode(), closeFrame.reasonText()));
            ctx.close();
        } else {
            logger.debug("Ignoring unexpected inbound message {}", msg.getClass().getSimpleName());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("WebSocket channel {} failed", ctx.channel().remoteAddress(), cause);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.completeExceptionally(cause);
        }
        ctx.close();
    }

    private static byte[] bytes(ByteBuf content) {
        return ByteBufUtil.getBytes(content);
    }
}
