package com.phoenixchannels.transport.netty;

import com.phoenixchannels.transport.Frame;
import com.phoenixchannels.transport.TransportConnection;
import com.phoenixchannels.transport.TransportException;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket connection over a Netty channel. The channel's event loop pushes inbound frames
 * into a queue that {@link #receive()} drains.
 */
final class NettyWebSocketConnection implements TransportConnection {

    private static final Logger logger = LoggerFactory.getLogger(NettyWebSocketConnection.class);

    private static final Object ABORT_SIGNAL = new Object();

    private final Channel channel;
    private final long sendTimeoutMillis;
    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closeDelivered = new AtomicBoolean(false);
    private volatile boolean closeRequested = false;
    private volatile boolean aborted = false;

    NettyWebSocketConnection(Channel channel, long sendTimeoutMillis) {
        this.channel = channel;
        this.sendTimeoutMillis = sendTimeoutMillis;
    }

    @Override
    public void send(Frame frame) {
        if (!isOpen()) {
            throw new TransportException("Connection to " + channel.remoteAddress() + " is not open");
        }
        ChannelFuture write = channel.writeAndFlush(toWebSocketFrame(frame));
        try {
            if (!write.await(sendTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new TransportException("Timed out writing " + frame.getClass().getSimpleName() + " frame");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while writing frame", e);
        }
        if (!write.isSuccess()) {
            throw new TransportException("Failed to write frame", write.cause());
        }
    }

    @Override
    public Frame receive() throws InterruptedException {
        if (aborted) {
            throw new TransportException("Connection aborted");
        }
        Object next = inbound.take();
        if (next == ABORT_SIGNAL) {
            throw new TransportException("Connection aborted");
        }
        return (Frame) next;
    }

    @Override
    public void close() {
        if (closeRequested || aborted) {
            return;
        }
        closeRequested = true;
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame(Frame.NORMAL_CLOSURE, ""))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
        logger.debug("Closing connection to {}", channel.remoteAddress());
    }

    @Override
    public void abort() {
        if (aborted) {
            return;
        }
        aborted = true;
        inbound.offer(ABORT_SIGNAL);
        channel.close();
        logger.debug("Aborted connection to {}", channel.remoteAddress());
    }

    @Override
    public boolean isOpen() {
        return channel.isActive() && !closeRequested && !aborted;
    }

    void deliver(Frame frame) {
        if (frame instanceof Frame.Close) {
            if (!closeDelivered.compareAndSet(false, true)) {
                return;
            }
        }
        inbound.offer(frame);
    }

    void channelLost() {
        deliver(new Frame.Close(Frame.ABNORMAL_CLOSURE, "connection lost"));
    }

    private static WebSocketFrame toWebSocketFrame(Frame frame) {
        if (frame instanceof Frame.Text text) {
            return new TextWebSocketFrame(text.text());
        } else if (frame instanceof Frame.Ping ping) {
            return new PingWebSocketFrame(Unpooled.wrappedBuffer(ping.data()));
        } else if (frame instanceof Frame.Pong pong) {
            return new PongWebSocketFrame(Unpooled.wrappedBuffer(pong.data()));
        } else if (frame instanceof Frame.Close close) {
            return new CloseWebSocketFrame(close.code(), close.reason());
        }
        throw new IllegalArgumentException("Unsupported frame: " + frame);
    }
}
