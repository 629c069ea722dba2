package com.phoenixchannels.client;

import com.phoenixchannels.Pid;
import com.phoenixchannels.codec.Envelope;
import com.phoenixchannels.codec.EnvelopeCodec;
import com.phoenixchannels.config.ThreadPoolFactory;
import com.phoenixchannels.transport.Frame;
import com.phoenixchannels.transport.TransportConnection;
import com.phoenixchannels.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Reads one connection on a dedicated thread and forwards what it reads to the socket actor,
 * tagged with the connection's epoch. The worker never reconnects and never touches actor state.
 */
public class ReceiveWorker {

    private static final Logger logger = LoggerFactory.getLogger(ReceiveWorker.class);

    static final long ERROR_BACKOFF_MS = 100;

    private final long epoch;
    private final TransportConnection connection;
    private final EnvelopeCodec codec;
    private final Pid socket;
    private final Thread thread;
    private volatile boolean running = true;

    /**
     * @param name       thread name
     * @param epoch      epoch of {@code connection}
     * @param connection the connection to read
     * @param codec      decoder for text frames
     * @param socket     the actor that receives the forwarded commands
     * @param threads    thread factory
     */
    public ReceiveWorker(String name,
                         long epoch,
                         TransportConnection connection,
                         EnvelopeCodec codec,
                         Pid socket,
                         ThreadPoolFactory threads) {
        this.epoch = epoch;
        this.connection = connection;
        this.codec = codec;
        this.socket = socket;
        this.thread = threads.newThread(name, this::run);
    }

    public void start() {
        thread.start();
    }

    /**
     * Asks the loop to exit and interrupts a blocking read. Does not wait.
     */
    public void stop() {
        running = false;
        thread.interrupt();
    }

    /**
     * Waits up to {@code timeout} for the thread to exit.
     *
     * @return true if the thread has exited
     */
    public boolean join(Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public long epoch() {
        return epoch;
    }

    public String name() {
        return thread.getName();
    }

    private void run() {
        logger.debug("Receive worker {} started", thread.getName());
        try {
            while (running) {
                Frame frame;
                try {
                    frame = connection.receive();
                } catch (TransportException e) {
                    if (!running) {
                        break;
                    }
                    reportError(e);
                    continue;
                }
                if (!running) {
                    break;
                }
                if (!handle(frame)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Receive worker {} exited", thread.getName());
    }

    /**
     * @return false once the loop should end
     */
    private boolean handle(Frame frame) throws InterruptedException {
        if (frame instanceof Frame.Text text) {
            Envelope envelope;
            try {
                envelope = codec.decode(text.text());
            } catch (TransportException e) {
                reportError(e);
                return true;
            }
            socket.tell(new SocketCommand.Inbound(epoch, envelope));
        } else if (frame instanceof Frame.Ping ping) {
            try {
                connection.send(new Frame.Pong(ping.data()));
            } catch (TransportException e) {
                logger.warn("Failed to answer ping on epoch {}", epoch, e);
            }
        } else if (frame instanceof Frame.Close close) {
            socket.tell(new SocketCommand.InboundClosed(epoch, close.code(), close.reason()));
            return false;
        }
        // pongs need no action
        return true;
    }

    private void reportError(TransportException error) throws InterruptedException {
        logger.warn("Receive error on epoch {}: {}", epoch, error.getMessage());
        socket.tell(new SocketCommand.InboundError(epoch, error));
        Thread.sleep(ERROR_BACKOFF_MS);
    }
}
