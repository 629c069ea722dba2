package com.phoenixchannels.client;

import com.phoenixchannels.ActorSystem;
import com.phoenixchannels.AsyncAssertion;
import com.phoenixchannels.codec.JacksonEnvelopeCodec;
import com.phoenixchannels.transport.Frame;
import com.phoenixchannels.transport.Transport;
import com.phoenixchannels.transport.TransportConnection;
import com.phoenixchannels.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Connection lifecycle of the socket actor against mocked transport collaborators.
 */
@Timeout(15)
class SocketHandlerTest {

    private ActorSystem system;
    private Transport transport;
    private PhoenixSocket socket;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
        transport = Mockito.mock(Transport.class);
        socket = PhoenixSocket.start(system, transport, new JacksonEnvelopeCodec());
    }

    @AfterEach
    void tearDown() {
        system.shutdown();
    }

    /** A connection whose receive blocks until the reading thread is interrupted. */
    private static TransportConnection blockingConnection() throws Exception {
        TransportConnection connection = Mockito.mock(TransportConnection.class);
        when(connection.receive()).thenAnswer(invocation -> {
            new CountDownLatch(1).await();
            return null;
        });
        when(connection.isOpen()).thenReturn(true);
        return connection;
    }

    private static SocketConfig config() {
        return new SocketConfig().setHost("example.com").setConnectTimeout(Duration.ofSeconds(3));
    }

    @Test
    void connectPassesTheUriAndConnectTimeout() throws Exception {
        TransportConnection connection = blockingConnection();
        when(transport.open(any(), any())).thenReturn(connection);

        socket.connect(config());

        verify(transport).open(URI.create("ws://example.com/?vsn=1.0.0"), Duration.ofSeconds(3));
    }

    @Test
    void reconnectClosesTheOldConnectionBeforeOpeningTheNext() throws Exception {
        TransportConnection first = blockingConnection();
        TransportConnection second = blockingConnection();
        when(transport.open(any(), any())).thenReturn(first, second);

        socket.connect(config());
        socket.reconnect();

        InOrder order = inOrder(transport, first);
        order.verify(transport).open(any(), any());
        order.verify(first).close();
        order.verify(transport).open(any(), any());
        verify(second, never()).close();
        assertEquals(2, socket.status().epoch());
    }

    @Test
    void failedReopenLeavesTheSocketDisconnected() throws Exception {
        TransportConnection first = blockingConnection();
        when(transport.open(any(), any()))
                .thenReturn(first)
                .thenThrow(new TransportException("refused"));

        socket.connect(config());
        assertThrows(SocketConnectException.class, () -> socket.reconnect());

        verify(first).close();
        SocketStatus status = socket.status();
        assertEquals(ConnectionState.DISCONNECTED, status.state());
        assertEquals(1, status.epoch());
        assertFalse(status.heartbeatScheduled());
        assertFalse(status.workerRunning());
    }

    @Test
    void heartbeatGoesOutAsATextFrame() throws Exception {
        TransportConnection connection = blockingConnection();
        when(transport.open(any(), any())).thenReturn(connection);

        socket.connect(config().setHeartbeatInterval(Duration.ofMillis(50)));

        verify(connection, timeout(2000).atLeast(2)).send(argThat(frame ->
                frame instanceof Frame.Text text
                        && text.text().contains("\"event\":\"heartbeat\"")
                        && text.text().contains("\"topic\":\"phoenix\"")));
    }

    @Test
    void closeAbortsTheConnectionAndStopsTheWorker() throws Exception {
        TransportConnection connection = blockingConnection();
        when(transport.open(any(), any())).thenReturn(connection);
        socket.connect(config());
        AsyncAssertion.eventually(() -> socket.status().workerRunning(), Duration.ofSeconds(2));

        socket.close();

        verify(connection).abort();
        verify(connection, never()).close();
        assertNull(system.getActor(socket.pid()));
    }
}
