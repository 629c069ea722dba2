package com.phoenixchannels.transport;

import java.util.Arrays;
import java.util.Objects;

/**
 * A discrete message on a transport connection.
 */
public sealed interface Frame permits Frame.Text, Frame.Ping, Frame.Pong, Frame.Close {

    /** Close code used when the channel disappears without a close handshake. */
    int ABNORMAL_CLOSURE = 1006;

    /** Close code for an orderly shutdown. */
    int NORMAL_CLOSURE = 1000;

    record Text(String text) implements Frame {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    record Ping(byte[] data) implements Frame {
        public Ping {
            data = data == null ? new byte[0] : data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ping other && Arrays.equals(data, other.data);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "Ping[" + data.length + " bytes]";
        }
    }

    record Pong(byte[] data) implements Frame {
        public Pong {
            data = data == null ? new byte[0] : data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Pong other && Arrays.equals(data, other.data);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "Pong[" + data.length + " bytes]";
        }
    }

    record Close(int code, String reason) implements Frame {
        public Close {
            reason = reason == null ? "" : reason;
        }
    }
}
