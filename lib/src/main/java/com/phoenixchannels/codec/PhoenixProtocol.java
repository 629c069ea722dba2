package com.phoenixchannels.codec;

/**
 * Reserved names of the Phoenix channel protocol.
 */
public final class PhoenixProtocol {

    /** Protocol version sent as the {@code vsn} query parameter. */
    public static final String VSN = "1.0.0";
    public static final String VSN_PARAM = "vsn";

    public static final String EVENT_JOIN = "phx_join";
    public static final String EVENT_REPLY = "phx_reply";
    public static final String EVENT_LEAVE = "phx_leave";
    public static final String EVENT_HEARTBEAT = "heartbeat";

    /** Topic that heartbeats are sent on. */
    public static final String HEARTBEAT_TOPIC = "phoenix";

    public static final String REPLY_STATUS = "status";
    public static final String REPLY_RESPONSE = "response";
    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    private PhoenixProtocol() {
    }
}
