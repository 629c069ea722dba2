package com.phoenixchannels.client;

import com.phoenixchannels.codec.PhoenixProtocol;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Connection settings for a {@link PhoenixSocket}. Setters return {@code this}.
 * Validation happens when the configuration is used to connect.
 */
public class SocketConfig {

    public static final String DEFAULT_PATH = "/";
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(30_000);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5_000);
    public static final Duration DEFAULT_MAX_TIMEOUT = Duration.ofMillis(60_000);
    public static final Duration DEFAULT_ASK_TIMEOUT = Duration.ofSeconds(5);

    private String host;
    private Integer port;
    private String path = DEFAULT_PATH;
    private final Map<String, String> params = new LinkedHashMap<>();
    private boolean secure = false;
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration defaultTimeout = DEFAULT_TIMEOUT;
    private Duration maxTimeout = DEFAULT_MAX_TIMEOUT;
    private Duration askTimeout = DEFAULT_ASK_TIMEOUT;

    public SocketConfig() {
        // Use defaults
    }

    public SocketConfig(SocketConfig other) {
        this.host = other.host;
        this.port = other.port;
        this.path = other.path;
        this.params.putAll(other.params);
        this.secure = other.secure;
        this.heartbeatInterval = other.heartbeatInterval;
        this.connectTimeout = other.connectTimeout;
        this.defaultTimeout = other.defaultTimeout;
        this.maxTimeout = other.maxTimeout;
        this.askTimeout = other.askTimeout;
    }

    /**
     * Checks that the configuration can be turned into an endpoint.
     *
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public void validate() {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        requirePositive("heartbeatInterval", heartbeatInterval);
        requirePositive("connectTimeout", connectTimeout);
        requirePositive("defaultTimeout", defaultTimeout);
        requirePositive("maxTimeout", maxTimeout);
        requirePositive("askTimeout", askTimeout);
    }

    /**
     * Builds {@code ws[s]://host[:port]/path?params&vsn=1.0.0}. Caller params keep their
     * insertion order; a caller-supplied {@code vsn} is replaced.
     *
     * @return the endpoint URI
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public URI toUri() {
        validate();
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (!PhoenixProtocol.VSN_PARAM.equals(param.getKey())) {
                query.add(encode(param.getKey()) + "=" + encode(param.getValue()));
            }
        }
        query.add(PhoenixProtocol.VSN_PARAM + "=" + encode(PhoenixProtocol.VSN));

        String normalizedPath = path == null || path.isEmpty() ? DEFAULT_PATH : path;
        if (!normalizedPath.startsWith("/")) {
            normalizedPath = "/" + normalizedPath;
        }
        String authority = port != null ? host + ":" + port : host;
        String uri = (secure ? "wss" : "ws") + "://" + authority + normalizedPath + "?" + query;
        try {
            return new URI(uri);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid socket address: " + uri, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public String getHost() {
        return host;
    }

    public SocketConfig setHost(String host) {
        this.host = host;
        return this;
    }

    public Integer getPort() {
        return port;
    }

    public SocketConfig setPort(Integer port) {
        this.port = port;
        return this;
    }

    public String getPath() {
        return path;
    }

    public SocketConfig setPath(String path) {
        this.path = path;
        return this;
    }

    public Map<String, String> getParams() {
        return Collections.unmodifiableMap(params);
    }

    public SocketConfig setParams(Map<String, String> params) {
        this.params.clear();
        this.params.putAll(params);
        return this;
    }

    public SocketConfig addParam(String name, String value) {
        this.params.put(name, value);
        return this;
    }

    public boolean isSecure() {
        return secure;
    }

    public SocketConfig setSecure(boolean secure) {
        this.secure = secure;
        return this;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public SocketConfig setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
        return this;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public SocketConfig setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    /**
     * Timeout used by channel operations that are not given one explicitly.
     */
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public SocketConfig setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
        return this;
    }

    /**
     * Upper bound on how long a caller waits for a reply, whatever timeout it asked for.
     */
    public Duration getMaxTimeout() {
        return maxTimeout;
    }

    public SocketConfig setMaxTimeout(Duration maxTimeout) {
        this.maxTimeout = maxTimeout;
        return this;
    }

    public Duration getAskTimeout() {
        return askTimeout;
    }

    public SocketConfig setAskTimeout(Duration askTimeout) {
        this.askTimeout = askTimeout;
        return this;
    }

    @Override
    public String toString() {
        return "SocketConfig{host=" + host + ", port=" + port + ", path=" + path + ", secure=" + secure
                + ", heartbeatInterval=" + heartbeatInterval.toMillis() + "ms}";
    }
}
