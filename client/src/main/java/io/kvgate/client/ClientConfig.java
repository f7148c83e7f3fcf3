// file: client/src/main/java/io/kvgate/client/ClientConfig.java
package io.kvgate.client;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for a {@link KvClient}.
 *
 *  - baseUrl:        gateway root, e.g. http://localhost:2379
 *  - apiPrefix:      versioned API prefix, /v3alpha for older gateways, /v3 for current ones
 *  - connectTimeout: TCP connect timeout
 *  - requestTimeout: default per-call timeout, null for none
 */
public record ClientConfig(
        String baseUrl,
        String apiPrefix,
        Duration connectTimeout,
        Duration requestTimeout
) {
    public static final String DEFAULT_BASE_URL = "http://localhost:2379";
    public static final String DEFAULT_API_PREFIX = "/v3alpha";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public ClientConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(apiPrefix, "apiPrefix");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl must not be blank");
        URI uri = URI.create(baseUrl);
        if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
            throw new IllegalArgumentException("baseUrl must be http(s): " + baseUrl);
        }
        if (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        if (!apiPrefix.isEmpty() && !apiPrefix.startsWith("/")) apiPrefix = "/" + apiPrefix;
        if (apiPrefix.endsWith("/")) apiPrefix = apiPrefix.substring(0, apiPrefix.length() - 1);
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero())) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
    }

    public static ClientConfig defaults() {
        return of(DEFAULT_BASE_URL);
    }

    public static ClientConfig of(String baseUrl) {
        return new ClientConfig(baseUrl, DEFAULT_API_PREFIX, DEFAULT_CONNECT_TIMEOUT, null);
    }

    public ClientConfig withRequestTimeout(Duration timeout) {
        return new ClientConfig(baseUrl, apiPrefix, connectTimeout, timeout);
    }

    /** Absolute URI of a gateway endpoint. */
    public URI endpoint(String path) {
        return URI.create(baseUrl + apiPrefix + path);
    }

    /**
     * Very small flag parser.
     *
     * Supported flags:
     *   --base-url,   -u  <url>
     *   --api-prefix      <path>
     *   --connect-timeout-ms <millis>
     *   --request-timeout-ms <millis>
     *
     * Invalid input raises IllegalArgumentException; the caller decides how to report it.
     */
    public static ClientConfig fromArgs(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String apiPrefix = DEFAULT_API_PREFIX;
        Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        Duration requestTimeout = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--base-url", "-u" -> {
                    ensureValue(args, i);
                    baseUrl = args[++i];
                }
                case "--api-prefix" -> {
                    ensureValue(args, i);
                    apiPrefix = args[++i];
                }
                case "--connect-timeout-ms" -> {
                    ensureValue(args, i);
                    connectTimeout = Duration.ofMillis(parseMillis(args[i], args[++i]));
                }
                case "--request-timeout-ms" -> {
                    ensureValue(args, i);
                    requestTimeout = Duration.ofMillis(parseMillis(args[i], args[++i]));
                }
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ClientConfig(baseUrl, apiPrefix, connectTimeout, requestTimeout);
    }

    /**
     * Load from a JSON file:
     * <pre>
     * { "baseUrl": "http://127.0.0.1:2379", "apiPrefix": "/v3", "connectTimeoutMs": 5000, "requestTimeoutMs": 2000 }
     * </pre>
     * Missing fields take the defaults.
     */
    public static ClientConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonConfig cfg = mapper.readValue(path.toFile(), JsonConfig.class);
            return new ClientConfig(
                    cfg.baseUrl != null ? cfg.baseUrl : DEFAULT_BASE_URL,
                    cfg.apiPrefix != null ? cfg.apiPrefix : DEFAULT_API_PREFIX,
                    cfg.connectTimeoutMs != null ? Duration.ofMillis(cfg.connectTimeoutMs) : DEFAULT_CONNECT_TIMEOUT,
                    cfg.requestTimeoutMs != null ? Duration.ofMillis(cfg.requestTimeoutMs) : null
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ClientConfig from " + path, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static long parseMillis(String flag, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag.substring(2) + ": " + value);
        }
    }

    /** Jackson binding for {@link #fromJsonFile(Path)}. */
    public static class JsonConfig {
        public String baseUrl;
        public String apiPrefix;
        public Long connectTimeoutMs;
        public Long requestTimeoutMs;
    }
}
