package io.tacoq.broker;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Connection settings shared by every broker backend.
 *
 * @param url            broker URL; its scheme selects the backend and it carries the credentials
 * @param namespace      prefix for pub/sub channel names
 * @param exchange       optional coordinator submission exchange declared on connect (AMQP only)
 * @param connectTimeout timeout applied when opening the transport session
 */
public record BrokerConfig(String url, String namespace, String exchange, Duration connectTimeout) {

    public static final String DEFAULT_NAMESPACE = "tacoq";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public BrokerConfig {
        url = url == null ? null : url.trim();
        namespace = namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace.trim();
        exchange = exchange == null || exchange.isBlank() ? null : exchange.trim();
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
    }

    public static BrokerConfig of(String url) {
        return new BrokerConfig(url, null, null, null);
    }

    /**
     * Lower-cased URL scheme, or {@code null} when the URL is missing or has none.
     */
    public String scheme() {
        if (url == null || url.isEmpty()) {
            return null;
        }
        try {
            String scheme = URI.create(url).getScheme();
            return scheme == null ? null : scheme.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    /**
     * URL with the password masked, safe for logging.
     */
    public String redactedUrl() {
        if (url == null) {
            return "<none>";
        }
        return url.replaceAll("://([^:/@]*):[^@/]*@", "://$1:****@");
    }
}
