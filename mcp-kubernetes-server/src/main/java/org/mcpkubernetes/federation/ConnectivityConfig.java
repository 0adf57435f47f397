package org.mcpkubernetes.federation;

import java.time.Duration;

/**
 * Timeouts and retry policy for clients that talk to workload clusters.
 *
 * @param connectionTimeout TCP connect timeout, also the bound for each reachability attempt
 * @param requestTimeout    per-request timeout set on every impersonated client
 * @param retryAttempts     reachability attempts before a cluster is reported unreachable
 * @param retryBackoff      wait before the second attempt, doubled for each further one
 * @param checkEnabled      whether new workload cluster clients are checked before they are cached
 */
public record ConnectivityConfig(Duration connectionTimeout, Duration requestTimeout, int retryAttempts,
        Duration retryBackoff, boolean checkEnabled) {

    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);

    public ConnectivityConfig {
        connectionTimeout = positiveOr(connectionTimeout, DEFAULT_CONNECTION_TIMEOUT);
        requestTimeout = positiveOr(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
        retryAttempts = retryAttempts <= 0 ? DEFAULT_RETRY_ATTEMPTS : retryAttempts;
        retryBackoff = positiveOr(retryBackoff, DEFAULT_RETRY_BACKOFF);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    static int millis(Duration duration) {
        return (int) Math.min(Integer.MAX_VALUE, duration.toMillis());
    }
}
