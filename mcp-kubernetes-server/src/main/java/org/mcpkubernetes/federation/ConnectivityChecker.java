package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.net.SocketTimeoutException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateExpiredException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLPeerUnverifiedException;
import org.jboss.logging.Logger;
import org.mcpkubernetes.metrics.FederationMetrics;

/**
 * Verifies that a newly built workload cluster client reaches its API server before it is cached.
 * <p>
 * Any HTTP answer, including 401 and 403, counts as reachable: authorization is decided per request. Transport
 * failures are retried with exponential backoff inside the request deadline, except TLS failures, which would fail
 * the same way again.
 */
public class ConnectivityChecker {

    private static final Logger LOG = Logger.getLogger(ConnectivityChecker.class);

    private final ConnectivityConfig config;
    private final FederationMetrics metrics;
    private final Sleeper sleeper;

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public ConnectivityChecker(ConnectivityConfig config, FederationMetrics metrics) {
        this(config, metrics, duration -> Thread.sleep(duration.toMillis()));
    }

    ConnectivityChecker(ConnectivityConfig config, FederationMetrics metrics, Sleeper sleeper) {
        this.config = config;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public static ConnectivityChecker disabled() {
        return new ConnectivityChecker(new ConnectivityConfig(null, null, 1, null, false), FederationMetrics.noop());
    }

    public boolean enabled() {
        return config.checkEnabled();
    }

    public void check(RequestContext ctx, String clusterName, KubernetesClient client) {
        if (!config.checkEnabled()) {
            return;
        }
        String cluster = ClusterNames.display(clusterName);
        ClusterUnreachableException last = null;
        for (int attempt = 0; attempt < config.retryAttempts(); attempt++) {
            if (attempt > 0) {
                backoff(ctx, attempt);
            }
            ctx.checkActive();
            try {
                client.getKubernetesVersion();
                if (attempt > 0) {
                    LOG.debugf("Cluster %s reachable after %d attempts", cluster, attempt + 1);
                }
                return;
            } catch (KubernetesClientException e) {
                if (e.getCode() > 0) {
                    return;
                }
                last = new ClusterUnreachableException(cluster, classify(e), e);
            } catch (RuntimeException e) {
                last = new ClusterUnreachableException(cluster, classify(e), e);
            }
            LOG.debugf("Reachability attempt %d for cluster %s failed: %s", attempt + 1, cluster,
                    last.reason());
            if (last.reason().isTls()) {
                break;
            }
        }
        metrics.recordConnectivityFailure(last.reason().tag());
        LOG.warnf("Cluster %s unreachable (%s)", cluster, last.reason());
        throw last;
    }

    private void backoff(RequestContext ctx, int attempt) {
        Duration wait = config.retryBackoff().multipliedBy(1L << Math.min(attempt - 1, 10));
        if (wait.compareTo(ctx.remaining()) >= 0) {
            throw new RequestAbortedException("request deadline exceeded");
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestAbortedException("interrupted while waiting to retry cluster connection");
        }
    }

    static ClusterUnreachableException.Reason classify(Throwable error) {
        if (hasCause(error, CertificateExpiredException.class)) {
            return ClusterUnreachableException.Reason.CERTIFICATE_EXPIRED;
        }
        if (hasCause(error, SSLPeerUnverifiedException.class)) {
            return ClusterUnreachableException.Reason.HOSTNAME_MISMATCH;
        }
        String messages = chainMessages(error);
        if (hasCause(error, SSLException.class) || hasCause(error, CertificateException.class)) {
            if (messages.contains("expired")) {
                return ClusterUnreachableException.Reason.CERTIFICATE_EXPIRED;
            }
            if (messages.contains("pkix") || messages.contains("unable to find valid certification path")
                    || messages.contains("unknown authority")) {
                return ClusterUnreachableException.Reason.CERTIFICATE_UNTRUSTED;
            }
            if (messages.contains("subject alternative") || messages.contains("hostname")) {
                return ClusterUnreachableException.Reason.HOSTNAME_MISMATCH;
            }
            return ClusterUnreachableException.Reason.TLS;
        }
        if (hasCause(error, SocketTimeoutException.class) || hasCause(error, TimeoutException.class)
                || messages.contains("timed out")) {
            return ClusterUnreachableException.Reason.TIMEOUT;
        }
        return ClusterUnreachableException.Reason.UNREACHABLE;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable cause = error; cause != null; cause = next(cause)) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }

    private static String chainMessages(Throwable error) {
        StringBuilder messages = new StringBuilder();
        for (Throwable cause = error; cause != null; cause = next(cause)) {
            if (cause.getMessage() != null) {
                messages.append(cause.getMessage().toLowerCase(Locale.ROOT)).append('\n');
            }
        }
        return messages.toString();
    }

    private static Throwable next(Throwable cause) {
        return cause.getCause() == cause ? null : cause.getCause();
    }
}
