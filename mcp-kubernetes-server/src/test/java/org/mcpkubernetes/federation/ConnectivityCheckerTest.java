package org.mcpkubernetes.federation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;


import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.security.cert.CertificateExpiredException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLPeerUnverifiedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mcpkubernetes.federation.ClusterUnreachableException.Reason;
import org.mcpkubernetes.metrics.FederationMetrics;

class ConnectivityCheckerTest {

    private KubernetesClient client;
    private SimpleMeterRegistry registry;
    private List<Duration> sleeps;
    private ConnectivityChecker checker;

    @BeforeEach
    void setUp() {
        client = mock(KubernetesClient.class);
        registry = new SimpleMeterRegistry();
        sleeps = new ArrayList<>();
        checker = new ConnectivityChecker(new ConnectivityConfig(Duration.ofSeconds(5), Duration.ofSeconds(30), 3,
                Duration.ofMillis(10), true), new FederationMetrics(registry), sleeps::add);
    }

    private static RequestContext ctx() {
        return RequestContext.withTimeout(Duration.ofSeconds(30));
    }

    private static KubernetesClientException transportFailure(Throwable cause) {
        return new KubernetesClientException("request failed", cause);
    }

    @Test
    void reachableClusterPassesOnFirstAttempt() {
        when(client.getKubernetesVersion()).thenReturn(new VersionInfo.Builder().build());

        checker.check(ctx(), "prod", client);

        verify(client).getKubernetesVersion();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void forbiddenAnswerStillMeansReachable() {
        when(client.getKubernetesVersion()).thenThrow(new KubernetesClientException("forbidden", 403, null));

        checker.check(ctx(), "prod", client);

        verify(client, times(1)).getKubernetesVersion();
    }

    @Test
    void transportFailuresAreRetriedWithDoublingBackoff() {
        when(client.getKubernetesVersion())
                .thenThrow(transportFailure(new ConnectException("Connection refused")))
                .thenThrow(transportFailure(new ConnectException("Connection refused")))
                .thenReturn(new VersionInfo.Builder().build());

        checker.check(ctx(), "prod", client);

        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void exhaustedRetriesReportTheClusterUnreachable() {
        when(client.getKubernetesVersion()).thenThrow(transportFailure(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> checker.check(ctx(), "prod", client))
                .isInstanceOfSatisfying(ClusterUnreachableException.class, e -> {
                    assertThat(e.reason()).isEqualTo(Reason.UNREACHABLE);
                    assertThat(e.userFacingMessage()).isEqualTo("cluster access denied or unavailable");
                });
        verify(client, times(3)).getKubernetesVersion();
        assertThat(registry.get("mcp.cluster.connectivity.failures").tag("reason", "unreachable").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void tlsFailuresAreNotRetried() {
        SSLHandshakeException handshake = new SSLHandshakeException("PKIX path building failed");
        handshake.initCause(new CertificateExpiredException("NotAfter: Mon Jan 01 00:00:00 UTC 2024"));
        when(client.getKubernetesVersion()).thenThrow(transportFailure(handshake));

        assertThatThrownBy(() -> checker.check(ctx(), "prod", client))
                .isInstanceOfSatisfying(ClusterUnreachableException.class, e -> assertThat(e.userFacingMessage())
                        .isEqualTo("cluster certificate has expired - please contact your administrator to renew "
                                + "the certificate"));
        verify(client, times(1)).getKubernetesVersion();
        assertThat(registry.get("mcp.cluster.connectivity.failures").tag("reason", "tls").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void classifiesTransportFailures() {
        assertThat(ConnectivityChecker.classify(transportFailure(new SocketTimeoutException("connect timed out"))))
                .isEqualTo(Reason.TIMEOUT);
        assertThat(ConnectivityChecker.classify(transportFailure(
                new SSLHandshakeException("PKIX path building failed: unable to find valid certification path"))))
                .isEqualTo(Reason.CERTIFICATE_UNTRUSTED);
        assertThat(ConnectivityChecker.classify(transportFailure(
                new SSLPeerUnverifiedException("Hostname prod.example.com not verified"))))
                .isEqualTo(Reason.HOSTNAME_MISMATCH);
        assertThat(ConnectivityChecker.classify(transportFailure(new SSLHandshakeException("handshake_failure"))))
                .isEqualTo(Reason.TLS);
        assertThat(ConnectivityChecker.classify(transportFailure(new ConnectException("Connection refused"))))
                .isEqualTo(Reason.UNREACHABLE);
    }

    @Test
    void disabledCheckNeverCallsTheCluster() {
        ConnectivityChecker disabled = ConnectivityChecker.disabled();
        disabled.check(ctx(), "prod", client);

        assertThat(disabled.enabled()).isFalse();

        verifyNoInteractions(client);
    }

    @Test
    void cancelledRequestStopsBeforeTheNextAttempt() {
        RequestContext ctx = ctx();
        ctx.cancel();

        assertThatThrownBy(() -> checker.check(ctx, "prod", client)).isInstanceOf(RequestAbortedException.class);
        verifyNoInteractions(client);
    }
}
