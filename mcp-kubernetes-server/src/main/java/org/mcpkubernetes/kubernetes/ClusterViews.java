package org.mcpkubernetes.kubernetes;

import java.time.Instant;
import org.mcpkubernetes.discovery.ClusterSummary;
import org.mcpkubernetes.kubernetes.dto.ClusterDetailOutput;
import org.mcpkubernetes.kubernetes.dto.ClusterListItem;
import org.mcpkubernetes.kubernetes.dto.ClusterMetadataInfo;
import org.mcpkubernetes.kubernetes.dto.ClusterStatusInfo;

final class ClusterViews {

    private ClusterViews() {
    }

    static ClusterListItem toListItem(ClusterSummary cluster, Instant now) {
        return new ClusterListItem(
                cluster.name(),
                cluster.namespace(),
                cluster.organization(),
                cluster.provider(),
                cluster.release(),
                cluster.phase(),
                cluster.ready(),
                cluster.age(now),
                cluster.nodeCount());
    }

    static ClusterDetailOutput toDetail(ClusterSummary cluster, Instant now) {
        ClusterMetadataInfo metadata = new ClusterMetadataInfo(
                cluster.organization(),
                cluster.provider(),
                cluster.release(),
                cluster.kubernetesVersion(),
                cluster.createdAt() == null ? null : cluster.createdAt().toString(),
                cluster.age(now),
                cluster.description());
        ClusterStatusInfo status = new ClusterStatusInfo(
                cluster.phase(),
                cluster.ready(),
                cluster.controlPlaneReady(),
                cluster.infrastructureReady(),
                cluster.nodeCount());
        return new ClusterDetailOutput(cluster.name(), cluster.namespace(), metadata, status, cluster.labels(),
                cluster.annotations());
    }
}
