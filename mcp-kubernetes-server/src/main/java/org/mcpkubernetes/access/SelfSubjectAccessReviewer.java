package org.mcpkubernetes.access;

import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectAccessReview;
import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectAccessReviewBuilder;
import io.fabric8.kubernetes.api.model.authorization.v1.SubjectAccessReviewStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.mcpkubernetes.federation.AccessCheckException;
import org.mcpkubernetes.federation.ClusterNames;

/**
 * Asks the API server whether the client's (impersonated) user may perform an action. Creating a
 * {@code SelfSubjectAccessReview} stores nothing on the cluster.
 */
public class SelfSubjectAccessReviewer {

    public AccessCheckResult review(KubernetesClient client, String clusterName, AccessCheck check) {
        SelfSubjectAccessReview review = new SelfSubjectAccessReviewBuilder()
                .withNewSpec()
                .withNewResourceAttributes()
                .withVerb(check.verb())
                .withResource(check.resource())
                .withGroup(emptyToNull(check.apiGroup()))
                .withNamespace(emptyToNull(check.namespace()))
                .withName(emptyToNull(check.name()))
                .withSubresource(emptyToNull(check.subresource()))
                .endResourceAttributes()
                .endSpec()
                .build();

        SelfSubjectAccessReview response;
        try {
            response = client.authorization().v1().selfSubjectAccessReview().create(review);
        } catch (KubernetesClientException e) {
            throw new AccessCheckException(ClusterNames.display(clusterName), e);
        }
        SubjectAccessReviewStatus status = response == null ? null : response.getStatus();
        if (status == null) {
            return new AccessCheckResult(false, false, "", "");
        }
        return new AccessCheckResult(
                Boolean.TRUE.equals(status.getAllowed()),
                Boolean.TRUE.equals(status.getDenied()),
                status.getReason() == null ? "" : status.getReason(),
                status.getEvaluationError() == null ? "" : status.getEvaluationError());
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
