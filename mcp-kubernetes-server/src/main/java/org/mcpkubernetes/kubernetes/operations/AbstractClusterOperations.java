package org.mcpkubernetes.kubernetes.operations;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.ListMeta;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.mcpkubernetes.federation.RequestContext;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.output.ListOptions;
import org.mcpkubernetes.output.PaginatedResult;

abstract class AbstractClusterOperations implements ClusterOperations {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    protected AbstractClusterOperations(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract KubernetesClient client(RequestContext ctx, Identity identity, String cluster);

    @Override
    public Optional<Map<String, Object>> get(RequestContext ctx, Identity identity, String cluster,
            String apiVersion, String kind, String namespace, String name) {
        KubernetesClient client = client(ctx, identity, cluster);
        ctx.checkActive();
        MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> resources =
                client.genericKubernetesResources(apiVersion, kind);
        GenericKubernetesResource resource = isBlank(namespace)
                ? resources.withName(name).get()
                : resources.inNamespace(namespace).withName(name).get();
        return Optional.ofNullable(resource).map(this::toMap);
    }

    @Override
    public PaginatedResult list(RequestContext ctx, Identity identity, String cluster, String apiVersion,
            String kind, String namespace, ListOptions options) {
        KubernetesClient client = client(ctx, identity, cluster);
        ctx.checkActive();
        MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> resources =
                client.genericKubernetesResources(apiVersion, kind);
        io.fabric8.kubernetes.api.model.ListOptions listOptions = new ListOptionsBuilder()
                .withLimit(options.limit() > 0 ? (long) options.limit() : null)
                .withContinue(blankToNull(options.continueToken()))
                .withLabelSelector(blankToNull(options.labelSelector()))
                .withFieldSelector(blankToNull(options.fieldSelector()))
                .build();

        GenericKubernetesResourceList list;
        if (options.allNamespaces()) {
            list = resources.inAnyNamespace().list(listOptions);
        } else if (!isBlank(namespace)) {
            list = resources.inNamespace(namespace).list(listOptions);
        } else {
            list = resources.list(listOptions);
        }

        List<Map<String, Object>> items = list == null || list.getItems() == null
                ? List.of()
                : list.getItems().stream().map(item -> withTypeMeta(toMap(item), apiVersion, kind)).toList();
        ListMeta meta = list == null ? null : list.getMetadata();
        String continueToken = meta == null ? null : blankToNull(meta.getContinue());
        Long remaining = meta == null ? null : meta.getRemainingItemCount();
        int total = items.size() + (remaining == null ? 0 : remaining.intValue());
        return new PaginatedResult(items, continueToken, meta == null ? null : meta.getResourceVersion(), remaining,
                total);
    }

    private Map<String, Object> toMap(GenericKubernetesResource resource) {
        return objectMapper.convertValue(resource, JSON_OBJECT);
    }

    // List items usually arrive without kind and apiVersion; masking and summaries key off the kind.
    private static Map<String, Object> withTypeMeta(Map<String, Object> item, String apiVersion, String kind) {
        if (item.get("kind") != null && item.get("apiVersion") != null) {
            return item;
        }
        Map<String, Object> typed = new LinkedHashMap<>(item);
        typed.putIfAbsent("apiVersion", apiVersion);
        typed.putIfAbsent("kind", kind);
        return typed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
