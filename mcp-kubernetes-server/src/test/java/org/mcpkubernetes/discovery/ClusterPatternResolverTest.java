package org.mcpkubernetes.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mcpkubernetes.discovery.Clusters.cluster;

import java.util.List;
import org.junit.jupiter.api.Test;

class ClusterPatternResolverTest {

    private final List<ClusterSummary> clusters = List.of(
            cluster("prod-wc-01"), cluster("staging-wc"), cluster("dev"), cluster("dev-2"));

    @Test
    void ambiguousFragmentListsEveryMatch() {
        PatternResolution resolution = ClusterPatternResolver.resolve(clusters, "wc");

        assertThat(resolution.resolved()).isFalse();
        assertThat(resolution.cluster()).isNull();
        assertThat(resolution.matches()).extracting(ClusterSummary::name).containsExactly("prod-wc-01", "staging-wc");
    }

    @Test
    void exactMatchWinsOverSubstringMatches() {
        PatternResolution resolution = ClusterPatternResolver.resolve(clusters, "dev");

        assertThat(resolution.resolved()).isTrue();
        assertThat(resolution.cluster().name()).isEqualTo("dev");
    }

    @Test
    void uniqueFragmentResolvesCaseInsensitively() {
        PatternResolution resolution = ClusterPatternResolver.resolve(clusters, "STAGING");

        assertThat(resolution.resolved()).isTrue();
        assertThat(resolution.cluster().name()).isEqualTo("staging-wc");
    }

    @Test
    void noMatch() {
        PatternResolution resolution = ClusterPatternResolver.resolve(clusters, "qa");

        assertThat(resolution.resolved()).isFalse();
        assertThat(resolution.matches()).isEmpty();
    }
}
