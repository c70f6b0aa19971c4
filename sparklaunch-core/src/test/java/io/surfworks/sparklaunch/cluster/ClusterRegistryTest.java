package io.surfworks.sparklaunch.cluster;

import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.testing.MockClusterProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClusterRegistry.
 */
class ClusterRegistryTest {

    private MockClusterProvider provider;
    private ClusterRegistry registry;

    @BeforeEach
    void setUp() {
        provider = new MockClusterProvider();
        registry = new ClusterRegistry(provider);
    }

    @Test
    void listActiveKeepsOnlyActivatedClusters() throws ProviderException {
        provider.addCluster("j-1", "etl", "RUNNING")
                .addCluster("j-2", "etl", "TERMINATED")
                .addCluster("j-3", "adhoc", "BOOTSTRAPPING")
                .addCluster("j-4", "old", "TERMINATED_WITH_ERRORS");

        Map<String, ClusterHandle> active = registry.listActive();

        assertEquals(List.of("j-1", "j-3"), List.copyOf(active.keySet()));
    }

    @Test
    void listActiveEmptyWhenNothingRuns() throws ProviderException {
        assertTrue(registry.listActive().isEmpty());
    }

    @Test
    void findByNameIgnoresTerminatedClusterWithSameName() throws ProviderException {
        provider.addCluster("j-1", "etl", "TERMINATED");

        assertEquals(Optional.empty(), registry.findByName("etl"));
    }

    @Test
    void findByNameReturnsActiveMatch() throws ProviderException {
        provider.addCluster("j-1", "etl", "TERMINATED")
                .addCluster("j-2", "etl", "WAITING");

        Optional<ClusterHandle> found = registry.findByName("etl");

        assertTrue(found.isPresent());
        assertEquals("j-2", found.get().id());
        assertTrue(found.get().isActive());
    }

    @Test
    void findByNameTakesFirstOfDuplicates() throws ProviderException {
        provider.addCluster("j-1", "etl", "RUNNING")
                .addCluster("j-2", "etl", "STARTING");

        assertEquals("j-1", registry.findByName("etl").orElseThrow().id());
    }

    @Test
    void findByNameIsExactMatch() throws ProviderException {
        provider.addCluster("j-1", "etl-nightly", "RUNNING");

        assertTrue(registry.findByName("etl").isEmpty());
    }

    @Test
    void listActiveDropsInactiveClustersReturnedDespiteFilter() throws ProviderException {
        provider.setIgnoreStateFilter(true)
                .addCluster("j-1", "etl", "TERMINATING")
                .addCluster("j-2", "etl", "WAITING")
                .addCluster("j-3", "etl", "TERMINATED");

        assertEquals(3, provider.listClusters(Set.of("RUNNING")).size());
        assertEquals(List.of("j-2"), List.copyOf(registry.listActive().keySet()));
    }

    @Test
    void findByNameSkipsInactiveClusterReturnedDespiteFilter() throws ProviderException {
        provider.setIgnoreStateFilter(true)
                .addCluster("j-1", "etl", "TERMINATED_WITH_ERRORS")
                .addCluster("j-2", "etl", "RUNNING");

        assertEquals("j-2", registry.findByName("etl").orElseThrow().id());
    }

    @Test
    void findByNameEmptyWhenProviderReturnsOnlyInactiveClusters() throws ProviderException {
        provider.setIgnoreStateFilter(true)
                .addCluster("j-1", "etl", "TERMINATED");

        assertTrue(registry.findByName("etl").isEmpty());
    }

    @Test
    void providerFailurePropagates() {
        provider.setFailure(new ProviderException("throttled"));

        ProviderException e = assertThrows(ProviderException.class, () -> registry.listActive());
        assertEquals("throttled", e.getMessage());
    }
}
