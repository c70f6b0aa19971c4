package io.surfworks.sparklaunch.cluster;

import io.surfworks.sparklaunch.config.LaunchConfig;
import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.request.ClusterCreationSpec;
import io.surfworks.sparklaunch.request.ConfigBuilder;
import io.surfworks.sparklaunch.testing.MockClusterProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClusterLifecycle and LaunchSession.
 */
class ClusterLifecycleTest {

    private MockClusterProvider provider;
    private ClusterLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        provider = new MockClusterProvider();
        ClusterCreationSpec template = ConfigBuilder.fromConfig(LaunchConfig.defaults().withClusterName("etl"));
        lifecycle = new ClusterLifecycle(provider, template);
    }

    // ===== LaunchSession =====

    @Test
    void blankIdMeansUnbound() {
        assertFalse(new LaunchSession(" ").isBound());
        assertFalse(LaunchSession.empty().isBound());
        assertEquals(Optional.of("j-1"), LaunchSession.empty().bind("j-1").boundCluster());
        assertFalse(LaunchSession.empty().bind("j-1").unbind().isBound());
    }

    // ===== create =====

    @Test
    void createClusterBindsNewCluster() throws ProviderException {
        LaunchSession session = lifecycle.createCluster(LaunchSession.empty());

        assertEquals(Optional.of("j-MOCK1"), session.boundCluster());
        assertEquals(1, provider.getCreateRequests().size());
        ClusterCreationSpec request = provider.getCreateRequests().get(0);
        assertEquals("etl", request.name());
        assertTrue(request.instances().keepJobFlowAliveWhenNoSteps());
        assertTrue(request.steps().isEmpty());
    }

    // ===== bind =====

    @Test
    void bindClusterAcceptsActiveId() throws ProviderException {
        provider.addCluster("j-1", "etl", "WAITING");

        LaunchSession session = lifecycle.bindCluster(LaunchSession.empty(), "j-1");

        assertEquals(Optional.of("j-1"), session.boundCluster());
    }

    @Test
    void bindClusterKeepsSessionForUnknownId() throws ProviderException {
        LaunchSession before = LaunchSession.empty().bind("j-old");

        LaunchSession after = lifecycle.bindCluster(before, "j-missing");

        assertSame(before, after);
    }

    @Test
    void bindClusterRejectsTerminatedCluster() throws ProviderException {
        provider.addCluster("j-1", "etl", "TERMINATED");

        assertFalse(lifecycle.bindCluster(LaunchSession.empty(), "j-1").isBound());
    }

    // ===== terminate =====

    @Test
    void terminateWithoutBindingDoesNothing() throws ProviderException {
        LaunchSession session = lifecycle.terminateCluster(LaunchSession.empty());

        assertFalse(session.isBound());
        assertTrue(provider.getTerminateRequests().isEmpty());
    }

    @Test
    void terminateBoundClusterUnbinds() throws ProviderException {
        provider.addCluster("j-1", "etl", "RUNNING");

        LaunchSession session = lifecycle.terminateCluster(LaunchSession.empty().bind("j-1"));

        assertFalse(session.isBound());
        assertEquals(List.of("j-1"), provider.getTerminateRequests());
    }

    // ===== list =====

    @Test
    void listClustersReturnsActiveOnly() throws ProviderException {
        provider.addCluster("j-1", "etl", "RUNNING")
                .addCluster("j-2", "old", "TERMINATED");

        Collection<ClusterHandle> clusters = lifecycle.listClusters();

        assertEquals(1, clusters.size());
        assertEquals("j-1", clusters.iterator().next().id());
    }

    @Test
    void listClustersEmpty() throws ProviderException {
        assertTrue(lifecycle.listClusters().isEmpty());
    }

    // ===== monitor target =====

    @Test
    void monitorTargetPrefersBoundCluster() throws ProviderException {
        provider.addCluster("j-1", "etl", "RUNNING");

        Optional<String> target = lifecycle.findMonitorTarget(LaunchSession.empty().bind("j-9"), "etl");

        assertEquals(Optional.of("j-9"), target);
    }

    @Test
    void monitorTargetFallsBackToName() throws ProviderException {
        provider.addCluster("j-1", "etl", "RUNNING");

        assertEquals(Optional.of("j-1"), lifecycle.findMonitorTarget(LaunchSession.empty(), "etl"));
    }

    @Test
    void monitorTargetAbsentWhenNoActiveCluster() throws ProviderException {
        provider.addCluster("j-1", "etl", "TERMINATED");

        assertTrue(lifecycle.findMonitorTarget(LaunchSession.empty(), "etl").isEmpty());
    }
}
