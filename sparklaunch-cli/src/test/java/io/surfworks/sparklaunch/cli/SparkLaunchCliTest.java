package io.surfworks.sparklaunch.cli;

import com.amazonaws.SdkClientException;
import io.surfworks.sparklaunch.artifact.ArtifactException;
import io.surfworks.sparklaunch.artifact.ArtifactStore;
import io.surfworks.sparklaunch.config.LaunchConfig;
import io.surfworks.sparklaunch.config.LaunchConfigLoader;
import io.surfworks.sparklaunch.monitor.ClusterMonitor;
import io.surfworks.sparklaunch.provider.ClusterProvider;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.provider.StepHandle;
import io.surfworks.sparklaunch.request.StepSpec;
import io.surfworks.sparklaunch.testing.ManualClock;
import io.surfworks.sparklaunch.testing.MockArtifactStore;
import io.surfworks.sparklaunch.testing.MockClusterProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SparkLaunchCli against the testing doubles.
 */
class SparkLaunchCliTest {

    @TempDir
    Path tempDir;

    private MockClusterProvider provider;
    private MockArtifactStore store;
    private ManualClock clock;
    private Path configFile;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws IOException {
        provider = new MockClusterProvider();
        store = new MockArtifactStore();
        clock = new ManualClock(Instant.parse("2024-03-01T12:00:00Z"));
        configFile = tempDir.resolve("launch.json");
        LaunchConfigLoader.save(LaunchConfig.builder()
                .clusterName("etl")
                .s3JarFolder("s3://mock-bucket/jars/")
                .timeout(Duration.ofMinutes(1))
                .build(), configFile);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private SparkLaunchCli cli(String stdin) {
        return cli(stdin, config -> provider, config -> store,
                p -> new ClusterMonitor(p, clock, clock::advance, ClusterMonitor.DEFAULT_POLL_INTERVAL, c -> { }));
    }

    private SparkLaunchCli cli(
            String stdin,
            Function<LaunchConfig, ClusterProvider> providers,
            Function<LaunchConfig, ArtifactStore> stores,
            Function<ClusterProvider, ClusterMonitor> monitors) {
        return new SparkLaunchCli(
                providers,
                stores,
                monitors,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)
        );
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configFile.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return cli("").run(withConfig);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // ===== General =====

    @Test
    void noArgsPrintsHelp() {
        assertEquals(0, cli("").run(new String[0]));
        assertTrue(stdout().contains("Usage: sparklaunch"));
    }

    @Test
    void versionFlag() {
        assertEquals(0, cli("").run(new String[]{"--version"}));
        assertTrue(stdout().startsWith("sparklaunch "));
    }

    @Test
    void unknownCommandFails() {
        assertEquals(1, run("deploy"));
        assertTrue(stderr().contains("Unknown command: deploy"));
    }

    @Test
    void globalOptionWithoutValueFails() {
        assertEquals(1, cli("").run(new String[]{"--cluster-id"}));
        assertTrue(stderr().contains("--cluster-id requires a value"));
    }

    @Test
    void malformedConfigFileFails() throws IOException {
        Files.writeString(configFile, "{ broken");

        assertEquals(1, run("list-clusters"));
        assertTrue(stderr().startsWith("I/O error: "));
    }

    @Test
    void providerErrorExitsWithOne() {
        provider.setFailure(new ProviderException("The security token included in the request is invalid."));

        assertEquals(1, run("list-clusters"));
        assertTrue(stderr().contains("Provider error: The security token included in the request is invalid."));
    }

    @Test
    void clientConstructionFailureReportedAsProviderError() {
        SparkLaunchCli cli = cli("", config -> {
            throw new SdkClientException("Unable to find a region via the region provider chain.");
        }, config -> store, ClusterMonitor::new);

        assertEquals(1, cli.run(new String[]{"--config", configFile.toString(), "list-clusters"}));
        assertTrue(stderr().contains("Provider error: Unable to find a region via the region provider chain."));
    }

    @Test
    void shellSurvivesClientConstructionFailure() {
        SparkLaunchCli shell = cli("list-clusters\nconfig\nexit\n", config -> {
            throw new SdkClientException("Unable to find a region via the region provider chain.");
        }, config -> store, ClusterMonitor::new);

        int exit = shell.run(new String[]{"--config", configFile.toString(), "--cluster-id", "j-1", "shell"});

        assertEquals(0, exit);
        assertTrue(stderr().contains("Provider error: Unable to find a region"));
        assertTrue(stdout().contains("Cluster Name: etl"));
        assertEquals(Optional.of("j-1"), shell.session().boundCluster());
    }

    @Test
    void providerClosedAfterCommand() {
        assertEquals(0, run("list-clusters"));
        assertTrue(provider.isClosed());
    }

    // ===== Cluster commands =====

    @Test
    void createClusterPrintsId() {
        assertEquals(0, run("create-cluster"));

        assertTrue(stdout().contains("Cluster created: j-MOCK1"));
        assertTrue(provider.getCreateRequests().get(0).instances().keepJobFlowAliveWhenNoSteps());
    }

    @Test
    void listClustersShowsActive() {
        provider.addCluster("j-1", "etl", "WAITING")
                .addCluster("j-2", "old", "TERMINATED");

        assertEquals(0, run("list-clusters"));

        assertTrue(stdout().contains("j-1"));
        assertFalse(stdout().contains("j-2"));
    }

    @Test
    void listClustersWhenNoneActive() {
        assertEquals(0, run("list-clusters"));
        assertTrue(stdout().contains("No active cluster found."));
    }

    @Test
    void bindUnknownClusterIsInformational() {
        assertEquals(0, run("bind-cluster", "j-missing"));
        assertTrue(stdout().contains("No active cluster with id j-missing."));
    }

    @Test
    void terminateUsesClusterIdOption() {
        provider.addCluster("j-1", "etl", "RUNNING");

        assertEquals(0, run("--cluster-id", "j-1", "terminate-cluster"));

        assertEquals(List.of("j-1"), provider.getTerminateRequests());
    }

    @Test
    void terminateWithoutBindingIsInformational() {
        assertEquals(0, run("terminate-cluster"));

        assertTrue(provider.getTerminateRequests().isEmpty());
        assertTrue(stdout().contains("bind-cluster"));
    }

    // ===== submit =====

    @Test
    void submitWithoutJarFails() {
        assertEquals(1, run("submit", "--class", "com.example.Main"));
        assertTrue(stderr().contains("--jar and --class are required"));
    }

    @Test
    void submitCreatesClusterWhenNoneActive() throws IOException {
        Path jar = Files.write(tempDir.resolve("job.jar"), new byte[]{42});

        int exit = run("submit", "--jar", jar.toString(), "--class", "com.example.Main", "--", "in", "--out");

        assertEquals(0, exit);
        assertEquals(1, store.getStoreOperations().size());
        assertEquals("job.jar", store.getStoreOperations().get(0).fileName());

        StepSpec step = provider.getCreateRequests().get(0).steps().get(0);
        assertEquals(List.of("spark-submit", "--deploy-mode", "cluster", "--class", "com.example.Main",
                "s3://mock-bucket/jars/job.jar", "in", "--out"), step.args());
        assertFalse(provider.getCreateRequests().get(0).instances().keepJobFlowAliveWhenNoSteps());
        assertTrue(stdout().contains("Created cluster j-MOCK1"));
    }

    @Test
    void submitAddsStepToNamedCluster() throws IOException {
        provider.addCluster("j-1", "etl", "WAITING");
        Path jar = Files.write(tempDir.resolve("job.jar"), new byte[]{42});

        assertEquals(0, run("submit", "--jar", jar.toString(), "--class", "com.example.Main"));

        assertEquals(1, provider.getAddStepsCalls().size());
        assertTrue(provider.getCreateRequests().isEmpty());
        assertTrue(stdout().contains("Added step to cluster j-1."));
    }

    @Test
    void submitUploadsJarAndClosesStore() throws IOException {
        Path jar = Files.write(tempDir.resolve("job.jar"), new byte[]{1, 2, 3});

        assertEquals(0, run("submit", "--jar", jar.toString(), "--class", "com.example.Main"));

        assertArrayEquals(new byte[]{1, 2, 3}, store.getArtifact("job.jar"));
        assertTrue(store.isClosed());
    }

    @Test
    void blankMainClassRejectedBeforeUpload() throws IOException {
        Path jar = Files.write(tempDir.resolve("job.jar"), new byte[]{42});

        assertEquals(1, run("submit", "--jar", jar.toString(), "--class", " "));

        assertTrue(stderr().contains("Error: mainClass cannot be blank"));
        assertTrue(store.getStoreOperations().isEmpty());
        assertTrue(provider.getCreateRequests().isEmpty());
    }

    @Test
    void jarNameWithSpacePassedVerbatim() throws IOException {
        Path jar = Files.write(tempDir.resolve("etl job.jar"), new byte[]{42});

        assertEquals(0, run("submit", "--jar", jar.toString(), "--class", "com.example.Main"));

        StepSpec step = provider.getCreateRequests().get(0).steps().get(0);
        assertTrue(step.args().contains("s3://mock-bucket/jars/etl job.jar"));
    }

    @Test
    void storeConstructionFailureReportedAsArtifactError() throws IOException {
        Path jar = Files.write(tempDir.resolve("job.jar"), new byte[]{42});
        SparkLaunchCli cli = cli("", config -> provider, config -> {
            throw new SdkClientException("Unable to load AWS credentials from any provider in the chain");
        }, ClusterMonitor::new);

        int exit = cli.run(new String[]{"--config", configFile.toString(),
                "submit", "--jar", jar.toString(), "--class", "com.example.Main"});

        assertEquals(1, exit);
        assertTrue(stderr().contains("Artifact error: Unable to load AWS credentials"));
        assertTrue(provider.getCreateRequests().isEmpty());
    }

    @Test
    void uploadFailureStopsSubmission() throws IOException {
        store.setStoreException(new ArtifactException("Access Denied"));
        Path jar = Files.write(tempDir.resolve("job.jar"), new byte[]{42});

        assertEquals(1, run("submit", "--jar", jar.toString(), "--class", "com.example.Main"));

        assertTrue(stderr().contains("Artifact error: Access Denied"));
        assertTrue(provider.getCreateRequests().isEmpty());
    }

    // ===== monitor =====

    @Test
    void monitorWithoutClusterIsInformational() {
        assertEquals(0, run("monitor"));
        assertTrue(stdout().contains("The cluster with name etl does not exist."));
    }

    @Test
    void monitorSuccessPrintsDots() {
        provider.addCluster("j-1", "etl", "RUNNING", "RUNNING", "TERMINATED")
                .setSteps("j-1", new StepHandle("s-1", "Spark Step", "COMPLETED"));

        assertEquals(0, run("monitor"));

        assertTrue(stdout().contains("Monitoring j-1.."));
        assertTrue(stdout().contains("Cluster terminated without error."));
    }

    @Test
    void monitorTimeoutExitsWithOne() {
        provider.addCluster("j-1", "etl", "RUNNING");

        assertEquals(1, run("monitor"));

        assertEquals(List.of("j-1"), provider.getTerminateRequests());
        assertTrue(stderr().contains("Monitor error: Timeout. Cluster terminated."));
    }

    @Test
    void cancelledMonitorLeavesClusterRunning() {
        provider.addCluster("j-1", "etl", "RUNNING");
        AtomicReference<SparkLaunchCli> holder = new AtomicReference<>();
        SparkLaunchCli cli = cli("", config -> provider, config -> store,
                p -> new ClusterMonitor(p, clock, pause -> holder.get().cancelMonitoring(Duration.ZERO),
                        ClusterMonitor.DEFAULT_POLL_INTERVAL, c -> { }));
        holder.set(cli);

        assertEquals(0, cli.run(new String[]{"--config", configFile.toString(), "monitor"}));

        assertTrue(provider.getTerminateRequests().isEmpty());
        assertTrue(stdout().contains("Monitoring cancelled, cluster left in state RUNNING."));
    }

    @Test
    void cancelWithoutRunningMonitorIsNoop() {
        SparkLaunchCli cli = cli("");

        cli.cancelMonitoring(Duration.ZERO);

        provider.addCluster("j-1", "etl", "RUNNING", "TERMINATED")
                .setSteps("j-1", new StepHandle("s-1", "Spark Step", "COMPLETED"));
        assertEquals(0, cli.run(new String[]{"--config", configFile.toString(), "monitor"}));
        assertTrue(stdout().contains("Cluster terminated without error."));
    }

    @Test
    void monitorAbnormalStepExitsWithOne() {
        provider.addCluster("j-1", "etl", "RUNNING", "TERMINATED")
                .setSteps("j-1", new StepHandle("s-1", "Spark Step", "FAILED"));

        assertEquals(1, run("monitor"));
        assertTrue(stderr().contains("abnormal step"));
    }

    // ===== config =====

    @Test
    void configSetPersistsTypedValue() throws IOException {
        assertEquals(0, run("config", "--set", "instanceCount=4"));

        assertEquals(4, LaunchConfigLoader.load(configFile).instanceCount());
        assertEquals("etl", LaunchConfigLoader.load(configFile).clusterName());
    }

    @Test
    void configSetPlainWord() throws IOException {
        assertEquals(0, run("config", "--set", "clusterName=nightly"));

        assertEquals("nightly", LaunchConfigLoader.load(configFile).clusterName());
    }

    @Test
    void configSetList() throws IOException {
        assertEquals(0, run("config", "--set", "securityGroupIds=sg-1, sg-2"));

        assertEquals(List.of("sg-1", "sg-2"), LaunchConfigLoader.load(configFile).securityGroupIds());
    }

    @Test
    void configSetSubMinuteTimeout() throws IOException {
        assertEquals(0, run("config", "--set", "timeout=PT30S"));

        assertEquals(Duration.ofSeconds(30), LaunchConfigLoader.load(configFile).timeout());
        assertTrue(stdout().contains("Timeout: 30 seconds"));
        assertEquals(0, run("list-clusters"));
    }

    @Test
    void configSetUnknownKeyFails() {
        assertEquals(1, run("config", "--set", "scheduler=ray"));
        assertTrue(stderr().contains("Unknown config key: scheduler"));
    }

    @Test
    void configSetInvalidValueFails() {
        assertEquals(1, run("config", "--set", "instanceCount=0"));
        assertTrue(stderr().startsWith("Error: "));
    }

    @Test
    void configShow() {
        assertEquals(0, run("config", "--show"));
        assertTrue(stdout().contains("Cluster Name: etl"));
        assertTrue(stdout().contains("Timeout: 1 minutes"));
    }

    // ===== shell =====

    @Test
    void shellKeepsBoundClusterBetweenCommands() {
        provider.addCluster("j-1", "etl", "WAITING");
        SparkLaunchCli shell = cli("bind-cluster j-1\nterminate-cluster\nexit\n");

        int exit = shell.run(new String[]{"--config", configFile.toString(), "shell"});

        assertEquals(0, exit);
        assertEquals(List.of("j-1"), provider.getTerminateRequests());
        assertTrue(stdout().contains("[j-1]> "));
        assertEquals(Optional.empty(), shell.session().boundCluster());
    }

    @Test
    void shellReportsErrorsAndContinues() {
        provider.addCluster("j-1", "etl", "WAITING");
        SparkLaunchCli shell = cli("config --set instanceCount=0\nbind-cluster j-1\n");

        int exit = shell.run(new String[]{"--config", configFile.toString(), "shell"});

        assertEquals(0, exit);
        assertTrue(stderr().contains("Error: "));
        assertEquals(Optional.of("j-1"), shell.session().boundCluster());
    }
}
