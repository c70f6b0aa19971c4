package io.surfworks.sparklaunch.cli;

import com.amazonaws.AmazonClientException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.surfworks.sparklaunch.artifact.ArtifactException;
import io.surfworks.sparklaunch.artifact.ArtifactStore;
import io.surfworks.sparklaunch.artifact.s3.S3ArtifactStore;
import io.surfworks.sparklaunch.cluster.ClusterLifecycle;
import io.surfworks.sparklaunch.cluster.LaunchSession;
import io.surfworks.sparklaunch.config.LaunchConfig;
import io.surfworks.sparklaunch.config.LaunchConfigLoader;
import io.surfworks.sparklaunch.job.JobSubmitter;
import io.surfworks.sparklaunch.job.SparkSubmitCommand;
import io.surfworks.sparklaunch.job.SubmitResult;
import io.surfworks.sparklaunch.monitor.CancellationToken;
import io.surfworks.sparklaunch.monitor.ClusterMonitor;
import io.surfworks.sparklaunch.monitor.MonitorException;
import io.surfworks.sparklaunch.monitor.MonitorResult;
import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ClusterProvider;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.provider.emr.EmrClusterProvider;
import io.surfworks.sparklaunch.request.ClusterCreationSpec;
import io.surfworks.sparklaunch.request.ConfigBuilder;
import io.surfworks.sparklaunch.request.StepSpec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * SparkLaunch CLI - Spark job submission to EMR clusters.
 *
 * <p>Commands:
 * <ul>
 *   <li>create-cluster - Create a long-lived cluster and bind to it</li>
 *   <li>bind-cluster - Bind to an active cluster</li>
 *   <li>terminate-cluster - Terminate the bound cluster</li>
 *   <li>list-clusters - List active clusters</li>
 *   <li>submit - Upload a jar and run it as a Spark step</li>
 *   <li>monitor - Wait for a cluster to finish</li>
 *   <li>config - Show/set configuration</li>
 *   <li>shell - Interactive session keeping the bound cluster</li>
 * </ul>
 */
public class SparkLaunchCli {

    private static final String VERSION = "0.1.0";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final Set<String> SETTABLE_KEYS = Set.of(
            "clusterName", "awsRegion", "emrRelease", "emrServiceRole", "emrApplications",
            "subnetId", "securityGroupIds", "instanceCount", "instanceType", "instanceBidPrice",
            "instanceRole", "instanceKeyName", "s3JarFolder", "s3LogUri",
            "s3ServerSideEncryption", "timeout", "timeoutMinutes"
    );
    private static final Duration SHUTDOWN_GRACE = ClusterMonitor.DEFAULT_POLL_INTERVAL.multipliedBy(2);

    private final Function<LaunchConfig, ClusterProvider> providerFactory;
    private final Function<LaunchConfig, ArtifactStore> storeFactory;
    private final Function<ClusterProvider, ClusterMonitor> monitorFactory;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final AtomicReference<ActiveMonitor> activeMonitor = new AtomicReference<>();

    private Path configPath = LaunchConfig.configFile();
    private LaunchConfig config;
    private LaunchSession session = LaunchSession.empty();

    public SparkLaunchCli(
            Function<LaunchConfig, ClusterProvider> providerFactory,
            Function<LaunchConfig, ArtifactStore> storeFactory,
            Function<ClusterProvider, ClusterMonitor> monitorFactory,
            InputStream in,
            PrintStream out,
            PrintStream err
    ) {
        this.providerFactory = providerFactory;
        this.storeFactory = storeFactory;
        this.monitorFactory = monitorFactory;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        SparkLaunchCli cli = new SparkLaunchCli(
                config -> EmrClusterProvider.forRegion(config.awsRegion()),
                S3ArtifactStore::forConfig,
                ClusterMonitor::new,
                System.in,
                System.out,
                System.err
        );
        Runtime.getRuntime().addShutdownHook(
                new Thread(() -> cli.cancelMonitoring(SHUTDOWN_GRACE), "sparklaunch-shutdown"));
        int exitCode = cli.run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one invocation and returns the process exit code.
     */
    public int run(String[] args) {
        List<String> remaining = new ArrayList<>(Arrays.asList(args));

        try {
            parseGlobalOptions(remaining);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (remaining.isEmpty()) {
            printHelp();
            return 0;
        }

        String command = remaining.remove(0);

        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return 0;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("sparklaunch " + VERSION);
            return 0;
        }

        try {
            config = LaunchConfigLoader.load(configPath);
            if (command.equals("shell")) {
                return runShell();
            }
            return dispatch(command, remaining.toArray(new String[0]));
        } catch (ProviderException e) {
            err.println("Provider error: " + e.getMessage());
            return 1;
        } catch (ArtifactException e) {
            err.println("Artifact error: " + e.getMessage());
            return 1;
        } catch (MonitorException e) {
            err.println("Monitor error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Returns the session as left by the last command.
     */
    public LaunchSession session() {
        return session;
    }

    /**
     * Cancels a running {@code monitor} command, leaving its cluster as it is,
     * and waits up to {@code grace} for the command to report.
     *
     * <p>Does nothing when no monitor is running. Called from the shutdown hook on Ctrl-C.
     */
    public void cancelMonitoring(Duration grace) {
        ActiveMonitor running = activeMonitor.get();
        if (running == null) {
            return;
        }
        running.token().cancel();
        try {
            running.done().await(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void parseGlobalOptions(List<String> args) {
        while (!args.isEmpty()) {
            String option = args.get(0);
            if (!option.equals("--config") && !option.equals("--cluster-id")) {
                return;
            }
            if (args.size() < 2) {
                throw new IllegalArgumentException(option + " requires a value");
            }
            String value = args.get(1);
            args.subList(0, 2).clear();
            if (option.equals("--config")) {
                configPath = Path.of(value);
            } else {
                session = session.bind(value);
            }
        }
    }

    private int dispatch(String command, String[] args)
            throws ProviderException, ArtifactException, MonitorException, IOException {
        switch (command) {
            case "create-cluster" -> handleCreateCluster(args);
            case "bind-cluster" -> {
                return handleBindCluster(args);
            }
            case "terminate-cluster" -> handleTerminateCluster(args);
            case "list-clusters" -> handleListClusters(args);
            case "submit" -> {
                return handleSubmit(args);
            }
            case "monitor" -> handleMonitor(args);
            case "config" -> {
                return handleConfig(args);
            }
            default -> {
                err.println("Unknown command: " + command);
                err.println("Run 'sparklaunch --help' for usage.");
                return 1;
            }
        }
        return 0;
    }

    private void handleCreateCluster(String[] args) throws ProviderException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: sparklaunch create-cluster");
            out.println("Creates a long-lived cluster from the configuration and binds to it.");
            return;
        }

        try (ClusterProvider provider = openProvider()) {
            session = lifecycle(provider).createCluster(session);
        }
        out.println("Cluster created: " + session.boundCluster().orElse("-"));
    }

    private int handleBindCluster(String[] args) throws ProviderException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            out.println("Usage: sparklaunch bind-cluster <cluster-id>");
            return args.length == 0 ? 1 : 0;
        }

        String clusterId = args[0];
        try (ClusterProvider provider = openProvider()) {
            session = lifecycle(provider).bindCluster(session, clusterId);
        }
        if (session.boundCluster().filter(clusterId::equals).isPresent()) {
            out.println("Bound to cluster " + clusterId + ".");
        } else {
            out.println("No active cluster with id " + clusterId + ".");
        }
        return 0;
    }

    private void handleTerminateCluster(String[] args) throws ProviderException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: sparklaunch [--cluster-id <id>] terminate-cluster");
            return;
        }

        Optional<String> bound = session.boundCluster();
        try (ClusterProvider provider = openProvider()) {
            session = lifecycle(provider).terminateCluster(session);
        }
        if (bound.isEmpty()) {
            out.println("No cluster is bound, please specify the cluster you want to terminate using bind-cluster first.");
        } else {
            out.println("Cluster " + bound.get() + " is terminating.");
        }
    }

    private void handleListClusters(String[] args) throws ProviderException, IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: sparklaunch list-clusters [--json]");
            return;
        }

        boolean json = hasFlag(args, "--json");
        Collection<ClusterHandle> clusters;
        try (ClusterProvider provider = openProvider()) {
            clusters = lifecycle(provider).listClusters();
        }

        if (json) {
            out.println(JSON.writeValueAsString(clusters));
        } else if (clusters.isEmpty()) {
            out.println("No active cluster found.");
        } else {
            out.println("Active clusters (" + clusters.size() + "):");
            out.println("-".repeat(60));
            for (ClusterHandle cluster : clusters) {
                out.printf("  %-20s  %-14s  %s%n", cluster.id(), cluster.status(), cluster.name());
            }
        }
    }

    private int handleSubmit(String[] args) throws ProviderException, ArtifactException {
        int separator = Arrays.asList(args).indexOf("--");
        String[] options = separator >= 0 ? Arrays.copyOfRange(args, 0, separator) : args;
        List<String> jobArgs = separator >= 0
                ? List.of(Arrays.copyOfRange(args, separator + 1, args.length))
                : List.of();

        if (hasFlag(options, "--help")) {
            printSubmitHelp();
            return 0;
        }

        String jar = getFlagValue(options, "--jar");
        String mainClass = getFlagValue(options, "--class");
        if (jar == null || mainClass == null) {
            err.println("Error: --jar and --class are required");
            printSubmitHelp();
            return 1;
        }

        Path jarPath = Path.of(jar);
        String fileName = jarPath.getFileName().toString();
        ClusterCreationSpec template = template();

        // Step is built, and validated, before the jar is uploaded
        SubmitResult result;
        try (ArtifactStore store = openStore(); ClusterProvider provider = openProvider()) {
            StepSpec step = SparkSubmitCommand.step(mainClass, jobArgs, config.submitConfs(), store.locate(fileName));
            store.store(jarPath, fileName);
            result = new JobSubmitter(provider, template).submit(config.clusterName(), step);
        }

        if (result.createdCluster()) {
            out.println("Created cluster " + result.clusterId() + " running " + mainClass + ".");
        } else {
            out.println("Added step to cluster " + result.clusterId() + ".");
        }
        return 0;
    }

    private void handleMonitor(String[] args) throws ProviderException, MonitorException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: sparklaunch [--cluster-id <id>] monitor");
            out.println("Waits for the bound cluster, or the cluster named in the configuration, to finish.");
            out.println("The cluster is terminated after the configured timeout.");
            return;
        }

        try (ClusterProvider provider = openProvider()) {
            Optional<String> target = lifecycle(provider).findMonitorTarget(session, config.clusterName());
            if (target.isEmpty()) {
                out.println("The cluster with name " + config.clusterName() + " does not exist.");
                return;
            }

            ActiveMonitor running = new ActiveMonitor(new CancellationToken(), new CountDownLatch(1));
            activeMonitor.set(running);
            try {
                out.print("Monitoring " + target.get());
                MonitorResult result = monitorFactory.apply(provider)
                        .withTickListener(cluster -> {
                            out.print(".");
                            out.flush();
                        })
                        .monitor(target.get(), config.timeout(), running.token());
                out.println();
                out.println(result.orThrow().message());
            } finally {
                activeMonitor.set(null);
                running.done().countDown();
            }
        }
    }

    private int handleConfig(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: sparklaunch config [--show] [--set <key>=<value>] [--json]");
            out.println();
            out.println("Options:");
            out.println("  --show         Show current configuration");
            out.println("  --set          Set a configuration value");
            out.println("  --json         Output as JSON");
            out.println();
            out.println("Config keys:");
            out.println("  clusterName, awsRegion, emrRelease, emrServiceRole, emrApplications,");
            out.println("  subnetId, securityGroupIds, instanceCount, instanceType, instanceBidPrice,");
            out.println("  instanceRole, instanceKeyName, s3JarFolder, s3LogUri,");
            out.println("  s3ServerSideEncryption, timeout (ISO-8601, e.g. PT90M), timeoutMinutes");
            return 0;
        }

        boolean json = hasFlag(args, "--json");
        String setValue = getFlagValue(args, "--set");

        if (setValue != null) {
            String[] parts = setValue.split("=", 2);
            if (parts.length != 2) {
                err.println("Invalid format. Use --set key=value");
                return 1;
            }
            if (!SETTABLE_KEYS.contains(parts[0])) {
                err.println("Unknown config key: " + parts[0]);
                return 1;
            }
            ObjectNode patch = JSON.createObjectNode();
            patch.set(parts[0], configValue(parts[0], parts[1]));
            config = LaunchConfigLoader.fromJson(patch, config);
            LaunchConfigLoader.save(config, configPath);
            out.println("Configuration updated.");
        }

        if (json) {
            out.println(JSON.writeValueAsString(LaunchConfigLoader.toJson(config)));
        } else {
            out.println("Configuration:");
            out.println("-".repeat(40));
            out.println("Cluster Name: " + config.clusterName());
            out.println("Region: " + orNotSet(config.awsRegion()));
            out.println("EMR Release: " + config.emrRelease());
            out.println("Applications: " + String.join(", ", config.emrApplications()));
            out.println("Instances: " + config.instanceCount() + " x " + config.instanceType()
                    + (config.instanceBidPrice() != null ? " (spot, bid " + config.instanceBidPrice() + ")" : ""));
            out.println("Subnet: " + orNotSet(config.subnetId()));
            out.println("Jar Folder: " + orNotSet(config.s3JarFolder()));
            out.println("Log URI: " + orNotSet(config.s3LogUri()));
            out.println("Timeout: " + formatTimeout(config.timeout()));
        }
        return 0;
    }

    private int runShell() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println("sparklaunch " + VERSION + " shell. Type 'help' for commands, 'exit' to quit.");

        while (true) {
            out.print(session.boundCluster().map(id -> "[" + id + "]> ").orElse("> "));
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                out.println();
                return 0;
            }
            String[] words = line.trim().split("\\s+");
            if (words[0].isEmpty()) {
                continue;
            }
            String command = words[0];
            if (command.equals("exit") || command.equals("quit")) {
                return 0;
            }
            if (command.equals("help")) {
                printHelp();
                continue;
            }

            String[] commandArgs = Arrays.copyOfRange(words, 1, words.length);
            try {
                dispatch(command, commandArgs);
            } catch (ProviderException e) {
                err.println("Provider error: " + e.getMessage());
            } catch (ArtifactException e) {
                err.println("Artifact error: " + e.getMessage());
            } catch (MonitorException e) {
                err.println("Monitor error: " + e.getMessage());
            } catch (IOException e) {
                err.println("I/O error: " + e.getMessage());
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
            }
        }
    }

    // ===== Helper methods =====

    private ClusterCreationSpec template() {
        return ConfigBuilder.fromConfig(config);
    }

    private ClusterLifecycle lifecycle(ClusterProvider provider) {
        return new ClusterLifecycle(provider, template());
    }

    private static JsonNode configValue(String key, String raw) {
        if (key.equals("emrApplications") || key.equals("securityGroupIds")) {
            ArrayNode values = JSON.createArrayNode();
            for (String value : raw.split(",")) {
                if (!value.isBlank()) {
                    values.add(value.trim());
                }
            }
            return values;
        }
        try {
            JsonNode parsed = JSON.readTree(raw);
            return parsed != null && parsed.isValueNode() ? parsed : TextNode.valueOf(raw);
        } catch (JsonProcessingException e) {
            // Plain words such as a cluster name are not JSON literals
            return TextNode.valueOf(raw);
        }
    }

    /**
     * Opens the provider, reporting SDK client construction failures (no region, no credentials)
     * as provider errors.
     */
    private ClusterProvider openProvider() throws ProviderException {
        try {
            return providerFactory.apply(config);
        } catch (AmazonClientException e) {
            throw new ProviderException(e.getMessage(), e);
        }
    }

    private ArtifactStore openStore() throws ArtifactException {
        try {
            return storeFactory.apply(config);
        } catch (AmazonClientException e) {
            throw new ArtifactException(e.getMessage(), e);
        }
    }

    private static String formatTimeout(Duration timeout) {
        if (timeout.toSecondsPart() == 0 && timeout.toNanosPart() == 0) {
            return timeout.toMinutes() + " minutes";
        }
        return timeout.toSeconds() + " seconds";
    }

    private static String orNotSet(String value) {
        return value != null ? value : "(not set)";
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    private record ActiveMonitor(CancellationToken token, CountDownLatch done) {}

    // ===== Help output =====

    private void printHelp() {
        out.println("SparkLaunch CLI - Spark job submission to EMR clusters");
        out.println();
        out.println("Usage: sparklaunch [--config <file>] [--cluster-id <id>] <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  create-cluster     Create a long-lived cluster and bind to it");
        out.println("  bind-cluster       Bind to an active cluster");
        out.println("  terminate-cluster  Terminate the bound cluster");
        out.println("  list-clusters      List active clusters");
        out.println("  submit             Upload a jar and run it as a Spark step");
        out.println("  monitor            Wait for a cluster to finish");
        out.println("  config             Show/set configuration");
        out.println("  shell              Interactive session keeping the bound cluster");
        out.println();
        out.println("Options:");
        out.println("  --config <file>    Config file (default: ~/.config/sparklaunch/launch.json)");
        out.println("  --cluster-id <id>  Start with this cluster bound");
        out.println("  -h, --help         Show help for a command");
        out.println("  -v, --version      Show version");
        out.println();
        out.println("Examples:");
        out.println("  sparklaunch submit --jar target/job.jar --class com.example.Main -- input output");
        out.println("  sparklaunch monitor");
        out.println("  sparklaunch --cluster-id j-2AXXXXXXGAPLF terminate-cluster");
    }

    private void printSubmitHelp() {
        out.println("Usage: sparklaunch submit --jar <path> --class <main> [-- args...]");
        out.println();
        out.println("Uploads the jar to the configured S3 folder and runs it with spark-submit.");
        out.println("The step is added to the active cluster with the configured name; if there");
        out.println("is none, a cluster is created that terminates once the step is done.");
        out.println();
        out.println("Required:");
        out.println("  --jar <path>       Built application jar");
        out.println("  --class <name>     Main class");
    }
}
