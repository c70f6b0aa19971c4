package io.surfworks.sparklaunch.job;

import io.surfworks.sparklaunch.request.StepSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the spark-submit invocation run by a cluster step.
 *
 * <p>Argument order: fixed flags, one {@code --conf key=value} pair per entry
 * (in the map's iteration order), the artifact location, then the job's own
 * arguments.
 */
public final class SparkSubmitCommand {

    /** Name of every step created by sparklaunch */
    public static final String STEP_NAME = "Spark Step";

    private SparkSubmitCommand() {
    }

    /**
     * Returns the full argument vector, starting with "spark-submit".
     */
    public static List<String> args(
            String mainClass,
            List<String> jobArgs,
            Map<String, String> submitConfs,
            String artifactLocation) {
        Objects.requireNonNull(mainClass, "mainClass cannot be null");
        Objects.requireNonNull(artifactLocation, "artifactLocation cannot be null");
        if (mainClass.isBlank()) {
            throw new IllegalArgumentException("mainClass cannot be blank");
        }

        List<String> command = new ArrayList<>();
        command.add("spark-submit");
        command.add("--deploy-mode");
        command.add("cluster");
        command.add("--class");
        command.add(mainClass);
        if (submitConfs != null) {
            for (Map.Entry<String, String> conf : submitConfs.entrySet()) {
                command.add("--conf");
                command.add(conf.getKey() + "=" + conf.getValue());
            }
        }
        command.add(artifactLocation);
        if (jobArgs != null) {
            command.addAll(jobArgs);
        }
        return command;
    }

    /**
     * Wraps the spark-submit invocation in a command-runner step.
     */
    public static StepSpec step(
            String mainClass,
            List<String> jobArgs,
            Map<String, String> submitConfs,
            String artifactLocation) {
        return StepSpec.command(STEP_NAME, args(mainClass, jobArgs, submitConfs, artifactLocation));
    }
}
