package io.surfworks.sparklaunch.request;

import java.util.List;
import java.util.Objects;

/**
 * A unit of work to run on a cluster: a jar invoked with an argument vector.
 *
 * @param name            step name shown by the provider
 * @param actionOnFailure what the cluster does if the step fails
 * @param jar             jar to run ("command-runner.jar" for shell commands)
 * @param args            arguments passed to the jar
 */
public record StepSpec(
        String name,
        ActionOnFailure actionOnFailure,
        String jar,
        List<String> args
) {

    /** Runner that executes its arguments as a command on the master node */
    public static final String COMMAND_RUNNER = "command-runner.jar";

    public StepSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(actionOnFailure, "actionOnFailure cannot be null");
        Objects.requireNonNull(jar, "jar cannot be null");
        Objects.requireNonNull(args, "args cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }

        args = List.copyOf(args);
    }

    /**
     * Creates a command-runner step that keeps the cluster alive when it fails.
     */
    public static StepSpec command(String name, List<String> command) {
        return new StepSpec(name, ActionOnFailure.CONTINUE, COMMAND_RUNNER, command);
    }
}
